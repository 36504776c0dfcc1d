package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.AssetResult;
import com.imageinsight.describer.dto.FieldAggregate;
import com.imageinsight.describer.dto.ItemResult;
import com.imageinsight.describer.entity.DescriptionField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps asset names returned by the vision API back to the ids that were sent.
 *
 * <p>The API stores uploads under a temp path and replaces ':' with '_', so
 * {@code "1:2504"} can come back as {@code "/tmp/files20260214-1-ei7mrm/1_2504"}.
 * Names are matched by trying each {@link MatchStrategy} in order; assets that
 * match nothing are dropped and counted.</p>
 */
@Component
@Slf4j
public class AssetNameReconciler {

    /**
     * Matching strategies, tried in declaration order. Do not add fuzzy rules here:
     * the remote naming scheme is undocumented.
     */
    enum MatchStrategy {
        EXACT {
            @Override
            Optional<String> match(String returnedName, IdIndex index) {
                return index.ids.contains(returnedName) ? Optional.of(returnedName) : Optional.empty();
            }
        },
        PATH_BASENAME {
            @Override
            Optional<String> match(String returnedName, IdIndex index) {
                String basename = returnedName.substring(returnedName.lastIndexOf('/') + 1);
                return Optional.ofNullable(index.byPlaceholderName.get(basename));
            }
        };

        abstract Optional<String> match(String returnedName, IdIndex index);
    }

    static final char ID_SEPARATOR = ':';
    static final char PLACEHOLDER = '_';

    public Reconciliation reconcile(List<String> itemIds, Collection<FieldAggregate> aggregates, String defaultBackend) {
        IdIndex index = new IdIndex(itemIds);
        Map<String, List<ItemResult.FieldText>> byItem = new LinkedHashMap<>();
        itemIds.forEach(id -> byItem.put(id, new ArrayList<>()));
        Set<DescriptionField> fieldsWithText = EnumSet.noneOf(DescriptionField.class);
        int unattributed = 0;

        for (FieldAggregate aggregate : aggregates) {
            DescriptionField field = aggregate.field();
            for (AssetResult asset : aggregate.assets()) {
                Optional<String> itemId = resolve(asset.returnedName(), index);
                if (itemId.isEmpty()) {
                    unattributed++;
                    log.debug("Asset '{}' for {} matches no image id", asset.returnedName(), field);
                    continue;
                }
                if (asset.descriptions().isEmpty()) {
                    continue;
                }

                AssetResult.Description first = asset.descriptions().get(0);
                if (first.text() == null || first.text().isBlank()) {
                    continue;
                }

                List<ItemResult.FieldText> texts = byItem.get(itemId.get());
                if (texts.stream().anyMatch(t -> t.field() == field)) {
                    log.debug("Ignoring extra {} text for {}", field, itemId.get());
                    continue;
                }

                String backend = first.sourceBackend() != null && !first.sourceBackend().isBlank()
                        ? first.sourceBackend()
                        : defaultBackend;
                texts.add(new ItemResult.FieldText(field, first.text(), backend));
                fieldsWithText.add(field);
            }
        }

        if (unattributed > 0) {
            log.warn("{} asset(s) could not be matched to an image and were dropped", unattributed);
        }

        List<ItemResult> results = byItem.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> new ItemResult(e.getKey(), e.getValue()))
                .toList();
        return new Reconciliation(results, fieldsWithText, unattributed);
    }

    /**
     * Resolve one returned asset name to a known item id.
     */
    public Optional<String> resolve(String returnedName, List<String> itemIds) {
        return resolve(returnedName, new IdIndex(itemIds));
    }

    private Optional<String> resolve(String returnedName, IdIndex index) {
        if (returnedName == null || returnedName.isEmpty()) {
            return Optional.empty();
        }
        for (MatchStrategy strategy : MatchStrategy.values()) {
            Optional<String> match = strategy.match(returnedName, index);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public record Reconciliation(List<ItemResult> results, Set<DescriptionField> fieldsWithText, int unattributed) {
    }

    static final class IdIndex {
        private final Set<String> ids;
        private final Map<String, String> byPlaceholderName = new LinkedHashMap<>();

        IdIndex(List<String> itemIds) {
            this.ids = new LinkedHashSet<>(itemIds);
            // first id wins when two ids collapse to the same name
            for (String id : itemIds) {
                byPlaceholderName.putIfAbsent(id.replace(ID_SEPARATOR, PLACEHOLDER), id);
            }
        }
    }
}
