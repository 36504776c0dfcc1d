package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.ChunkResult;
import com.imageinsight.describer.dto.FieldAggregate;
import com.imageinsight.describer.entity.DescriptionField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines chunk-level results into one {@link FieldAggregate} per field.
 *
 * <p>Within a field, assets and errors are concatenated in chunk-index order
 * regardless of the order the chunks finished in. A field with no successful
 * chunk gets no aggregate.</p>
 */
@Service
@Slf4j
public class ResultMergeService {

    /**
     * @param fields requested fields; the returned map iterates in this order
     */
    public Map<DescriptionField, FieldAggregate> merge(List<ChunkResult> chunkResults, List<DescriptionField> fields) {
        Set<String> seen = new HashSet<>();
        for (ChunkResult result : chunkResults) {
            if (!seen.add(result.field() + "#" + result.chunkIndex())) {
                throw new IllegalArgumentException(
                        "Duplicate result for " + result.field() + " chunk " + result.chunkIndex());
            }
        }

        Map<DescriptionField, FieldAggregate> merged = new LinkedHashMap<>();
        for (DescriptionField field : fields) {
            List<ChunkResult> forField = chunkResults.stream()
                    .filter(cr -> cr.field() == field)
                    .sorted(Comparator.comparingInt(ChunkResult::chunkIndex))
                    .toList();
            if (forField.isEmpty()) {
                log.debug("No successful chunks for {}", field);
                continue;
            }

            FieldAggregate aggregate = FieldAggregate.empty(field);
            for (ChunkResult chunkResult : forField) {
                aggregate = aggregate.append(chunkResult.toAggregate());
            }
            merged.put(field, aggregate);
            log.debug("Merged {} chunk(s) for {}: {} asset(s), {} error(s)",
                    forField.size(), field, aggregate.assets().size(), aggregate.errors().size());
        }
        return merged;
    }
}
