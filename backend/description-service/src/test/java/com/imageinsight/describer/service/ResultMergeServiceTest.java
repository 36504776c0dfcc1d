package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.AssetResult;
import com.imageinsight.describer.dto.ChunkResult;
import com.imageinsight.describer.dto.FieldAggregate;
import com.imageinsight.describer.entity.DescriptionField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultMergeServiceTest {

    private final ResultMergeService resultMergeService = new ResultMergeService();

    private static ChunkResult result(DescriptionField field, int chunk, String name, String... errors) {
        return new ChunkResult(field, chunk,
                List.of(new AssetResult(name, List.of(new AssetResult.Description("t-" + name, "gemini")))),
                List.of(errors));
    }

    @Test
    @DisplayName("Assets are ordered by chunk index whatever the completion order")
    void ordersByChunkIndex() {
        List<ChunkResult> results = List.of(
                result(DescriptionField.ALT_TEXT, 2, "e"),
                result(DescriptionField.CAPTION, 0, "x"),
                result(DescriptionField.ALT_TEXT, 0, "a"),
                result(DescriptionField.ALT_TEXT, 1, "c"));

        Map<DescriptionField, FieldAggregate> merged = resultMergeService.merge(results,
                List.of(DescriptionField.CAPTION, DescriptionField.ALT_TEXT));

        assertThat(merged.keySet()).containsExactly(DescriptionField.CAPTION, DescriptionField.ALT_TEXT);
        assertThat(merged.get(DescriptionField.ALT_TEXT).assets())
                .extracting(AssetResult::returnedName)
                .containsExactly("a", "c", "e");
        assertThat(merged.get(DescriptionField.CAPTION).assets()).hasSize(1);
    }

    @Test
    @DisplayName("Backend errors survive the merge in chunk order")
    void keepsErrors() {
        List<ChunkResult> results = List.of(
                result(DescriptionField.ALT_TEXT, 1, "b", "second"),
                result(DescriptionField.ALT_TEXT, 0, "a", "first"));

        FieldAggregate aggregate = resultMergeService.merge(results, List.of(DescriptionField.ALT_TEXT))
                .get(DescriptionField.ALT_TEXT);

        assertThat(aggregate.errors()).containsExactly("first", "second");
        assertThat(aggregate.hasErrors()).isTrue();
    }

    @Test
    @DisplayName("Fields without successful chunks get no aggregate")
    void skipsFieldsWithoutResults() {
        Map<DescriptionField, FieldAggregate> merged = resultMergeService.merge(
                List.of(result(DescriptionField.CAPTION, 0, "a")),
                List.of(DescriptionField.ALT_TEXT, DescriptionField.CAPTION));

        assertThat(merged).containsOnlyKeys(DescriptionField.CAPTION);
    }

    @Test
    @DisplayName("Appending aggregates is associative")
    void appendIsAssociative() {
        FieldAggregate a = result(DescriptionField.ALT_TEXT, 0, "a", "e1").toAggregate();
        FieldAggregate b = result(DescriptionField.ALT_TEXT, 1, "b").toAggregate();
        FieldAggregate c = result(DescriptionField.ALT_TEXT, 2, "c", "e3").toAggregate();

        assertThat(a.append(b).append(c)).isEqualTo(a.append(b.append(c)));
        assertThat(FieldAggregate.empty(DescriptionField.ALT_TEXT).append(a)).isEqualTo(a);
    }

    @Test
    @DisplayName("Duplicate (field, chunk) results are rejected")
    void rejectsDuplicates() {
        List<ChunkResult> results = List.of(
                result(DescriptionField.ALT_TEXT, 0, "a"),
                result(DescriptionField.ALT_TEXT, 0, "b"));

        assertThatThrownBy(() -> resultMergeService.merge(results, List.of(DescriptionField.ALT_TEXT)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunk 0");
    }

    @Test
    @DisplayName("Aggregates of different fields cannot be combined")
    void rejectsCrossFieldAppend() {
        FieldAggregate alt = FieldAggregate.empty(DescriptionField.ALT_TEXT);
        FieldAggregate caption = FieldAggregate.empty(DescriptionField.CAPTION);

        assertThatThrownBy(() -> alt.append(caption)).isInstanceOf(IllegalArgumentException.class);
    }
}
