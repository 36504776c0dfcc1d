package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.dto.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageBatcherTest {

    private final ImageBatcher imageBatcher = new ImageBatcher();

    private static List<WorkItem> items(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new WorkItem("1:" + (2500 + i), new byte[]{(byte) i}))
                .toList();
    }

    @ParameterizedTest(name = "{0} items, batch {1} -> {2} chunks")
    @CsvSource({
            "32, 10, 4",
            "10, 10, 1",
            "11, 10, 2",
            "1, 10, 1",
            "5, 1, 5",
            "0, 10, 0"
    })
    @DisplayName("Chunk count is ceil(N/K)")
    void chunkCount(int n, int batchSize, int expectedChunks) {
        List<Chunk> chunks = imageBatcher.partition(items(n), batchSize);

        assertThat(chunks).hasSize(expectedChunks);
        assertThat(chunks).allSatisfy(c -> assertThat(c.size()).isBetween(1, batchSize));
    }

    @Test
    @DisplayName("Concatenated chunks reproduce the input order")
    void preservesOrder() {
        List<WorkItem> input = items(32);

        List<Chunk> chunks = imageBatcher.partition(input, 10);

        List<String> flattened = chunks.stream().flatMap(c -> c.itemIds().stream()).toList();
        assertThat(flattened).containsExactlyElementsOf(input.stream().map(WorkItem::id).toList());
        assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2, 3);
        assertThat(chunks).extracting(Chunk::size).containsExactly(10, 10, 10, 2);
        assertThat(chunks.get(3).payloads().get(1)).containsExactly((byte) 31);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Batch size below one is rejected")
    void rejectsInvalidBatchSize(int batchSize) {
        assertThatThrownBy(() -> imageBatcher.partition(items(3), batchSize))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
