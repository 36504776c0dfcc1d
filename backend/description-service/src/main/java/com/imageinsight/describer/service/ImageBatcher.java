package com.imageinsight.describer.service;

import com.imageinsight.describer.dto.Chunk;
import com.imageinsight.describer.dto.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits work items into fixed-size chunks, one API call each.
 *
 * <p>N items with batch size K give ceil(N/K) chunks indexed 0..n-1 in input
 * order; no item is dropped, duplicated or reordered.</p>
 */
@Component
@Slf4j
public class ImageBatcher {

    public List<Chunk> partition(List<WorkItem> items, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }

        List<Chunk> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());

            List<String> ids = new ArrayList<>(end - start);
            List<byte[]> payloads = new ArrayList<>(end - start);
            for (WorkItem item : items.subList(start, end)) {
                ids.add(item.id());
                payloads.add(item.payload());
            }
            chunks.add(new Chunk(chunks.size(), ids, payloads));
        }

        log.debug("Split {} images into {} chunk(s) of up to {}", items.size(), chunks.size(), batchSize);
        return chunks;
    }
}
