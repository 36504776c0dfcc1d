package com.imageinsight.describer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ImageInsight Description Service Application
 *
 * Generates alt text, captions and descriptions for images through a remote vision API:
 * - batches images per API call
 * - submits every (field, batch) pair concurrently and polls async jobs
 * - maps results back to the caller's image ids
 */
@SpringBootApplication
public class DescriberApplication {

    public static void main(String[] args) {
        SpringApplication.run(DescriberApplication.class, args);
    }
}
