package com.imageinsight.describer.config;

import java.time.Duration;

/**
 * Immutable per-run view of the settings. Built from {@link DescriberProperties}
 * and optionally overridden by the caller.
 */
public record DescriptionSettings(
        String apiKey,
        String backend,
        String language,
        String prompt,
        int batchSize,
        Duration pollInterval,
        int maxPollAttempts
) {

    public DescriptionSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (maxPollAttempts < 1) {
            throw new IllegalArgumentException("maxPollAttempts must be >= 1");
        }
        if (pollInterval == null || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be >= 0");
        }
        prompt = prompt != null ? prompt : "";
    }

    public static DescriptionSettings from(DescriberProperties properties) {
        return new DescriptionSettings(
                properties.getApi().getApiKey(),
                properties.getDefaults().getBackend(),
                properties.getDefaults().getLanguage(),
                properties.getDefaults().getPrompt(),
                properties.getBatch().getSize(),
                Duration.ofMillis(properties.getPolling().getIntervalMs()),
                properties.getPolling().getMaxAttempts()
        );
    }

    /**
     * Returns a copy with any non-blank override applied.
     */
    public DescriptionSettings withOverrides(String backendOverride, String languageOverride, String promptOverride) {
        return new DescriptionSettings(
                apiKey,
                isBlank(backendOverride) ? backend : backendOverride.trim(),
                isBlank(languageOverride) ? language : languageOverride.trim(),
                promptOverride != null ? promptOverride : prompt,
                batchSize,
                pollInterval,
                maxPollAttempts
        );
    }

    public boolean hasCustomPrompt() {
        return !prompt.isBlank();
    }

    public boolean hasApiKey() {
        return !isBlank(apiKey);
    }

    @Override
    public String toString() {
        // never print the key
        return "DescriptionSettings[backend=" + backend + ", language=" + language
                + ", customPrompt=" + hasCustomPrompt() + ", batchSize=" + batchSize
                + ", pollInterval=" + pollInterval + ", maxPollAttempts=" + maxPollAttempts + "]";
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
