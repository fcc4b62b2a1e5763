package io.github.reugn.bindgen4j.model;

/**
 * Per-function generation status computed upstream from configuration.
 */
public enum GenerationStatus {
    GENERATE,
    MANUAL,
    IGNORE;

    /**
     * Returns whether any code is emitted for a function with this status.
     *
     * @return {@code true} only for {@link #GENERATE}
     */
    public boolean needGenerate() {
        return this == GENERATE;
    }
}
