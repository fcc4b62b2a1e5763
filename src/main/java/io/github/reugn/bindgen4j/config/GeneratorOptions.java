package io.github.reugn.bindgen4j.config;

import io.github.reugn.bindgen4j.model.Version;

/**
 * Library-wide generator options relevant to version gating.
 *
 * @param minCfgVersion the lowest library version the generated code supports, or {@code null}
 *                      if no minimum is configured. Elements introduced at or before this version
 *                      need no version gate.
 */
public record GeneratorOptions(Version minCfgVersion) {

    public static final GeneratorOptions DEFAULT = new GeneratorOptions(null);

    /**
     * Drops versions that are always satisfied under {@link #minCfgVersion()}.
     *
     * @param version a version gate, may be {@code null}
     * @return {@code version} if it is newer than the minimum configured version, otherwise {@code null}
     */
    public Version filterVersion(Version version) {
        if (version == null || minCfgVersion == null) {
            return version;
        }
        return version.compareTo(minCfgVersion) > 0 ? version : null;
    }
}
