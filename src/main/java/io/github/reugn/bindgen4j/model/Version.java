package io.github.reugn.bindgen4j.model;

import java.util.Comparator;

/**
 * A library version at which an API element becomes available.
 *
 * <p>Versions are written {@code major.minor} or {@code major.minor.patch} and are
 * compared component by component. Where a version is optional, {@code null} stands
 * for "available in every version".
 *
 * @param major the major component
 * @param minor the minor component
 * @param patch the patch component, {@code 0} when omitted
 */
public record Version(int major, int minor, int patch) implements Comparable<Version> {

    private static final Comparator<Version> ORDER = Comparator
            .comparingInt(Version::major)
            .thenComparingInt(Version::minor)
            .thenComparingInt(Version::patch);

    public Version {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    "Version components must not be negative: " + major + "." + minor + "." + patch);
        }
    }

    public static Version of(int major, int minor) {
        return new Version(major, minor, 0);
    }

    /**
     * Parses a version string.
     *
     * <p><b>Examples:</b>
     * <ul>
     *   <li>{@code "2.56"} → {@code 2.56.0}</li>
     *   <li>{@code "1.0.3"} → {@code 1.0.3}</li>
     * </ul>
     *
     * @param text the version text
     * @return the parsed version
     * @throws IllegalArgumentException if the text is not {@code major.minor[.patch]}
     */
    public static Version parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be empty");
        }
        String[] parts = text.trim().split("\\.", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException(
                    "'" + text + "' is not a valid version. Expected major.minor or major.minor.patch.");
        }
        int[] components = new int[3];
        for (int i = 0; i < parts.length; i++) {
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "'" + text + "' is not a valid version. Component '" + parts[i] + "' is not a number.", e);
            }
        }
        return new Version(components[0], components[1], components[2]);
    }

    /**
     * Returns the lower of two optional versions, where {@code null} (unconditional)
     * is lower than any concrete version.
     *
     * @param a first version, may be {@code null}
     * @param b second version, may be {@code null}
     * @return the least restrictive of the two
     */
    public static Version min(Version a, Version b) {
        if (a == null || b == null) {
            return null;
        }
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
