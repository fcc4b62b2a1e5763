package io.github.reugn.bindgen4j.model;

/**
 * Kind of the library type that owns the analyzed functions.
 */
public enum TypeKind {
    ENUMERATION,
    BITFIELD,
    OTHER;

    /**
     * Enumerations and bitfields have their string-returning functions annotated
     * correctly upstream and are the only types that return static strings.
     *
     * @return {@code true} for {@link #ENUMERATION} and {@link #BITFIELD}
     */
    public boolean isEnumLike() {
        return this == ENUMERATION || this == BITFIELD;
    }
}
