package io.github.reugn.bindgen4j.model;

/**
 * Ownership transfer of a returned value, as recorded in the introspection data.
 */
public enum Transfer {
    /** Ownership stays with the callee. */
    NONE,
    /** The caller owns the container and its elements. */
    FULL,
    /** The caller owns the container only. */
    CONTAINER
}
