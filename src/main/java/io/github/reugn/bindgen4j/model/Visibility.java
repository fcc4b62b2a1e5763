package io.github.reugn.bindgen4j.model;

/**
 * Visibility of a raw binding in the generated wrapper code.
 */
public enum Visibility {
    /** Emitted as a public method. */
    PUBLIC,
    /** Emitted, but only reachable from the generated type itself. */
    PRIVATE,
    /** Not emitted as a method; a synthesized operation takes its place. */
    HIDDEN,
    /** Emitted as commented-out code. Never changed by the analysis. */
    SUPPRESSED
}
