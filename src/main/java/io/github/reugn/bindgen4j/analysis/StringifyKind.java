package io.github.reugn.bindgen4j.analysis;

/**
 * Special treatment applicable to a single stringify function.
 */
public enum StringifyKind {
    /**
     * The function returns a string owned by the library with static lifetime, so the
     * binding may return a borrowed view instead of copying into a new allocation.
     */
    STATIC_STRINGIFY
}
