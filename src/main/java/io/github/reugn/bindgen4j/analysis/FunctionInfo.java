package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.model.Version;

import java.util.Objects;

/**
 * Special treatment recorded for one function.
 *
 * @param kind    the treatment
 * @param version the version gate of the function, or {@code null}
 */
public record FunctionInfo(StringifyKind kind, Version version) {

    public FunctionInfo {
        Objects.requireNonNull(kind, "kind");
    }
}
