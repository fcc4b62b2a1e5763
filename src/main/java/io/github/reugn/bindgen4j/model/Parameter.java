package io.github.reugn.bindgen4j.model;

import java.util.Objects;

/**
 * A C-level parameter of a function.
 *
 * @param name     the parameter name
 * @param instance {@code true} for the implicit {@code self} parameter
 */
public record Parameter(String name, boolean instance) {

    public Parameter {
        Objects.requireNonNull(name, "name");
    }

    public static Parameter instance(String name) {
        return new Parameter(name, true);
    }

    public static Parameter of(String name) {
        return new Parameter(name, false);
    }
}
