package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.model.Version;

import java.util.Objects;

/**
 * The raw function chosen to implement an operation.
 *
 * @param symbol  the C symbol of the source function
 * @param version the version gate of the synthesized operation, or {@code null}
 */
public record TraitInfo(String symbol, Version version) {

    public TraitInfo {
        Objects.requireNonNull(symbol, "symbol");
    }
}
