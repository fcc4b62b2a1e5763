package io.github.reugn.bindgen4j.model;

import java.util.List;
import java.util.Objects;

/**
 * Structural view of one exported function of a library type.
 *
 * <p>Built by the manifest ingestion stage and owned by the caller. The special function
 * analysis mutates it in place: it may rewrite {@link #name()}, change
 * {@link #visibility()}, and override the nullability of {@link #returnValue()}.
 * {@link #symbol()} is never rewritten and identifies the function in analysis results.
 */
public final class FunctionDescriptor {

    private final String symbol;
    private final List<Parameter> parameters;
    private final ReturnValue returnValue;
    private final Version version;
    private final GenerationStatus status;
    private String name;
    private Visibility visibility;

    /**
     * Creates a function descriptor.
     *
     * @param name        the short name relative to the owning type, e.g. {@code copy}
     * @param symbol      the exported C symbol, e.g. {@code foo_bar_copy}
     * @param parameters  the C-level parameters in declaration order
     * @param returnValue the return value, or {@code null} for {@code void}
     * @param visibility  the initial visibility
     * @param version     the version introducing the function, or {@code null}
     * @param status      the generation status
     */
    public FunctionDescriptor(String name, String symbol, List<Parameter> parameters, ReturnValue returnValue,
                              Visibility visibility, Version version, GenerationStatus status) {
        this.name = Objects.requireNonNull(name, "name");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.parameters = List.copyOf(parameters);
        this.returnValue = returnValue;
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.version = version;
        this.status = Objects.requireNonNull(status, "status");
    }

    public String name() {
        return name;
    }

    public void rename(String newName) {
        this.name = Objects.requireNonNull(newName, "newName");
    }

    public String symbol() {
        return symbol;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    /**
     * @return the return value, or {@code null} if the function returns nothing
     */
    public ReturnValue returnValue() {
        return returnValue;
    }

    public Visibility visibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public boolean isSuppressed() {
        return visibility == Visibility.SUPPRESSED;
    }

    /**
     * @return the version introducing the function, or {@code null} if always available
     */
    public Version version() {
        return version;
    }

    public GenerationStatus status() {
        return status;
    }

    @Override
    public String toString() {
        return symbol + " (" + name + ", " + visibility + ")";
    }
}
