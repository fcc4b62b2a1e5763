package io.github.reugn.bindgen4j.model;

import java.util.Objects;

/**
 * Return value of a function.
 *
 * <p>Mutable: the analysis may override {@link #isNullable()} on functions whose
 * upstream nullability annotation is not trusted.
 */
public final class ReturnValue {

    /**
     * Introspection type name of a NUL-terminated UTF-8 string.
     */
    public static final String UTF8 = "utf8";

    private final String type;
    private final Transfer transfer;
    private boolean nullable;

    public ReturnValue(String type, boolean nullable, Transfer transfer) {
        this.type = Objects.requireNonNull(type, "type");
        this.transfer = Objects.requireNonNull(transfer, "transfer");
        this.nullable = nullable;
    }

    /**
     * Creates a UTF-8 string return value.
     *
     * @param nullable whether the upstream data marks the result nullable
     * @param transfer ownership transfer of the result
     * @return a new return value of type {@link #UTF8}
     */
    public static ReturnValue string(boolean nullable, Transfer transfer) {
        return new ReturnValue(UTF8, nullable, transfer);
    }

    public String type() {
        return type;
    }

    public boolean isString() {
        return UTF8.equals(type);
    }

    public Transfer transfer() {
        return transfer;
    }

    public boolean isNullable() {
        return nullable;
    }

    public void setNullable(boolean nullable) {
        this.nullable = nullable;
    }

    @Override
    public String toString() {
        return type + (nullable ? "?" : "") + " (transfer " + transfer.name().toLowerCase() + ")";
    }
}
