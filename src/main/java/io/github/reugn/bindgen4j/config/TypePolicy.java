package io.github.reugn.bindgen4j.config;

/**
 * Per-type policy flags resolved from the generator configuration.
 *
 * @param trustReturnValueNullability if {@code true}, upstream nullability annotations on
 *                                    {@code to_string} return values are used as-is; otherwise
 *                                    they are assumed non-null on types other than enumerations
 *                                    and bitfields
 */
public record TypePolicy(boolean trustReturnValueNullability) {

    /**
     * Policy applied to types without explicit configuration.
     */
    public static final TypePolicy DEFAULT = new TypePolicy(false);
}
