package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.model.FunctionDescriptor;
import io.github.reugn.bindgen4j.model.Visibility;

import java.util.List;
import java.util.Objects;

/**
 * Re-exposes raw functions hidden by {@link OperationClassifier}.
 *
 * <p>Some operations must stay directly callable next to the synthesized operation,
 * e.g. {@code copy} on a reference-counted type, where cloning the wrapper only takes
 * another reference.
 */
public final class VisibilityPromoter {

    private VisibilityPromoter() {
    }

    /**
     * Makes the source function of an operation public again.
     *
     * <p>Does nothing if the operation was not found or its source function is suppressed.
     *
     * @param functions the functions that were classified
     * @param specials  the classification result for {@code functions}
     * @param kind      the operation whose source function is exposed
     */
    public static void unhide(List<FunctionDescriptor> functions, SpecialFunctions specials, OperationKind kind) {
        Objects.requireNonNull(functions, "functions");
        Objects.requireNonNull(kind, "kind");
        specials.operation(kind).flatMap(info -> functions.stream()
                        .filter(f -> f.symbol().equals(info.symbol()) && !f.isSuppressed())
                        .findFirst())
                .ifPresent(f -> f.setVisibility(Visibility.PUBLIC));
    }
}
