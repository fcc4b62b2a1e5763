package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.config.TypePolicy;
import io.github.reugn.bindgen4j.model.FunctionDescriptor;
import io.github.reugn.bindgen4j.model.Transfer;
import io.github.reugn.bindgen4j.model.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the functions of one type into conventional operations.
 *
 * <p>Makes a single pass over the functions in declaration order and updates them in place.
 * For each function:
 * <ol>
 *   <li>If {@link StringifyDetector} accepts it, it may be recorded as a
 *       {@link StringifyKind#STATIC_STRINGIFY} function and, if its name is a formatting
 *       candidate, as the {@link OperationKind#FORMAT} operation</li>
 *   <li>Otherwise, if its name is in the {@link OperationKind} vocabulary, its visibility is
 *       set to {@link OperationKind#visibility()} and it is recorded as that operation</li>
 * </ol>
 *
 * <p>When several functions map to the same operation, the last one in list order wins.
 *
 * <p><b>Destroy fallback:</b>
 * <p>A function named {@code destroy} is only a fallback. It becomes the {@link OperationKind#DESTROY}
 * operation after the pass, and only if the type has {@code copy} but no {@code free}:
 * <pre>
 * [copy, destroy]         → CLONE=copy, DESTROY=destroy, both hidden
 * [free, destroy]         → DESTROY=free, destroy left untouched
 * [destroy]               → nothing recorded, destroy left untouched
 * </pre>
 *
 * <p>Functions with {@link io.github.reugn.bindgen4j.model.Visibility#SUPPRESSED} visibility keep it.
 *
 * @see VisibilityPromoter
 * @see ImportAnalyzer
 */
public final class OperationClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(OperationClassifier.class);

    private static final String DESTROY_NAME = "destroy";

    private OperationClassifier() {
    }

    /**
     * Classifies the functions of a type.
     *
     * @param functions  the type's functions in declaration order, updated in place
     * @param typeKind   kind of the owning type
     * @param typePolicy policy of the owning type
     * @return the operations and special functions found
     */
    public static SpecialFunctions extract(List<FunctionDescriptor> functions, TypeKind typeKind,
                                           TypePolicy typePolicy) {
        Objects.requireNonNull(functions, "functions");
        Objects.requireNonNull(typeKind, "typeKind");
        Objects.requireNonNull(typePolicy, "typePolicy");

        SpecialFunctions specials = new SpecialFunctions();
        boolean hasClone = false;
        boolean hasFree = false;
        DestroyCandidate destroy = null;

        for (int pos = 0; pos < functions.size(); pos++) {
            FunctionDescriptor function = functions.get(pos);

            // Renaming happens inside isStringify, before anything below reads the name
            if (StringifyDetector.isStringify(function, typeKind, typePolicy)) {
                if (returnsStaticString(function, typeKind)) {
                    specials.putFunction(function.symbol(),
                            new FunctionInfo(StringifyKind.STATIC_STRINGIFY, function.version()));
                    LOG.debug("{} returns a static string", function.symbol());
                }
                // TODO: pick a preferred candidate when a type has more than one formatting function
                if (StringifyDetector.isFormatCandidate(function.name())) {
                    register(specials, function, OperationKind.FORMAT);
                }
                continue;
            }

            Optional<OperationKind> parsed = OperationKind.parse(function.name());
            if (parsed.isEmpty()) {
                continue;
            }
            OperationKind kind = parsed.get();

            if (DESTROY_NAME.equals(function.name())) {
                destroy = new DestroyCandidate(function.symbol(), pos);
                continue;
            }

            applyVisibility(function, kind);
            if (kind == OperationKind.CLONE) {
                hasClone = true;
            } else if (kind == OperationKind.DESTROY) {
                hasFree = true;
            }
            register(specials, function, kind);
        }

        if (hasClone && !hasFree && destroy != null) {
            FunctionDescriptor function = functions.get(destroy.position());
            applyVisibility(function, OperationKind.DESTROY);
            specials.putTrait(OperationKind.DESTROY, new TraitInfo(destroy.symbol(), function.version()));
            LOG.debug("{} classified as {} (fallback)", destroy.symbol(), OperationKind.DESTROY);
        }

        return specials;
    }

    /**
     * Only enumerations and bitfields are assumed to return static strings, and only from
     * functions that are generated at all.
     */
    private static boolean returnsStaticString(FunctionDescriptor function, TypeKind typeKind) {
        return function.returnValue().transfer() == Transfer.NONE
                && typeKind.isEnumLike()
                && function.status().needGenerate();
    }

    private static void applyVisibility(FunctionDescriptor function, OperationKind kind) {
        if (!function.isSuppressed()) {
            function.setVisibility(kind.visibility());
        }
    }

    private static void register(SpecialFunctions specials, FunctionDescriptor function, OperationKind kind) {
        specials.putTrait(kind, new TraitInfo(function.symbol(), function.version()));
        LOG.debug("{} classified as {}", function.symbol(), kind);
    }

    /**
     * A {@code destroy} function held back until the whole list has been seen.
     *
     * @param symbol   the C symbol
     * @param position index of the function in the analyzed list
     */
    private record DestroyCandidate(String symbol, int position) {
    }
}
