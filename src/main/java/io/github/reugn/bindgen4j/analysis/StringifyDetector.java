package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.config.TypePolicy;
import io.github.reugn.bindgen4j.model.FunctionDescriptor;
import io.github.reugn.bindgen4j.model.Parameter;
import io.github.reugn.bindgen4j.model.ReturnValue;
import io.github.reugn.bindgen4j.model.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Detects stringify functions: functions taking only the instance and returning a string.
 *
 * <p><b>Rules, applied in order:</b>
 * <ol>
 *   <li>The only parameter must be the instance parameter</li>
 *   <li>The function must return a {@code utf8} string</li>
 *   <li>A function named {@code to_string} is renamed to {@code to_str} so the binding does not
 *       clash with {@link Object#toString()}. Unless the type policy trusts upstream nullability,
 *       its result is then assumed non-null on types other than enumerations and bitfields</li>
 *   <li>The result must not be nullable</li>
 * </ol>
 *
 * <p>The rename in rule 3 sticks even when rule 4 rejects the function.
 */
final class StringifyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StringifyDetector.class);

    /**
     * Function name reserved by the wrapper's own string conversion.
     */
    static final String RESERVED_NAME = "to_string";

    /**
     * Name a {@value #RESERVED_NAME} function is bound as.
     */
    static final String RENAMED = "to_str";

    /**
     * Stringify function names that can back a formatting operation.
     */
    static final Set<String> FORMAT_CANDIDATES = Set.of(RESERVED_NAME, RENAMED, "name", "get_name");

    private StringifyDetector() {
    }

    /**
     * Checks whether the function is a stringify function, renaming it and overriding its
     * return nullability where the rules above require.
     *
     * @param function   the function, possibly mutated
     * @param typeKind   kind of the owning type
     * @param typePolicy policy of the owning type
     * @return {@code true} if the function takes only the instance and returns a non-null string
     */
    static boolean isStringify(FunctionDescriptor function, TypeKind typeKind, TypePolicy typePolicy) {
        List<Parameter> parameters = function.parameters();
        if (parameters.size() != 1 || !parameters.get(0).instance()) {
            return false;
        }

        ReturnValue ret = function.returnValue();
        if (ret == null || !ret.isString()) {
            return false;
        }

        if (RESERVED_NAME.equals(function.name())) {
            function.rename(RENAMED);
            LOG.debug("Renamed {} from {} to {}", function.symbol(), RESERVED_NAME, RENAMED);

            // Only enumerations and bitfields are reliably annotated upstream
            if (!typePolicy.trustReturnValueNullability() && !typeKind.isEnumLike()) {
                ret.setNullable(false);
            }
        }

        return !ret.isNullable();
    }

    static boolean isFormatCandidate(String name) {
        return FORMAT_CANDIDATES.contains(name);
    }
}
