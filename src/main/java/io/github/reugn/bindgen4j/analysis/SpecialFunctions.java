package io.github.reugn.bindgen4j.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of the special function analysis of one type.
 *
 * <p>Holds two mappings, both iterated in key order so generated output is stable:
 * <ul>
 *   <li><b>traits</b>: operation kind → the function implementing it, at most one per kind</li>
 *   <li><b>functions</b>: C symbol → special treatment of that function</li>
 * </ul>
 *
 * <p>Populated only by {@link OperationClassifier} and read-only afterwards.
 *
 * @see OperationClassifier#extract
 */
public final class SpecialFunctions {

    private final Map<OperationKind, TraitInfo> traits = new EnumMap<>(OperationKind.class);
    private final SortedMap<String, FunctionInfo> functions = new TreeMap<>();

    SpecialFunctions() {
    }

    /**
     * @return operations found for the type, in {@link OperationKind} declaration order
     */
    public Map<OperationKind, TraitInfo> traits() {
        return Collections.unmodifiableMap(traits);
    }

    /**
     * @return special function treatments keyed by C symbol, in symbol order
     */
    public SortedMap<String, FunctionInfo> functions() {
        return Collections.unmodifiableSortedMap(functions);
    }

    public boolean hasOperation(OperationKind kind) {
        return traits.containsKey(kind);
    }

    public Optional<TraitInfo> operation(OperationKind kind) {
        return Optional.ofNullable(traits.get(kind));
    }

    // Last write wins: a later function of the same kind replaces the earlier one.
    void putTrait(OperationKind kind, TraitInfo info) {
        traits.put(kind, info);
    }

    void putFunction(String symbol, FunctionInfo info) {
        functions.put(symbol, info);
    }

    @Override
    public String toString() {
        return "SpecialFunctions{traits=" + traits + ", functions=" + functions + "}";
    }
}
