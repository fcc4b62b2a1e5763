package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.config.GeneratorOptions;
import io.github.reugn.bindgen4j.model.Version;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Version-gated imports collected for one generated file.
 *
 * <p>An import requested several times keeps its least restrictive gate:
 * <pre>
 * add(HASHING, 2.4) + add(HASHING, 2.8)  → HASHING gated at 2.4
 * add(HASHING, 2.4) + add(HASHING, null) → HASHING unconditional
 * </pre>
 *
 * <p>Gates at or below the configured {@link GeneratorOptions#minCfgVersion()} are always
 * satisfied and are recorded as unconditional.
 */
public final class Imports {

    private final GeneratorOptions options;
    // A present key with a null value is an unconditional import
    private final Map<ImportGroup, Version> gates = new EnumMap<>(ImportGroup.class);

    public Imports() {
        this(GeneratorOptions.DEFAULT);
    }

    public Imports(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Requires an import group from the given version on.
     *
     * @param group   the import group
     * @param version the version gate, or {@code null} for an unconditional import
     */
    public void addWithVersion(ImportGroup group, Version version) {
        Objects.requireNonNull(group, "group");
        Version gate = options.filterVersion(version);
        if (gates.containsKey(group)) {
            gates.put(group, Version.min(gates.get(group), gate));
        } else {
            gates.put(group, gate);
        }
    }

    public boolean contains(ImportGroup group) {
        return gates.containsKey(group);
    }

    /**
     * Returns the gate of a required group.
     *
     * @param group the import group
     * @return the gate, or empty if the group is unconditional or not required
     */
    public Optional<Version> gate(ImportGroup group) {
        return Optional.ofNullable(gates.get(group));
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }

    /**
     * @return the required imports in {@link ImportGroup} order
     */
    public List<ImportDeclaration> declarations() {
        List<ImportDeclaration> declarations = new ArrayList<>(gates.size());
        gates.forEach((group, version) -> declarations.add(new ImportDeclaration(group, version)));
        return declarations;
    }

    @Override
    public String toString() {
        return "Imports" + declarations();
    }
}
