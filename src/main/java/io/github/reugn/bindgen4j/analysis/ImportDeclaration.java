package io.github.reugn.bindgen4j.analysis;

import com.squareup.javapoet.ClassName;
import io.github.reugn.bindgen4j.model.Version;

import java.util.Objects;

/**
 * A required import, gated at the version where it becomes necessary.
 *
 * <p>The emitter wraps a gated declaration in a guard equivalent to "library version is at
 * least {@code minVersion}"; an ungated one is emitted unconditionally.
 *
 * @param group      the import group
 * @param minVersion the gate, or {@code null} if unconditional
 */
public record ImportDeclaration(ImportGroup group, Version minVersion) {

    public ImportDeclaration {
        Objects.requireNonNull(group, "group");
    }

    public boolean isConditional() {
        return minVersion != null;
    }

    public ClassName className() {
        return group.className();
    }
}
