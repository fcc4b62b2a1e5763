package io.github.reugn.bindgen4j.analysis;

import com.squareup.javapoet.ClassName;

/**
 * Support declarations required by synthesized operations.
 */
public enum ImportGroup {
    /** {@code compareTo} implementations. */
    ORDERING(ClassName.get("java.util", "Comparator")),
    /** {@code toString} and {@code formatTo} implementations. */
    FORMATTING(ClassName.get("java.util", "Formattable")),
    /** {@code hashCode} implementations. */
    HASHING(ClassName.get("java.util", "Objects")),
    /** Borrowed views of library-owned static strings. */
    STATIC_STRING(ClassName.get("java.lang.foreign", "MemorySegment"));

    private final ClassName className;

    ImportGroup(ClassName className) {
        this.className = className;
    }

    /**
     * @return the type the generated code imports for this group
     */
    public ClassName className() {
        return className;
    }
}
