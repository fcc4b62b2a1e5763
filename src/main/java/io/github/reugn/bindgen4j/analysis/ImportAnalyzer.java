package io.github.reugn.bindgen4j.analysis;

import java.util.Map;

/**
 * Derives the imports required by the operations and special functions of a type.
 *
 * <table border="1">
 *   <caption>Imports per analysis entry</caption>
 *   <tr><th>Entry</th><th>Import group</th></tr>
 *   <tr><td>{@link OperationKind#COMPARE}</td><td>{@link ImportGroup#ORDERING}</td></tr>
 *   <tr><td>{@link OperationKind#FORMAT}</td><td>{@link ImportGroup#FORMATTING}</td></tr>
 *   <tr><td>{@link OperationKind#HASH}</td><td>{@link ImportGroup#HASHING}</td></tr>
 *   <tr><td>{@link StringifyKind#STATIC_STRINGIFY}</td><td>{@link ImportGroup#STATIC_STRING}</td></tr>
 * </table>
 *
 * <p>Other operations need no import. Each import is gated at the version of the entry requiring it.
 */
public final class ImportAnalyzer {

    private ImportAnalyzer() {
    }

    /**
     * Adds the imports required by {@code specials} to {@code imports}.
     *
     * @param specials the classification result of a type
     * @param imports  the import collector of the file the type is generated into
     */
    public static void analyzeImports(SpecialFunctions specials, Imports imports) {
        for (Map.Entry<OperationKind, TraitInfo> entry : specials.traits().entrySet()) {
            TraitInfo info = entry.getValue();
            switch (entry.getKey()) {
                case COMPARE -> imports.addWithVersion(ImportGroup.ORDERING, info.version());
                case FORMAT -> imports.addWithVersion(ImportGroup.FORMATTING, info.version());
                case HASH -> imports.addWithVersion(ImportGroup.HASHING, info.version());
                default -> {
                }
            }
        }
        for (FunctionInfo info : specials.functions().values()) {
            switch (info.kind()) {
                case STATIC_STRINGIFY -> imports.addWithVersion(ImportGroup.STATIC_STRING, info.version());
            }
        }
    }
}
