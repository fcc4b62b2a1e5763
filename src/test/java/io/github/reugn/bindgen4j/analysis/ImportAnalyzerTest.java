package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.config.TypePolicy;
import io.github.reugn.bindgen4j.model.FunctionDescriptor;
import io.github.reugn.bindgen4j.model.Transfer;
import io.github.reugn.bindgen4j.model.TypeKind;
import io.github.reugn.bindgen4j.model.Version;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.reugn.bindgen4j.util.Functions.method;
import static io.github.reugn.bindgen4j.util.Functions.stringify;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Import Analyzer")
class ImportAnalyzerTest {

    private static final Version V2_60 = Version.of(2, 60);

    @Test
    @DisplayName("Compare requires ordering support gated at its version")
    void compareGated() {
        SpecialFunctions specials = new SpecialFunctions();
        specials.putTrait(OperationKind.COMPARE, new TraitInfo("foo_compare", V2_60));
        Imports imports = new Imports();

        ImportAnalyzer.analyzeImports(specials, imports);

        assertThat(imports.declarations()).containsExactly(new ImportDeclaration(ImportGroup.ORDERING, V2_60));
    }

    @Test
    @DisplayName("Hash without version requires unconditional hashing support")
    void hashUnconditional() {
        SpecialFunctions specials = new SpecialFunctions();
        specials.putTrait(OperationKind.HASH, new TraitInfo("foo_hash", null));
        Imports imports = new Imports();

        ImportAnalyzer.analyzeImports(specials, imports);

        assertThat(imports.declarations()).containsExactly(new ImportDeclaration(ImportGroup.HASHING, null));
        assertThat(imports.declarations().get(0).isConditional()).isFalse();
    }

    @Test
    @DisplayName("Lifecycle and equality operations need no imports")
    void noImports() {
        SpecialFunctions specials = new SpecialFunctions();
        specials.putTrait(OperationKind.CLONE, new TraitInfo("foo_copy", null));
        specials.putTrait(OperationKind.DESTROY, new TraitInfo("foo_free", null));
        specials.putTrait(OperationKind.REF_INCREMENT, new TraitInfo("foo_ref", null));
        specials.putTrait(OperationKind.REF_DECREMENT, new TraitInfo("foo_unref", null));
        specials.putTrait(OperationKind.EQUAL, new TraitInfo("foo_equal", null));
        Imports imports = new Imports();

        ImportAnalyzer.analyzeImports(specials, imports);

        assertThat(imports.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Classified enumeration requires formatting and static string support")
    void classifiedEnumeration() {
        List<FunctionDescriptor> functions = List.of(
                stringify("to_string").transfer(Transfer.NONE).since("2.60").build(),
                method("hash").build());
        SpecialFunctions specials = OperationClassifier.extract(functions, TypeKind.ENUMERATION, TypePolicy.DEFAULT);
        Imports imports = new Imports();

        ImportAnalyzer.analyzeImports(specials, imports);

        assertThat(imports.declarations()).containsExactly(
                new ImportDeclaration(ImportGroup.FORMATTING, V2_60),
                new ImportDeclaration(ImportGroup.HASHING, null),
                new ImportDeclaration(ImportGroup.STATIC_STRING, V2_60));
        assertThat(imports.declarations())
                .extracting(d -> d.className().canonicalName())
                .containsExactly("java.util.Formattable", "java.util.Objects", "java.lang.foreign.MemorySegment");
    }
}
