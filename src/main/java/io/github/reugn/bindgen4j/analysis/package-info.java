/**
 * Special function analysis: detects which raw functions of a library type implement
 * conventional operations and what the generated wrapper needs to synthesize them.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * OperationClassifier.extract (entry point, one type at a time)
 *     ├── StringifyDetector   - to_string rename, nullability override, signature check
 *     └── OperationKind.parse - name vocabulary
 *           │
 *           ▼
 *     SpecialFunctions (traits + functions)
 *           ├── VisibilityPromoter.unhide   - re-exposes hidden source functions
 *           └── ImportAnalyzer.analyzeImports → Imports
 * </pre>
 *
 * <p>Classification is synchronous and keeps no state between calls. Distinct types may be
 * analyzed concurrently as long as each call gets its own function list.
 */
package io.github.reugn.bindgen4j.analysis;
