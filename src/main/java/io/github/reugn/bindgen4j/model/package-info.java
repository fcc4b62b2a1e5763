/**
 * Structural model of library functions consumed by the special function analysis.
 * <p>
 * Instances are produced by manifest ingestion; this library only reads them and applies
 * the in-place updates documented on {@link io.github.reugn.bindgen4j.model.FunctionDescriptor}.
 */
package io.github.reugn.bindgen4j.model;
