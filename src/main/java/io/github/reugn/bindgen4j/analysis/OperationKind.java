package io.github.reugn.bindgen4j.analysis;

import io.github.reugn.bindgen4j.model.Visibility;

import java.util.Optional;

/**
 * Conventional operations that a library type may expose through raw functions.
 *
 * <p>Each detected operation is synthesized as a high-level operation of the generated
 * wrapper, e.g. {@code equals} for {@link #EQUAL} or {@code toString} for {@link #FORMAT}.
 *
 * <p><b>Name Vocabulary:</b>
 * <table border="1">
 *   <caption>Function names recognized by {@link #parse}</caption>
 *   <tr><th>Name</th><th>Kind</th></tr>
 *   <tr><td>{@code compare}</td><td>{@link #COMPARE}</td></tr>
 *   <tr><td>{@code copy}</td><td>{@link #CLONE}</td></tr>
 *   <tr><td>{@code equal}, {@code is_equal}</td><td>{@link #EQUAL}</td></tr>
 *   <tr><td>{@code free}, {@code destroy}</td><td>{@link #DESTROY}</td></tr>
 *   <tr><td>{@code ref}, {@code ref_}</td><td>{@link #REF_INCREMENT}</td></tr>
 *   <tr><td>{@code unref}</td><td>{@link #REF_DECREMENT}</td></tr>
 *   <tr><td>{@code hash}</td><td>{@link #HASH}</td></tr>
 * </table>
 *
 * <p>{@link #FORMAT} has no vocabulary entry: it is detected from the function signature
 * by {@link StringifyDetector}.
 */
public enum OperationKind {
    COMPARE,
    CLONE,
    EQUAL,
    DESTROY,
    REF_INCREMENT,
    REF_DECREMENT,
    FORMAT,
    HASH;

    /**
     * Maps a function name to the operation it implements by naming convention.
     *
     * <p>Matching is case-sensitive and exact.
     *
     * @param name the short function name
     * @return the operation kind, or empty if the name is not part of the vocabulary
     */
    public static Optional<OperationKind> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(switch (name) {
            case "compare" -> COMPARE;
            case "copy" -> CLONE;
            case "equal", "is_equal" -> EQUAL;
            case "free", "destroy" -> DESTROY;
            case "ref", "ref_" -> REF_INCREMENT;
            case "unref" -> REF_DECREMENT;
            case "hash" -> HASH;
            default -> null;
        });
    }

    /**
     * Visibility of a raw function once it is classified as this operation.
     *
     * <ul>
     *   <li>Lifecycle operations are hidden: the synthesized operation is the public surface</li>
     *   <li>Comparison and hashing stay private: {@code equals}, {@code compareTo} and
     *       {@code hashCode} call them</li>
     *   <li>Formatting functions stay public</li>
     * </ul>
     *
     * @return the visibility to apply
     */
    public Visibility visibility() {
        return switch (this) {
            case CLONE, DESTROY, REF_INCREMENT, REF_DECREMENT -> Visibility.HIDDEN;
            case HASH, COMPARE, EQUAL -> Visibility.PRIVATE;
            case FORMAT -> Visibility.PUBLIC;
        };
    }
}
