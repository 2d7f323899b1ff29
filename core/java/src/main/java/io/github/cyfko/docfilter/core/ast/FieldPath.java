package io.github.cyfko.docfilter.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved path from the document root (or from the current array element inside an
 * {@code $elemMatch}) to a field.
 * <p>
 * Paths are immutable sequences of element names. They are only ever produced by field
 * resolution, never from raw source expressions, so every field referenced by a
 * {@link FilterNode} is known to exist in the serialized document layout.
 * </p>
 *
 * <pre>{@code
 * FieldPath tags = FieldPath.of("Tags");
 * FieldPath red = tags.subField("red");   // Tags.red
 * }</pre>
 *
 * @param segments the element names, from outermost to innermost
 * @since 1.0.0
 */
public record FieldPath(List<String> segments) {

    private static final FieldPath EMPTY = new FieldPath(List.of());

    public FieldPath {
        Objects.requireNonNull(segments, "Segments cannot be null");
        segments = List.copyOf(segments);
    }

    /**
     * Creates a path from its element names.
     *
     * @param segments element names, outermost first
     * @return the path
     */
    public static FieldPath of(String... segments) {
        return new FieldPath(List.of(segments));
    }

    /**
     * Returns the empty path. It denotes the document being matched: the root document, or the
     * current element of an array inside an {@code $elemMatch}.
     *
     * @return the empty path
     */
    public static FieldPath empty() {
        return EMPTY;
    }

    /**
     * Extends this path with a literal sub-field name.
     *
     * @param name the sub-field name, used verbatim
     * @return a new, longer path
     */
    public FieldPath subField(String name) {
        Objects.requireNonNull(name, "Sub-field name cannot be null");
        List<String> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(name);
        return new FieldPath(extended);
    }

    /**
     * @return {@code true} if this path has no segment
     */
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * Returns the dotted form used as a key in a query document, e.g. {@code "a.b"}.
     *
     * @return the dotted path
     */
    public String dotted() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return isEmpty() ? "<empty>" : dotted();
    }
}
