package io.github.cyfko.docfilter.core.serialization;

/**
 * On-wire encodings of a key/value mapping.
 *
 * <pre>{@code
 * DOCUMENT            { "red": 1, "blue": 2 }
 * ARRAY_OF_ARRAYS     [ ["red", 1], ["blue", 2] ]
 * ARRAY_OF_DOCUMENTS  [ { "k": "red", "v": 1 }, { "k": "blue", "v": 2 } ]
 * }</pre>
 *
 * @since 1.0.0
 */
public enum DictionaryRepresentation {

    /** A document whose element names are the serialized keys. Keys must serialize to strings. */
    DOCUMENT("document"),

    /** An array of two-element arrays {@code [key, value]}. */
    ARRAY_OF_ARRAYS("array of arrays"),

    /** An array of documents {@code { k: key, v: value }}. */
    ARRAY_OF_DOCUMENTS("array of documents");

    /** Element name of the key in {@link #ARRAY_OF_DOCUMENTS} entries. */
    public static final String KEY_ELEMENT = "k";

    /** Element name of the value in {@link #ARRAY_OF_DOCUMENTS} entries. */
    public static final String VALUE_ELEMENT = "v";

    private final String description;

    DictionaryRepresentation(String description) {
        this.description = description;
    }

    /**
     * @return a lower-case human readable description, e.g. {@code "array of documents"}
     */
    public String getDescription() {
        return description;
    }
}
