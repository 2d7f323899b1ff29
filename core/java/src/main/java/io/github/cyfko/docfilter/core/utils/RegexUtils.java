package io.github.cyfko.docfilter.core.utils;

/**
 * Regular expression helpers for string predicates translated to {@code $regex} filters.
 *
 * @since 1.0.0
 */
public final class RegexUtils {

    private static final String METACHARACTERS = "\\^$.|?*+()[]{}";

    private RegexUtils() {
        // Prevent instantiation
    }

    /**
     * Escapes every regular expression metacharacter so the text matches literally.
     * <p>
     * Characters are escaped one by one rather than quoted with {@code \Q...\E}, since the server
     * side regex engine is not Java's.
     * </p>
     *
     * @param text the literal text
     * @return the escaped pattern
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
