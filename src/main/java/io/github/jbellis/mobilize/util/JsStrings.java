package io.github.jbellis.mobilize.util;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Encodes values as JavaScript string literals for inline script blocks.
 */
public final class JsStrings {

    /**
     * Escapes everything that could terminate a quoted literal or the
     * enclosing {@code <script>} element. The output is safe inside either
     * single or double quotes.
     */
    private static final Escaper LITERAL_ESCAPER = Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('\'', "\\'")
            .addEscape('"', "\\\"")
            .addEscape('\n', "\\n")
            .addEscape('\r', "\\r")
            .addEscape('\t', "\\t")
            .addEscape('<', "\\u003c")
            .addEscape('\u2028', "\\u2028")
            .addEscape('\u2029', "\\u2029")
            .build();

    private JsStrings() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the escaped body of a string literal, without surrounding quotes.
     */
    public static String escape(String value) {
        return LITERAL_ESCAPER.escape(value);
    }

    /**
     * Returns {@code value} as a complete single-quoted literal.
     */
    public static String singleQuoted(String value) {
        return "'" + escape(value) + "'";
    }
}
