package safejson;

import java.util.Objects;

/**
 * Turns arbitrary text into the body of a JSON string literal.
 *
 * <p> Every character of the result is JSON-safe, so wrapping it in double quotes always yields a
 * valid literal that decodes back to the input.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonEscaper.escape("say \"hi\"\n");
 * // -> say \"hi\"\n
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonEscaper {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonEscaper() {
        throw new UnsupportedOperationException();
    }

    /**
     * Escape {@code text} for use between the quotes of a JSON string literal.
     *
     * @param text any text, not {@code null}
     * @return escaped text, empty if {@code text} is empty
     */
    public static String escape(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var sb = new StringBuilder(text.length() + 16);
        escapeTo(sb, text);
        return sb.toString();
    }

    /**
     * Escape {@code text} and wrap it in double quotes.
     *
     * @param text any text, not {@code null}
     * @return a complete JSON string literal
     */
    public static String quote(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var sb = new StringBuilder(text.length() + 18);
        quoteTo(sb, text);
        return sb.toString();
    }

    static void quoteTo(StringBuilder out, CharSequence text) {
        out.append('"');
        escapeTo(out, text);
        out.append('"');
    }

    /**
     * Append the escaped form of {@code text} to {@code out}.
     *
     * <p> Named escapes win over the generic <code>&#92;u</code> form, so a tab is written as
     * {@code \t} and never as <code>&#92;u0009</code>. Other characters of the Unicode control
     * category (C0, DEL and C1) use four lowercase hex digits. Surrogates are copied as they are.
     *
     * @param out  destination buffer
     * @param text source text
     */
    public static void escapeTo(StringBuilder out, CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                default -> {
                    if (Character.getType(c) == Character.CONTROL) {
                        appendUnicodeEscape(out, c);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }

    private static void appendUnicodeEscape(StringBuilder out, char c) {
        out.append('\\')
                .append('u')
                .append(HEX[(c >> 12) & 0xF])
                .append(HEX[(c >> 8) & 0xF])
                .append(HEX[(c >> 4) & 0xF])
                .append(HEX[c & 0xF]);
    }
}
