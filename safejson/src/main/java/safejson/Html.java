package safejson;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Minimal {@link Markup} implementations.
 *
 * @since 0.1.0
 */
public final class Html {

    private Html() {
        throw new UnsupportedOperationException();
    }

    /**
     * Untrusted text, rendered with HTML entity escaping.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Html.text("Tom & \"Jerry\"").render();
     * // -> Tom &amp; &quot;Jerry&quot;
     * }</pre>
     *
     * @param text raw text, not {@code null}
     * @return markup rendering the escaped text
     */
    public static Markup text(String text) {
        Objects.requireNonNull(text, "text");
        return new Text(text);
    }

    /**
     * Text that is already HTML-safe, rendered as it is.
     *
     * @param html pre-escaped HTML, not {@code null}
     * @return markup rendering {@code html} verbatim
     */
    public static Markup preEscaped(String html) {
        Objects.requireNonNull(html, "html");
        return new PreEscaped(html);
    }

    /**
     * Render several markup values one after another.
     *
     * @param parts markup parts, not {@code null}
     * @return markup rendering the parts in order
     */
    public static Markup concat(Markup... parts) {
        Objects.requireNonNull(parts, "parts");
        var list = List.copyOf(Arrays.asList(parts));
        return new Concat(list);
    }

    static void escapeTo(StringBuilder out, String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
    }

    private record Text(String value) implements Markup {
        @Override
        public String render() {
            var sb = new StringBuilder(value.length() + 16);
            escapeTo(sb, value);
            return sb.toString();
        }
    }

    private record PreEscaped(String value) implements Markup {
        @Override
        public String render() {
            return value;
        }
    }

    private record Concat(List<Markup> parts) implements Markup {
        @Override
        public String render() {
            var sb = new StringBuilder();
            for (var part : parts) {
                sb.append(Objects.requireNonNull(part.render(), "rendered markup"));
            }
            return sb.toString();
        }
    }
}
