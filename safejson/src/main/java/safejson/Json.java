package safejson;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Builds JSON text from typed fragments.
 *
 * <p> Every {@link JsonFragment} this class returns is a complete JSON value. String content goes
 * through {@link JsonEscaper}, so no caller can put malformed text into the output.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonFragment json = Json.map(
 *         Json.entry("foo", Json.list(Json.scalar(Html.text("bar")), Json.scalar(Html.text("baz")))));
 * Content content = Json.toContent(json);
 * // -> {"foo":["bar","baz"]}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Json {

    private static final JsonRenderer defaultRenderer = JsonRenderer.builder().build();

    private static final JsonFragment EMPTY_LIST = new JsonFragment("[]");
    private static final JsonFragment EMPTY_MAP = new JsonFragment("{}");

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Scalars
    // ============================================================

    /**
     * Render {@code markup} to raw text and emit it as a JSON string.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.scalar(Html.text("a < b"));
     * // -> "a &lt; b"
     * }</pre>
     *
     * @param markup markup-safe text, not {@code null}
     * @return a JSON string value
     */
    public static JsonFragment scalar(Markup markup) {
        Objects.requireNonNull(markup, "markup");
        var text = Objects.requireNonNull(markup.render(), "rendered markup");
        var sb = new StringBuilder(text.length() + 2);
        JsonEscaper.quoteTo(sb, text);
        return new JsonFragment(sb.toString());
    }

    // ============================================================
    // Lists
    // ============================================================

    /**
     * Emit a JSON array of {@code items}.
     *
     * @param items array elements, not {@code null}
     * @return {@code []} if there are no items
     * @see #list(Iterable)
     */
    public static JsonFragment list(JsonFragment... items) {
        Objects.requireNonNull(items, "items");
        return list(Arrays.asList(items));
    }

    /**
     * Emit a JSON array of {@code items}, in iteration order.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.list(List.of(Json.scalar(Html.text("a")), Json.scalar(Html.text("b"))));
     * // -> ["a","b"]
     * }</pre>
     *
     * @param items array elements, not {@code null}
     * @return {@code []} if there are no items
     */
    public static JsonFragment list(Iterable<JsonFragment> items) {
        Objects.requireNonNull(items, "items");
        var it = items.iterator();
        if (!it.hasNext()) return EMPTY_LIST;
        var out = new StringBuilder();
        out.append('[');
        int i = 0;
        while (it.hasNext()) {
            if (i > 0) out.append(',');
            var item = it.next();
            if (item == null) throw new NullPointerException("items[" + i + "]");
            item.appendTo(out);
            i++;
        }
        out.append(']');
        return new JsonFragment(out.toString());
    }

    // ============================================================
    // Maps
    // ============================================================

    /**
     * Create a map entry for {@link #map(Map.Entry[])}.
     *
     * @param key   plain key text, not {@code null}
     * @param value entry value, not {@code null}
     * @return the entry
     */
    public static Map.Entry<String, JsonFragment> entry(String key, JsonFragment value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return Map.entry(key, value);
    }

    /**
     * Emit a JSON object of {@code entries}.
     *
     * @param entries object members, not {@code null}
     * @return {@code {}} if there are no entries
     * @see #map(Iterable)
     */
    @SafeVarargs
    public static JsonFragment map(Map.Entry<String, JsonFragment>... entries) {
        Objects.requireNonNull(entries, "entries");
        return map(Arrays.asList(entries));
    }

    /**
     * Emit a JSON object with the entries of {@code map}, in the map's iteration order.
     *
     * @param map object members, not {@code null}
     * @return {@code {}} if the map is empty
     */
    public static JsonFragment map(Map<String, JsonFragment> map) {
        Objects.requireNonNull(map, "map");
        return map(map.entrySet());
    }

    /**
     * Emit a JSON object of {@code entries}, in iteration order.
     *
     * <p> Keys are plain text: they are escaped and quoted but not rendered as markup. Keys are not
     * sorted and duplicates are written as given.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.map(List.of(Json.entry("z", Json.scalar(Html.text("1"))), Json.entry("a", Json.scalar(Html.text("2")))));
     * // -> {"z":"1","a":"2"}
     * }</pre>
     *
     * @param entries object members, not {@code null}
     * @return {@code {}} if there are no entries
     */
    public static JsonFragment map(Iterable<? extends Map.Entry<String, JsonFragment>> entries) {
        Objects.requireNonNull(entries, "entries");
        var it = entries.iterator();
        if (!it.hasNext()) return EMPTY_MAP;
        var out = new StringBuilder();
        out.append('{');
        int i = 0;
        while (it.hasNext()) {
            var en = it.next();
            if (en == null) throw new NullPointerException("entries[" + i + "]");
            var key = en.getKey();
            if (key == null) throw new NullPointerException("entries[" + i + "].key");
            var value = en.getValue();
            if (value == null) throw new NullPointerException("entries[" + i + "].value");
            if (i > 0) out.append(',');
            JsonEscaper.quoteTo(out, key);
            out.append(':');
            value.appendTo(out);
            i++;
        }
        out.append('}');
        return new JsonFragment(out.toString());
    }

    // ============================================================
    // Output
    // ============================================================

    /**
     * Render a finished fragment to UTF-8 bytes.
     *
     * @param fragment finished JSON, not {@code null}
     * @return the encoded content
     */
    public static Content toContent(JsonFragment fragment) {
        return defaultRenderer.toContent(fragment);
    }

    /**
     * Render a finished fragment to UTF-8 bytes, labelled as a JSON response body.
     *
     * @param fragment finished JSON, not {@code null}
     * @return the encoded content wrapped in a {@link RepJson}
     */
    public static RepJson toRepJson(JsonFragment fragment) {
        return defaultRenderer.toRepJson(fragment);
    }
}
