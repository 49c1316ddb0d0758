package safejson;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collector;
import org.jspecify.annotations.Nullable;

/**
 * An immutable piece of syntactically complete JSON text.
 *
 * <p> Fragments can only be created by {@link Json} and by composing existing fragments, so their
 * text is always valid JSON. Composition is plain concatenation: {@link #empty()} is the identity
 * and {@link #append(JsonFragment)} is associative.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonFragment a = Json.list();
 * JsonFragment b = JsonFragment.empty().append(a);
 * // b.equals(a) -> true
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonFragment {

    private static final JsonFragment EMPTY = new JsonFragment("");

    private final String json;

    // Callers must pass escaped or fixed delimiter text only.
    JsonFragment(String json) {
        this.json = json;
    }

    /**
     * @return the fragment holding no text
     */
    public static JsonFragment empty() {
        return EMPTY;
    }

    /**
     * Concatenate this fragment with {@code other}.
     *
     * @param other fragment to put after this one, not {@code null}
     * @return the combined fragment
     */
    public JsonFragment append(JsonFragment other) {
        Objects.requireNonNull(other, "other");
        if (other.json.isEmpty()) return this;
        if (json.isEmpty()) return other;
        return new JsonFragment(json.concat(other.json));
    }

    /**
     * Concatenate all fragments in order.
     *
     * @param fragments fragments, not {@code null}
     * @return the combined fragment, {@link #empty()} if there are none
     */
    public static JsonFragment concat(JsonFragment... fragments) {
        Objects.requireNonNull(fragments, "fragments");
        return concat(Arrays.asList(fragments));
    }

    /**
     * Concatenate all fragments in iteration order, in time linear in the total length.
     *
     * @param fragments fragments, not {@code null}
     * @return the combined fragment, {@link #empty()} if there are none
     */
    public static JsonFragment concat(Iterable<JsonFragment> fragments) {
        Objects.requireNonNull(fragments, "fragments");
        var sb = new StringBuilder();
        int i = 0;
        for (var f : fragments) {
            if (f == null) throw new NullPointerException("fragments[" + i + "]");
            f.appendTo(sb);
            i++;
        }
        return of(sb);
    }

    /**
     * A collector concatenating stream elements in encounter order.
     *
     * @return collector producing {@link #empty()} for an empty stream
     */
    public static Collector<JsonFragment, ?, JsonFragment> concatenating() {
        return Collector.of(
                StringBuilder::new,
                (StringBuilder sb, JsonFragment f) -> Objects.requireNonNull(f, "fragment").appendTo(sb),
                StringBuilder::append,
                JsonFragment::of);
    }

    public boolean isEmpty() {
        return json.isEmpty();
    }

    /**
     * @return number of chars of JSON text
     */
    public int length() {
        return json.length();
    }

    void appendTo(StringBuilder out) {
        out.append(json);
    }

    static JsonFragment of(StringBuilder sb) {
        return sb.length() == 0 ? EMPTY : new JsonFragment(sb.toString());
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonFragment that)) return false;
        return json.equals(that.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    /**
     * @return the JSON text of this fragment
     */
    @Override
    public String toString() {
        return json;
    }
}
