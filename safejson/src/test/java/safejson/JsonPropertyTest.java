package safejson;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.Tuple;
import tools.jackson.databind.json.JsonMapper;

/**
 * Property checks against a real JSON parser.
 */
class JsonPropertyTest {

    private static final JsonMapper mapper = JsonMapper.builder().build();

    // Surrogates only appear as valid pairs, lone ones cannot be encoded.
    @Provide
    Arbitrary<String> texts() {
        Arbitrary<String> bmp = Arbitraries.strings()
                .withCharRange('\u0000', '\ud7ff')
                .withCharRange('\ue000', '\ufffd')
                .ofLength(1);
        Arbitrary<String> supplementary = Arbitraries.integers()
                .between(Character.MIN_SUPPLEMENTARY_CODE_POINT, Character.MAX_CODE_POINT)
                .map(cp -> Character.toString(cp));
        return Arbitraries.frequencyOf(Tuple.of(4, bmp), Tuple.of(1, supplementary))
                .list()
                .ofMaxSize(48)
                .map(parts -> String.join("", parts));
    }

    @Provide
    Arbitrary<JsonFragment> fragments() {
        return texts().list().ofMaxSize(4).flatMap(values -> texts().map(key -> {
            var scalars = values.stream().map(v -> Json.scalar(Html.preEscaped(v))).toList();
            return values.size() % 2 == 0 ? Json.list(scalars) : Json.map(Json.entry(key, Json.list(scalars)));
        }));
    }

    @Property
    void escapedTextParsesBackToItself(@ForAll("texts") String text) {
        var parsed = mapper.readValue("\"" + JsonEscaper.escape(text) + "\"", String.class);

        assertThat(parsed).isEqualTo(text);
    }

    @Property
    void keysAndValuesSurviveRendering(@ForAll("texts") String key, @ForAll("texts") String value) {
        var json = Json.toContent(Json.map(Json.entry(key, Json.scalar(Html.preEscaped(value)))))
                .asString();

        Map<?, ?> parsed = mapper.readValue(json, Map.class);
        assertThat(parsed).hasSize(1);
        assertThat(parsed.get(key)).isEqualTo(value);
    }

    @Property
    void emptyIsIdentity(@ForAll("fragments") JsonFragment x) {
        assertThat(JsonFragment.empty().append(x)).isEqualTo(x);
        assertThat(x.append(JsonFragment.empty())).isEqualTo(x);
    }

    @Property
    void appendIsAssociative(
            @ForAll("fragments") JsonFragment x, @ForAll("fragments") JsonFragment y, @ForAll("fragments") JsonFragment z) {
        var left = x.append(y).append(z);
        var right = x.append(y.append(z));

        assertThat(Json.toContent(left)).isEqualTo(Json.toContent(right));
        assertThat(JsonFragment.concat(List.of(x, y, z))).isEqualTo(left);
    }

    @Property
    void listsParseWithElementsInOrder(@ForAll("texts") String a, @ForAll("texts") String b) {
        var json = Json.list(Json.scalar(Html.preEscaped(a)), Json.scalar(Html.preEscaped(b)))
                .toString();

        var parsed = mapper.readValue(json, String[].class);
        assertThat(parsed).containsExactly(a, b);
    }

    @Property
    void supplementaryCharactersPassThroughAsPairs(
            @ForAll("supplementaryCodePoints") int codePoint, @ForAll("texts") String around) {
        var text = around + Character.toString(codePoint) + around;

        var escaped = JsonEscaper.escape(text);

        assertThat(escaped).contains(Character.toString(codePoint));
        assertThat(mapper.readValue("\"" + escaped + "\"", String.class)).isEqualTo(text);
    }

    @Provide
    Arbitrary<Integer> supplementaryCodePoints() {
        return Arbitraries.integers().between(Character.MIN_SUPPLEMENTARY_CODE_POINT, Character.MAX_CODE_POINT);
    }
}
