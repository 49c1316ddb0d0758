package safejson;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns finished fragments into bytes.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonRenderer renderer = JsonRenderer.builder().charset(StandardCharsets.UTF_16).build();
 * Content content = renderer.toContent(Json.list());
 * }</pre>
 *
 * @since 0.1.0
 */
@Slf4j
@Builder(toBuilder = true)
public final class JsonRenderer {

    /**
     * Output encoding. Characters the charset cannot represent become its replacement bytes.
     */
    @NonNull
    @Builder.Default
    private final Charset charset = StandardCharsets.UTF_8;

    public Charset charset() {
        return charset;
    }

    /**
     * Encode {@code fragment}.
     *
     * @param fragment finished JSON, not {@code null}
     * @return the encoded content
     */
    public Content toContent(JsonFragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        var bytes = fragment.toString().getBytes(charset);
        log.debug("Rendered JSON fragment of {} chars to {} bytes ({})", fragment.length(), bytes.length, charset);
        return new Content(bytes, charset);
    }

    /**
     * Encode {@code fragment} and label it as a JSON response body.
     *
     * @param fragment finished JSON, not {@code null}
     * @return {@link #toContent(JsonFragment)} wrapped in a {@link RepJson}
     */
    public RepJson toRepJson(JsonFragment fragment) {
        return new RepJson(toContent(fragment));
    }

    /**
     * Encode {@code fragment} and write it to {@code out}. The stream is not closed.
     *
     * @param fragment finished JSON, not {@code null}
     * @param out      destination, not {@code null}
     * @throws IOException if writing fails
     */
    public void writeTo(JsonFragment fragment, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        toContent(fragment).writeTo(out);
    }
}
