package safejson;

import java.util.Objects;

/**
 * {@link Content} labelled as a JSON response body. Holds the same instance, nothing is copied.
 *
 * @since 0.1.0
 */
public record RepJson(Content content) {

    public static final String MIME_TYPE = "application/json";

    public RepJson {
        Objects.requireNonNull(content, "content");
    }

    /**
     * @return e.g. {@code application/json; charset=UTF-8}
     */
    public String contentType() {
        return MIME_TYPE + "; charset=" + content.charset().name();
    }
}
