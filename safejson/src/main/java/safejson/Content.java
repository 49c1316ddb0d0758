package safejson;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Encoded JSON ready to hand to a transport.
 *
 * <p> Only {@link JsonRenderer} creates instances, so the bytes are always the encoding of a
 * {@link JsonFragment}.
 *
 * @since 0.1.0
 */
public final class Content {

    private final byte[] bytes;
    private final Charset charset;

    Content(byte[] bytes, Charset charset) {
        this.bytes = bytes;
        this.charset = charset;
    }

    public int length() {
        return bytes.length;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * @return a copy of the encoded bytes
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * @return the bytes decoded with {@link #charset()}
     */
    public String asString() {
        return new String(bytes, charset);
    }

    /**
     * Write the bytes to {@code out} in order. The stream is not flushed or closed.
     *
     * @param out destination, not {@code null}
     * @throws IOException if writing fails
     */
    public void writeTo(OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        out.write(bytes);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof Content that)) return false;
        return charset.equals(that.charset) && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * charset.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Content[" + bytes.length + " bytes, " + charset + "]";
    }
}
