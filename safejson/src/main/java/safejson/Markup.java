package safejson;

/**
 * Text that is already safe against HTML-entity injection.
 *
 * <p> {@link Json#scalar(Markup)} only needs the rendered text. Template engines plug in here;
 * {@link Html} covers the simple cases.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Markup {

    /**
     * @return the raw rendered text, never {@code null}
     */
    String render();
}
