/**
 * Injection-proof JSON output.
 *
 * <p> Build values with {@link safejson.Json}, combine them as {@link safejson.JsonFragment}s and
 * finish with {@link safejson.Json#toContent(safejson.JsonFragment)}.
 */
@NullMarked
package safejson;

import org.jspecify.annotations.NullMarked;
