package work.lcod.scriptgen.codegen;

import java.util.regex.Pattern;

/**
 * Turns display titles into script identifiers: {@code "get-child item"} becomes {@code "GetChildItem"}.
 */
public final class IdentifierSanitizer {
    public static final String FALLBACK = "Result";

    private static final Pattern SEPARATORS = Pattern.compile("[-\\s._]+");
    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9]");

    private IdentifierSanitizer() {}

    public static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return FALLBACK;
        }
        var builder = new StringBuilder();
        for (var fragment : SEPARATORS.split(raw.trim())) {
            if (fragment.isEmpty()) {
                continue;
            }
            builder.append(Character.toUpperCase(fragment.charAt(0))).append(fragment, 1, fragment.length());
        }
        var cleaned = INVALID.matcher(builder).replaceAll("");
        return cleaned.isEmpty() ? FALLBACK : cleaned;
    }

    /** Alphanumeric characters of a block identity, used as a uniqueness suffix. */
    static String identitySuffix(String id, int length) {
        var cleaned = INVALID.matcher(id == null ? "" : id).replaceAll("");
        if (cleaned.isEmpty()) {
            cleaned = "0";
        }
        return cleaned.length() <= length ? cleaned : cleaned.substring(0, length);
    }
}
