package com.pystructure.core.analyzer;

/**
 * Naming rules applied to module-level bindings.
 */
public final class NamingConventions {

    private NamingConventions() {
        // Utility class
    }

    /**
     * Returns whether {@code name} follows the constant naming convention: a valid
     * identifier with at least one letter, every letter upper case, and no leading
     * underscore.
     *
     * <p>{@code MAX_SIZE}, {@code DEBUG} and {@code HTTP2_PORT} qualify; {@code my_const},
     * {@code MyClass}, {@code _PRIVATE} and {@code __ALL__} do not.
     *
     * @param name binding name (may be null)
     * @return true if the name reads as a constant
     */
    public static boolean isConstantName(String name) {
        if (!isIdentifier(name) || name.charAt(0) == '_') {
            return false;
        }
        boolean hasLetter = false;
        for (int i = 0; i < name.length(); ) {
            int codePoint = name.codePointAt(i);
            if (Character.isLetter(codePoint)) {
                if (!Character.isUpperCase(codePoint)) {
                    return false;
                }
                hasLetter = true;
            }
            i += Character.charCount(codePoint);
        }
        return hasLetter;
    }

    /**
     * Returns whether {@code name} is a syntactically valid Python identifier.
     *
     * @param name candidate (may be null)
     * @return true for identifiers such as {@code x}, {@code _tmp} or {@code café}
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int first = name.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first)) {
            return false;
        }
        for (int i = Character.charCount(first); i < name.length(); ) {
            int codePoint = name.codePointAt(i);
            if (!Character.isUnicodeIdentifierPart(codePoint) || Character.isIdentifierIgnorable(codePoint)) {
                return false;
            }
            i += Character.charCount(codePoint);
        }
        return true;
    }
}
