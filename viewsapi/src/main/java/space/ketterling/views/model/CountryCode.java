package space.ketterling.views.model;

/**
 * Normalizes numeric country codes to their zero-padded external form.
 */
public final class CountryCode {
    /**
     * Utility class; no instances.
     */
    private CountryCode() {
    }

    /**
     * Returns the zero-padded code ("24" -> "024", "800.0" -> "800"), null for
     * blank input, or the trimmed input unchanged when it is not numeric.
     */
    public static String normalize(String raw) {
        if (raw == null)
            return null;
        String v = raw.trim();
        if (v.isEmpty())
            return null;
        if (v.endsWith(".0"))
            v = v.substring(0, v.length() - 2);
        if (!v.chars().allMatch(Character::isDigit))
            return v;
        if (v.length() >= 3)
            return v;
        return "0".repeat(3 - v.length()) + v;
    }

    /**
     * Normalizes a numeric cell value (e.g. an int column) or a string.
     */
    public static String normalize(Object raw) {
        if (raw == null)
            return null;
        if (raw instanceof Number n)
            return normalize(Long.toString(n.longValue()));
        return normalize(raw.toString());
    }

    /**
     * True for a three digit code.
     */
    public static boolean isValid(String code) {
        return code != null && code.length() == 3 && code.chars().allMatch(Character::isDigit);
    }
}
