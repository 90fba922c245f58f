package space.ketterling.views.query;

import space.ketterling.views.errors.InvalidFilterException;

import java.util.Locale;

/**
 * Result encoding: one buffered JSON document or newline-delimited records.
 */
public enum OutputFormat {
    JSON("json"),
    NDJSON("ndjson");

    private final String wireName;

    OutputFormat(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses {@code json} / {@code ndjson}; blank means json.
     */
    public static OutputFormat parse(String raw) {
        if (raw == null || raw.isBlank())
            return JSON;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.wireName.equals(v))
                return f;
        }
        throw new InvalidFilterException(raw, "Unsupported format '" + raw + "' (expected json or ndjson)");
    }
}
