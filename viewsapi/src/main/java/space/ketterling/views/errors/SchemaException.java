package space.ketterling.views.errors;

import java.util.List;

/**
 * A batch failed validation. Carries every violation found, not just the first.
 */
public class SchemaException extends ForecastApiException {
    private final List<String> violations;

    public SchemaException(List<String> violations) {
        super(summarize(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    @Override
    public String errorCode() {
        return "schema_error";
    }

    private static String summarize(List<String> violations) {
        StringBuilder sb = new StringBuilder();
        sb.append(violations.size()).append(" schema violation(s)");
        int shown = Math.min(violations.size(), 20);
        for (int i = 0; i < shown; i++) {
            sb.append("\n  - ").append(violations.get(i));
        }
        if (violations.size() > shown)
            sb.append("\n  ... ").append(violations.size() - shown).append(" more");
        return sb.toString();
    }
}
