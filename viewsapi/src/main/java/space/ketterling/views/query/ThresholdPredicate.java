package space.ketterling.views.query;

import space.ketterling.views.errors.InvalidFilterException;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A numeric condition on one metric, e.g. {@code prob_100>=0.3}.
 *
 * <p>
 * Records that do not carry the metric never match.
 * </p>
 */
public record ThresholdPredicate(MetricName metric, Comparison op, double bound) {

    private static final Pattern TOKEN = Pattern.compile("^\\s*([A-Za-z0-9_]+)\\s*(>=|<=|==|>|<)\\s*(.*?)\\s*$");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    /**
     * Supported comparison operators.
     */
    public enum Comparison {
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<="),
        EQ("==");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean test(double value, double bound) {
            return switch (this) {
                case GT -> value > bound;
                case GE -> value >= bound;
                case LT -> value < bound;
                case LE -> value <= bound;
                case EQ -> value == bound;
            };
        }

        static Comparison fromSymbol(String s) {
            for (Comparison c : values()) {
                if (c.symbol.equals(s))
                    return c;
            }
            throw new IllegalArgumentException("Unknown operator " + s);
        }
    }

    public ThresholdPredicate {
        if (metric == null || op == null)
            throw new IllegalArgumentException("metric and op are required");
        if (!Double.isFinite(bound))
            throw new InvalidFilterException(String.valueOf(bound), "Threshold bound must be a finite number");
    }

    /**
     * Parses {@code <metric><op><number>}.
     *
     * @throws InvalidFilterException naming the token when any part is
     *                                malformed
     */
    public static ThresholdPredicate parse(String token) {
        if (token == null || token.isBlank())
            throw new InvalidFilterException(String.valueOf(token), "Empty metric filter");
        Matcher m = TOKEN.matcher(token);
        if (!m.matches())
            throw new InvalidFilterException(token,
                    "Malformed metric filter '" + token + "' (expected <metric><op><number>, op one of > >= < <= ==)");

        MetricName metric = MetricName.fromWire(m.group(1))
                .orElseThrow(() -> new InvalidFilterException(token,
                        "Unknown metric '" + m.group(1) + "' in filter '" + token + "'"));

        String operand = m.group(3);
        if (!NUMBER.matcher(operand).matches())
            throw new InvalidFilterException(token, "Malformed operand '" + operand + "' in filter '" + token + "'");
        double bound = Double.parseDouble(operand);
        if (!Double.isFinite(bound))
            throw new InvalidFilterException(token, "Operand out of range in filter '" + token + "'");

        return new ThresholdPredicate(metric, Comparison.fromSymbol(m.group(2)), bound);
    }

    /**
     * Evaluates against the full-precision metric value.
     */
    public boolean test(ForecastRecord r) {
        OptionalDouble v = r.metrics().get(metric);
        return v.isPresent() && op.test(v.getAsDouble(), bound);
    }

    @Override
    public String toString() {
        return metric.wireName() + op.symbol() + bound;
    }
}
