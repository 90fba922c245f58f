package space.ketterling.views.errors;

/**
 * Malformed or contradictory query parameters. Client error, never retried.
 */
public class InvalidFilterException extends ForecastApiException {
    private final String token;

    public InvalidFilterException(String token, String message) {
        super(message);
        this.token = token;
    }

    /**
     * The offending parameter value as the caller sent it.
     */
    public String token() {
        return token;
    }

    @Override
    public String errorCode() {
        return "invalid_filter";
    }
}
