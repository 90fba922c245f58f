package space.ketterling.views.errors;

/**
 * Base class of the failures the forecast service reports on purpose.
 */
public abstract class ForecastApiException extends RuntimeException {

    protected ForecastApiException(String message) {
        super(message);
    }

    protected ForecastApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable code used in JSON error bodies.
     */
    public abstract String errorCode();
}
