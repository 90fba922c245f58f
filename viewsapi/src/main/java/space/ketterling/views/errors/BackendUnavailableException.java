package space.ketterling.views.errors;

/**
 * A storage backend could not be read or written within the retry budget.
 */
public class BackendUnavailableException extends ForecastApiException {
    private final String backendId;

    public BackendUnavailableException(String backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }

    public String backendId() {
        return backendId;
    }

    @Override
    public String errorCode() {
        return "backend_unavailable";
    }
}
