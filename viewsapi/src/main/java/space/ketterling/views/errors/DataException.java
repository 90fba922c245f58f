package space.ketterling.views.errors;

import java.time.YearMonth;

/**
 * Malformed raw input to summarization, located by grid cell and month.
 */
public class DataException extends ForecastApiException {
    private final Integer gridId;
    private final YearMonth month;

    public DataException(Integer gridId, YearMonth month, String message) {
        super(locate(gridId, month) + message);
        this.gridId = gridId;
        this.month = month;
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
        this.gridId = null;
        this.month = null;
    }

    public Integer gridId() {
        return gridId;
    }

    public YearMonth month() {
        return month;
    }

    @Override
    public String errorCode() {
        return "data_error";
    }

    private static String locate(Integer gridId, YearMonth month) {
        if (gridId == null && month == null)
            return "";
        return "grid_id=" + gridId + " month=" + month + ": ";
    }
}
