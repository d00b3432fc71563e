package com.todayatsg.backend.exception;

import com.todayatsg.backend.model.enums.FetchFailureReason;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Network or HTTP failure while fetching a source page.
 */
@Getter
public class FetchException extends IngestionException {

    private final String url;
    private final FetchFailureReason reason;
    private final Integer httpStatus;

    public FetchException(String url, FetchFailureReason reason, Integer httpStatus, String message, Throwable cause) {
        super("FETCH_ERROR", HttpStatus.BAD_GATEWAY, message, cause);
        this.url = url;
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public static FetchException httpStatus(String url, int status) {
        return new FetchException(url, FetchFailureReason.HTTP_STATUS, status,
                "HTTP " + status + " fetching " + url, null);
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(url, FetchFailureReason.TIMEOUT, null,
                "Timeout fetching " + url + ": " + cause.getMessage(), cause);
    }

    public static FetchException io(String url, Throwable cause) {
        return new FetchException(url, FetchFailureReason.IO, null,
                "I/O error fetching " + url + ": " + cause.getMessage(), cause);
    }

    public static FetchException robotsDisallowed(String url) {
        return new FetchException(url, FetchFailureReason.ROBOTS_DISALLOWED, null,
                "robots.txt disallows " + url, null);
    }

    /**
     * Timeouts, I/O errors, 5xx and 429 are worth another attempt; everything else is final.
     */
    public boolean isTransient() {
        return switch (reason) {
            case TIMEOUT, IO -> true;
            case HTTP_STATUS -> httpStatus != null && (httpStatus >= 500 || httpStatus == 429);
            case ROBOTS_DISALLOWED -> false;
        };
    }
}
