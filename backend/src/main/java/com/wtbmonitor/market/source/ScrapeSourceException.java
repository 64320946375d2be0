package com.wtbmonitor.market.source;

public class ScrapeSourceException extends RuntimeException {
    public ScrapeSourceException(String message) {
        super(message);
    }

    public ScrapeSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
