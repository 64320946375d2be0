package com.wtbmonitor.market.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class ScrapeSourceUnavailableException extends RuntimeException {
    public ScrapeSourceUnavailableException(String message) {
        super(message);
    }
}
