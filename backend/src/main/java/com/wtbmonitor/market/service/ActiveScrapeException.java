package com.wtbmonitor.market.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScrapeException extends RuntimeException {
    public ActiveScrapeException(String message) {
        super(message);
    }
}
