package com.wtbmonitor.market.source;

import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.state.ProgressChannel;

import java.util.List;
import java.util.Map;

/**
 * Producer of raw, untyped items for one side of the comparison.
 */
public interface ScrapeSource {

    ScrapeKind kind();

    String originLabel();

    boolean isAvailable();

    /**
     * Runs to completion on the calling thread. Progress lines are published to {@code progress};
     * the caller owns closing it.
     */
    List<Map<String, Object>> fetch(ProgressChannel progress);
}
