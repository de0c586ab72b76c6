package com.darksite.metering.adapters;

import java.util.List;

/**
 * Receives adapter records as pages are drained.
 *
 * Records handed over stay valid even if draining later fails, so a
 * cycle aborted mid-pagination still reports what it obtained.
 */
public interface RecordSink {

    void accept(AdapterRecord record);

    /**
     * Hands over one fully parsed page. Sinks that can be closed mid-cycle
     * take the page as a whole or not at all.
     */
    default void acceptAll(List<AdapterRecord> records) {
        records.forEach(this::accept);
    }

    /**
     * Notes a failure that cost some records without stopping the drain,
     * e.g. one file server whose stats could not be read.
     */
    void markIncomplete(MeteringException reason);
}
