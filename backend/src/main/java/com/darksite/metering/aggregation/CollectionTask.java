package com.darksite.metering.aggregation;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.EndpointAdapter;
import com.darksite.metering.adapters.ErrorCategory;
import com.darksite.metering.adapters.MeteringException;
import com.darksite.metering.adapters.RecordSink;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Drains one (kind, generation) route into a private buffer.
 *
 * Once sealed the task accepts nothing more, so a drain that outlives the
 * cycle budget cannot add records to a snapshot already being assembled.
 * Pages are accepted whole.
 */
@Slf4j
final class CollectionTask implements Callable<Void>, RecordSink {

    private final ResourceKind kind;
    private final EndpointAdapter adapter;

    private final List<AdapterRecord> records = new ArrayList<>();
    private MeteringException failure;
    private MeteringException incomplete;
    private boolean finished;
    private boolean sealed;

    CollectionTask(ResourceKind kind, EndpointAdapter adapter) {
        this.kind = kind;
        this.adapter = adapter;
    }

    @Override
    public Void call() {
        try {
            adapter.fetch(kind, this);
            synchronized (this) {
                finished = true;
            }
        } catch (MeteringException e) {
            fail(e);
        } catch (RuntimeException e) {
            fail(new MeteringException(ErrorCategory.PERMANENT, "Unexpected adapter failure: " + e, e));
        }
        return null;
    }

    @Override
    public void accept(AdapterRecord record) {
        acceptAll(List.of(record));
    }

    @Override
    public synchronized void acceptAll(List<AdapterRecord> page) {
        if (!sealed) {
            records.addAll(page);
        }
    }

    @Override
    public synchronized void markIncomplete(MeteringException reason) {
        if (!sealed && incomplete == null) {
            incomplete = reason;
        }
    }

    /**
     * Stop accepting records; an unfinished drain is recorded as failed with the given reason.
     */
    synchronized void seal(String unfinishedReason) {
        if (sealed) {
            return;
        }
        sealed = true;
        if (!finished && failure == null) {
            failure = new MeteringException(ErrorCategory.TRANSIENT, unfinishedReason);
        }
    }

    private synchronized void fail(MeteringException e) {
        if (sealed) {
            return;
        }
        failure = e;
        log.warn("{} drain of {} stopped after {} record(s): {}",
                adapter.getGeneration(), kind, records.size(), e.describe());
    }

    ResourceKind getKind() {
        return kind;
    }

    ApiGeneration getGeneration() {
        return adapter.getGeneration();
    }

    synchronized List<AdapterRecord> getRecords() {
        return List.copyOf(records);
    }

    /**
     * True when the drain ran to its last page without losing anything.
     */
    synchronized boolean isClean() {
        return finished && failure == null && incomplete == null;
    }

    /**
     * First error that cost this route records, if any.
     */
    synchronized MeteringException getError() {
        return failure != null ? failure : incomplete;
    }

    /**
     * True when the drain stopped on a rejected request or credential, which fails the whole kind.
     * Timeouts, interruption and an exceeded budget are not fatal.
     */
    synchronized boolean isFatal() {
        return failure != null && failure.getCategory() != ErrorCategory.TRANSIENT;
    }

    synchronized boolean isAuthExhausted() {
        return failure != null && failure.getCategory() == ErrorCategory.AUTH_EXHAUSTED;
    }
}
