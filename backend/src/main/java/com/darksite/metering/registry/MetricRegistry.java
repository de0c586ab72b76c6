package com.darksite.metering.registry;

import com.darksite.metering.domain.model.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot currently served.
 *
 * Publishing swaps one reference, so a reader sees either the old or the new
 * snapshot in full. When two cycles overlap, the snapshot with the higher
 * version wins regardless of which finishes last.
 */
@Component
@Slf4j
public class MetricRegistry {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.empty());

    /**
     * Replace the served snapshot unless a newer one is already published.
     *
     * @return true when the snapshot became the served one
     */
    public boolean publish(Snapshot snapshot) {
        Snapshot previous = current.getAndAccumulate(snapshot,
                (served, candidate) -> candidate.getVersion() > served.getVersion() ? candidate : served);
        boolean replaced = snapshot.getVersion() > previous.getVersion();
        if (replaced) {
            log.debug("Published snapshot {} ({} records)", snapshot.getVersion(), snapshot.getRecords().size());
        } else {
            log.info("Snapshot {} not published, version {} is already served",
                    snapshot.getVersion(), previous.getVersion());
        }
        return replaced;
    }

    /**
     * Latest published snapshot, or {@link Snapshot#empty()} before the first cycle.
     */
    public Snapshot current() {
        return current.get();
    }
}
