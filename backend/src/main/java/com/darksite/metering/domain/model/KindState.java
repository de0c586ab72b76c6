package com.darksite.metering.domain.model;

import java.util.Optional;

/**
 * Completeness of one resource kind within a snapshot.
 *
 * @param status         overall outcome for the kind
 * @param error          first error recorded for the kind, if any
 * @param recordCount    metric records retained for the kind
 * @param droppedRecords adapter records dropped as malformed or unmappable
 */
public record KindState(KindStatus status, String error, int recordCount, int droppedRecords) {

    public static KindState complete(int recordCount, int droppedRecords) {
        return new KindState(KindStatus.COMPLETE, null, recordCount, droppedRecords);
    }

    public static KindState failed(String error) {
        return new KindState(KindStatus.FAILED, error, 0, 0);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
