package com.darksite.metering.adapters;

import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.ResourceKind;

import java.util.Set;

/**
 * Port for one control-plane API generation.
 *
 * ADAPTER PATTERN:
 * Each generation implements this interface and knows exactly one wire shape
 * and one pagination convention. Adapters emit adapter-local records; unit
 * conversion and cross-generation precedence belong to the normalizer.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Drain pagination completely, requesting pages strictly in sequence
 * 2. Hand records to the sink page by page, never a partially parsed page
 * 3. On an error mid-drain, throw; records already handed over are kept
 * 4. Authentication goes through the session manager, never around it
 */
public interface EndpointAdapter {

    /**
     * Returns the API generation this adapter speaks.
     */
    ApiGeneration getGeneration();

    /**
     * Resource kinds this adapter can populate.
     */
    Set<ResourceKind> getSupportedKinds();

    /**
     * Fetch every record of a kind into the sink.
     *
     * Restartable: each call starts again from the first page.
     *
     * @param kind resource kind to fetch, one of {@link #getSupportedKinds()}
     * @param sink destination for drained records
     * @throws MeteringException when draining stops before the last page
     */
    void fetch(ResourceKind kind, RecordSink sink);
}
