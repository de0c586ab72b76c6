package com.darksite.metering.adapters;

import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.ResourceKind;

import java.time.Instant;

/**
 * One raw field observation, in the shape a single API generation returned it.
 *
 * Adapters do not validate: a missing uuid or an unparseable value is carried
 * through and rejected by the normalizer so it can be dropped and counted on
 * its own.
 *
 * @param source     generation that produced the observation
 * @param kind       resource kind observed
 * @param uuid       resource uuid, null when the wire record lacked one
 * @param name       resource display name as reported, may be null
 * @param field      adapter-local field name, e.g. {@code hypervisor_cpu_usage_ppm}
 * @param rawValue   value as read off the wire (Number, String or null)
 * @param unit       unit of {@code rawValue}
 * @param parentUuid owning cluster uuid, when the resource references one
 * @param parentName owning cluster name as referenced by the resource
 * @param observedAt time the page carrying this record was received
 */
public record AdapterRecord(
        ApiGeneration source,
        ResourceKind kind,
        String uuid,
        String name,
        String field,
        Object rawValue,
        SourceUnit unit,
        String parentUuid,
        String parentName,
        Instant observedAt
) {}
