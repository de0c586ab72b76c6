package com.darksite.metering.normalization;

import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.MetricRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which API generation is authoritative when two report the same series.
 *
 * The order is configured per metric name ({@code metering.precedence}); metrics
 * without an entry use {@code metering.default-precedence}. Generations missing
 * from an order rank below all listed ones.
 *
 * Two observations of one series from the same generation are a defect in the
 * remote data rather than a conflict: the first is kept and the rest are counted.
 */
@Component
@Slf4j
public class SourcePrecedence {

    private final Map<String, List<ApiGeneration>> perMetric;
    private final List<ApiGeneration> defaultOrder;

    public SourcePrecedence(MeteringProperties properties) {
        this.perMetric = Map.copyOf(properties.getPrecedence());
        this.defaultOrder = List.copyOf(properties.getDefaultPrecedence());
    }

    /**
     * Rank of a generation for a metric; lower wins.
     */
    public int rank(String metricName, ApiGeneration generation) {
        List<ApiGeneration> order = perMetric.getOrDefault(metricName, defaultOrder);
        int index = order.indexOf(generation);
        return index >= 0 ? index : order.size();
    }

    /**
     * Collapses records sharing a series key to the most authoritative one.
     * Survivors keep the position of the first record seen for their series.
     */
    public Reconciliation reconcile(List<MetricRecord> records) {
        var winners = new LinkedHashMap<MetricRecord.SeriesKey, MetricRecord>();
        int overridden = 0;
        int duplicates = 0;

        for (MetricRecord candidate : records) {
            MetricRecord.SeriesKey key = candidate.seriesKey();
            MetricRecord current = winners.get(key);
            if (current == null) {
                winners.put(key, candidate);
                continue;
            }
            if (current.source() == candidate.source()) {
                duplicates++;
                log.warn("Duplicate {} series {}{} from {}, keeping first observation",
                        candidate.resource().kind().getDisplayName(), key.metricName(), key.labels(),
                        candidate.source());
                continue;
            }
            overridden++;
            if (rank(key.metricName(), candidate.source()) < rank(key.metricName(), current.source())) {
                log.debug("{} from {} overrides {} ({} vs {})", key.metricName(), candidate.source(),
                        current.source(), candidate.value(), current.value());
                winners.put(key, candidate);
            }
        }
        return new Reconciliation(new ArrayList<>(winners.values()), overridden, duplicates);
    }

    /**
     * @param records    one record per series
     * @param overridden records discarded because another generation outranked them
     * @param duplicates records discarded as same-generation repeats
     */
    public record Reconciliation(List<MetricRecord> records, int overridden, int duplicates) {}
}
