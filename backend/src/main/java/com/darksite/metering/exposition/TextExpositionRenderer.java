package com.darksite.metering.exposition;

import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.Snapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Renders a snapshot as exposition text, one {@code name{k="v",...} value} line per record.
 */
@Component
public class TextExpositionRenderer {

    public String render(Snapshot snapshot) {
        var out = new StringBuilder(snapshot.getRecords().size() * 96);
        for (MetricRecord record : snapshot.getRecords()) {
            out.append(record.metricName());
            if (record.labels().size() > 0) {
                out.append('{');
                boolean[] first = {true};
                record.labels().forEach((key, value) -> {
                    if (!first[0]) {
                        out.append(',');
                    }
                    first[0] = false;
                    out.append(key).append("=\"").append(escape(value)).append('"');
                });
                out.append('}');
            }
            out.append(' ').append(formatValue(record.value())).append('\n');
        }
        return out.toString();
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
