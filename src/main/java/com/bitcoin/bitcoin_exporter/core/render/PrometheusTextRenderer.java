package com.bitcoin.bitcoin_exporter.core.render;

import com.bitcoin.bitcoin_exporter.core.model.PodMetrics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Writes pod metrics in the Prometheus text exposition format (version 0.0.4).
 * HELP and TYPE lines are repeated in front of every sample, one block per pod.
 */
@Component
public class PrometheusTextRenderer {

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    static final String POD_LABEL = "pod";

    public String render(List<PodMetrics> podMetrics) {
        StringBuilder out = new StringBuilder();
        for (PodMetrics metrics : podMetrics) {
            String labels = "{" + POD_LABEL + "=\"" + escapeLabelValue(metrics.getPod()) + "\"}";
            for (MetricFamily family : MetricFamily.values()) {
                out.append("# HELP ").append(family.getMetricName()).append(' ').append(family.getHelp()).append('\n');
                out.append("# TYPE ").append(family.getMetricName()).append(' ').append(MetricFamily.TYPE).append('\n');
                out.append(family.getMetricName()).append(labels).append(' ')
                        .append(formatValue(family.valueOf(metrics))).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Integers stay integers, floating point values are written as plain decimals with a fractional part.
     */
    static String formatValue(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "+Inf" : "-Inf";
            }
            BigDecimal decimal = BigDecimal.valueOf(d).stripTrailingZeros();
            // Always keep one fractional digit so 5.5e13 reads 55000000000000.0
            return decimal.setScale(Math.max(1, decimal.scale())).toPlainString();
        }
        return Long.toString(value.longValue());
    }

    static String escapeLabelValue(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }
}
