package com.perfsentinel.core.persistence;

import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.ScalingRecommendation;

import java.util.List;

/**
 * Items handed to a {@link PersistenceSink} in one write.
 *
 * @since 1.0.0
 */
public final class PersistenceBatch {

    private final List<Metric> metrics;
    private final List<Alert> alerts;
    private final List<ScalingRecommendation> recommendations;
    private final List<HealthReport> reports;

    public PersistenceBatch(List<Metric> metrics, List<Alert> alerts,
            List<ScalingRecommendation> recommendations, List<HealthReport> reports) {
        this.metrics = List.copyOf(metrics);
        this.alerts = List.copyOf(alerts);
        this.recommendations = List.copyOf(recommendations);
        this.reports = List.copyOf(reports);
    }

    public List<Metric> getMetrics() {
        return metrics;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public List<ScalingRecommendation> getRecommendations() {
        return recommendations;
    }

    public List<HealthReport> getReports() {
        return reports;
    }

    public boolean isEmpty() {
        return metrics.isEmpty() && alerts.isEmpty() && recommendations.isEmpty() && reports.isEmpty();
    }

    public int size() {
        return metrics.size() + alerts.size() + recommendations.size() + reports.size();
    }

    @Override
    public String toString() {
        return "PersistenceBatch{metrics=" + metrics.size() + ", alerts=" + alerts.size()
                + ", recommendations=" + recommendations.size() + ", reports=" + reports.size() + '}';
    }
}
