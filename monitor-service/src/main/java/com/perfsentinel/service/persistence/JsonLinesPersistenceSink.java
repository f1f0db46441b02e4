package com.perfsentinel.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.HealthReport;
import com.perfsentinel.core.model.Metric;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.persistence.PersistenceBatch;
import com.perfsentinel.core.persistence.PersistenceException;
import com.perfsentinel.core.persistence.PersistenceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PersistenceSink} that appends one JSON object per line to one file
 * per table under a directory.
 *
 * <h3>Tables</h3>
 * <ul>
 * <li>{@value #METRICS_FILE}: name, kind, value, ts, tags</li>
 * <li>{@value #ALERTS_FILE}: id, rule, severity, message, ts, resolved,
 * resolved_ts</li>
 * <li>{@value #RECOMMENDATIONS_FILE}: id, action, resource, cur, rec,
 * confidence, reasoning, ts, applied</li>
 * <li>{@value #REPORTS_FILE}: id, start, end, summary_json, score, ts</li>
 * </ul>
 * <p>
 * An alert is written once when it triggers and again when it resolves; the
 * later line for an id is its current state. {@code summary_json} holds the
 * whole report serialised as JSON.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesPersistenceSink implements PersistenceSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesPersistenceSink.class);

    public static final String METRICS_FILE = "metrics.jsonl";
    public static final String ALERTS_FILE = "alerts.jsonl";
    public static final String RECOMMENDATIONS_FILE = "scaling_recommendations.jsonl";
    public static final String REPORTS_FILE = "reports.jsonl";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonLinesPersistenceSink(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void write(PersistenceBatch batch) throws PersistenceException {
        Objects.requireNonNull(batch, "batch must not be null");
        List<String> metricLines = new ArrayList<>();
        List<String> alertLines = new ArrayList<>();
        List<String> recommendationLines = new ArrayList<>();
        List<String> reportLines = new ArrayList<>();
        try {
            for (Metric m : batch.getMetrics()) {
                metricLines.add(mapper.writeValueAsString(metricRow(m)));
            }
            for (Alert a : batch.getAlerts()) {
                alertLines.add(mapper.writeValueAsString(alertRow(a)));
            }
            for (ScalingRecommendation r : batch.getRecommendations()) {
                recommendationLines.add(mapper.writeValueAsString(recommendationRow(r)));
            }
            for (HealthReport h : batch.getReports()) {
                reportLines.add(mapper.writeValueAsString(reportRow(h)));
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialise " + batch, e);
        }

        try {
            Files.createDirectories(directory);
            append(METRICS_FILE, metricLines);
            append(ALERTS_FILE, alertLines);
            append(RECOMMENDATIONS_FILE, recommendationLines);
            append(REPORTS_FILE, reportLines);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + batch + " to " + directory, e);
        }
        LOG.debug("Appended {} to {}", batch, directory);
    }

    private void append(String file, List<String> lines) throws IOException {
        if (lines.isEmpty()) {
            return;
        }
        Files.write(directory.resolve(file), lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public Path getDirectory() {
        return directory;
    }

    // ---------------------------------------------------------------
    // Rows
    // ---------------------------------------------------------------

    private static Map<String, Object> metricRow(Metric m) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", m.getName());
        row.put("kind", m.getKind().name().toLowerCase(Locale.ROOT));
        row.put("value", m.getValue());
        row.put("ts", m.getTimestamp());
        row.put("tags", m.getTags().asMap());
        return row;
    }

    private static Map<String, Object> alertRow(Alert a) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", a.getId());
        row.put("rule", a.getRuleKey());
        row.put("severity", a.getSeverity().name().toLowerCase(Locale.ROOT));
        row.put("message", a.getMessage());
        row.put("ts", a.getTriggeredAt());
        row.put("resolved", a.isResolved());
        row.put("resolved_ts", a.getResolvedAt());
        return row;
    }

    private static Map<String, Object> recommendationRow(ScalingRecommendation r) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", r.getId());
        row.put("action", r.getAction().name().toLowerCase(Locale.ROOT));
        row.put("resource", r.getResourceType());
        row.put("cur", r.getCurrentCapacity());
        row.put("rec", r.getRecommendedCapacity());
        row.put("confidence", r.getConfidence());
        row.put("reasoning", r.getReasoning());
        row.put("ts", r.getTimestamp());
        // recommendations are advisory; applying them is the caller's job
        row.put("applied", false);
        return row;
    }

    private Map<String, Object> reportRow(HealthReport h) throws JsonProcessingException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", h.getId());
        row.put("start", h.getStartTime());
        row.put("end", h.getEndTime());
        row.put("summary_json", mapper.writeValueAsString(h));
        row.put("score", h.getHealthScore());
        row.put("ts", h.getGeneratedAt());
        return row;
    }
}
