package com.perfsentinel.core.alerting;

import com.perfsentinel.core.model.Alert;
import com.perfsentinel.core.model.AlertRule;
import com.perfsentinel.core.model.MetricStats;
import com.perfsentinel.core.recorder.MetricRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Evaluates {@link AlertRule}s against windowed statistics and tracks the
 * lifecycle of the resulting {@link Alert}s.
 *
 * <h3>Evaluation</h3>
 * <p>
 * For every rule, {@link #evaluate()} reads
 * {@code stats(metricName, timeWindow)} from the {@link MetricRecorder}. A
 * window with no samples, or with fewer than {@code minSamples}, is skipped
 * without error. The window <em>mean</em> is compared against the threshold.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Per rule key: {@code NO_ALERT → ACTIVE} when the condition holds,
 * {@code ACTIVE → RESOLVED} when it no longer does, and back to
 * {@code ACTIVE} on a later trigger once the rule's cooldown since the last
 * resolution has elapsed. At most one alert is active per rule key. Every
 * trigger gets a fresh id ({@code ruleKey#occurrence}); the resolution of an
 * alert keeps the id of its trigger.
 * </p>
 *
 * <h3>Notification</h3>
 * <p>
 * Subscribers are called synchronously, on the evaluating thread, after the
 * state change is recorded. A failing subscriber is logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    /** Default number of alerts retained in history. */
    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    private final MetricRecorder recorder;
    private final Clock clock;
    private final int historyLimit;

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final List<AlertSubscriber> subscribers = new CopyOnWriteArrayList<>();

    // Lifecycle state, guarded by stateLock
    private final Object stateLock = new Object();
    private final Map<String, Alert> activeByRuleKey = new LinkedHashMap<>();
    private final Map<String, Integer> occurrences = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastResolvedAt = new ConcurrentHashMap<>();
    private final LinkedHashMap<String, Alert> history = new LinkedHashMap<>();

    public AlertEngine(MetricRecorder recorder, Clock clock, int historyLimit) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be >= 1, got: " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    public AlertEngine(MetricRecorder recorder, Clock clock) {
        this(recorder, clock, DEFAULT_HISTORY_LIMIT);
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    /**
     * Register a rule, replacing any rule with the same rule key.
     *
     * @param rule validated rule; must not be {@code null}
     */
    public void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        AlertRule previous = rules.put(rule.getRuleKey(), rule);
        if (previous == null) {
            LOG.info("Registered alert rule {}", rule);
        } else if (!previous.equals(rule)) {
            LOG.info("Replaced alert rule {} (was {})", rule, previous);
        }
    }

    /**
     * Remove a rule. An alert still active for it is resolved and delivered to
     * subscribers.
     *
     * @return {@code true} if a rule was removed
     */
    public boolean removeRule(String ruleKey) {
        Objects.requireNonNull(ruleKey, "ruleKey must not be null");
        AlertRule removed = rules.remove(ruleKey);
        if (removed == null) {
            return false;
        }
        Alert resolved;
        synchronized (stateLock) {
            Alert active = activeByRuleKey.remove(ruleKey);
            resolved = active != null ? markResolved(active, clock.instant()) : null;
        }
        LOG.info("Removed alert rule {}", ruleKey);
        if (resolved != null) {
            notifySubscribers(resolved);
        }
        return true;
    }

    public Optional<AlertRule> getRule(String ruleKey) {
        return Optional.ofNullable(rules.get(ruleKey));
    }

    /**
     * @return registered rules ordered by rule key
     */
    public List<AlertRule> listRules() {
        List<AlertRule> list = new ArrayList<>(rules.values());
        list.sort(Comparator.comparing(AlertRule::getRuleKey));
        return list;
    }

    // ---------------------------------------------------------------
    // Subscribers
    // ---------------------------------------------------------------

    public void subscribe(AlertSubscriber subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber must not be null"));
    }

    public boolean unsubscribe(AlertSubscriber subscriber) {
        return subscribers.remove(subscriber);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate every registered rule once.
     *
     * @return alerts that changed state during this pass (triggered or
     *         resolved), in evaluation order
     */
    public List<Alert> evaluate() {
        List<Alert> transitions = new ArrayList<>();
        for (AlertRule rule : listRules()) {
            try {
                evaluateRule(rule).ifPresent(alert -> {
                    transitions.add(alert);
                    notifySubscribers(alert);
                });
            } catch (RuntimeException e) {
                LOG.error("Error evaluating alert rule [{}] – continuing with next rule",
                        rule.getRuleKey(), e);
            }
        }
        return transitions;
    }

    private Optional<Alert> evaluateRule(AlertRule rule) {
        Optional<MetricStats> stats = recorder.stats(rule.getMetricName(), rule.getTimeWindow());
        if (stats.isEmpty()) {
            LOG.trace("Rule [{}]: no samples in window – skipping", rule.getRuleKey());
            return Optional.empty();
        }
        if (stats.get().getCount() < rule.getMinSamples()) {
            LOG.debug("Rule [{}]: {} sample(s) < minSamples {} – skipping",
                    rule.getRuleKey(), stats.get().getCount(), rule.getMinSamples());
            return Optional.empty();
        }

        double currentValue = stats.get().getMean();
        boolean conditionHolds = rule.getCondition().test(currentValue, rule.getThreshold());
        Instant now = clock.instant();
        String key = rule.getRuleKey();

        synchronized (stateLock) {
            Alert active = activeByRuleKey.get(key);

            if (conditionHolds && active == null) {
                Instant resolvedAt = lastResolvedAt.get(key);
                if (resolvedAt != null && now.isBefore(resolvedAt.plus(rule.getCooldown()))) {
                    LOG.debug("Rule [{}]: condition holds but cooldown active until {}",
                            key, resolvedAt.plus(rule.getCooldown()));
                    return Optional.empty();
                }
                int occurrence = occurrences.merge(key, 1, Integer::sum);
                Alert alert = Alert.builder()
                        .id(key + "#" + occurrence)
                        .ruleKey(key)
                        .metricName(rule.getMetricName())
                        .severity(rule.getSeverity())
                        .message(String.format(Locale.ROOT, "%s %s %s (current: %.2f)",
                                rule.getMetricName(), rule.getCondition().getCode(),
                                rule.getThreshold(), currentValue))
                        .threshold(rule.getThreshold())
                        .currentValue(currentValue)
                        .triggeredAt(now)
                        .build();
                activeByRuleKey.put(key, alert);
                putHistory(alert);
                LOG.info("Alert triggered: id={} severity={} value={}", alert.getId(),
                        alert.getSeverity(), currentValue);
                return Optional.of(alert);
            }

            if (!conditionHolds && active != null) {
                activeByRuleKey.remove(key);
                Alert resolved = markResolved(active, now);
                LOG.info("Alert resolved: id={} value={}", resolved.getId(), currentValue);
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    /** Caller must hold {@code stateLock}. */
    private Alert markResolved(Alert active, Instant now) {
        Alert resolved = active.resolve(now);
        lastResolvedAt.put(active.getRuleKey(), now);
        putHistory(resolved);
        return resolved;
    }

    /** Caller must hold {@code stateLock}. */
    private void putHistory(Alert alert) {
        history.put(alert.getId(), alert);
        Iterator<Map.Entry<String, Alert>> it = history.entrySet().iterator();
        while (history.size() > historyLimit && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    private void notifySubscribers(Alert alert) {
        for (AlertSubscriber subscriber : subscribers) {
            try {
                subscriber.onAlert(alert);
            } catch (RuntimeException e) {
                LOG.error("Alert subscriber {} failed for alert {} – continuing with next subscriber",
                        subscriber, alert.getId(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return currently active alerts in trigger order
     */
    public List<Alert> activeAlerts() {
        synchronized (stateLock) {
            return List.copyOf(activeByRuleKey.values());
        }
    }

    /**
     * @return retained alerts, oldest trigger first, each in its latest state
     */
    public List<Alert> alertHistory() {
        synchronized (stateLock) {
            return List.copyOf(history.values());
        }
    }

    /**
     * @return retained alerts whose trigger time lies in {@code [from, to]}
     */
    public List<Alert> alertsBetween(Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        List<Alert> result = new ArrayList<>();
        for (Alert alert : alertHistory()) {
            Instant t = alert.getTriggeredAt();
            if (!t.isBefore(from) && !t.isAfter(to)) {
                result.add(alert);
            }
        }
        return result;
    }
}
