package com.perfsentinel.core.scaling;

import com.perfsentinel.core.model.MetricStats;
import com.perfsentinel.core.model.ScalingAction;
import com.perfsentinel.core.model.ScalingImpact;
import com.perfsentinel.core.model.ScalingRecommendation;
import com.perfsentinel.core.model.ScalingRule;
import com.perfsentinel.core.recorder.MetricRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns windowed metric statistics into capacity recommendations.
 *
 * <h3>Decision</h3>
 * <p>
 * Per registered {@link ScalingRule}, with {@code m} the window mean of the
 * rule's metric and {@code c} the caller-supplied current capacity:
 * </p>
 * <ul>
 * <li>{@code m > scaleUp} and {@code c < max}: {@code SCALE_UP} to
 * {@code ceil(c * factor)}, confidence {@code (m - scaleUp) / scaleUp}</li>
 * <li>{@code m < scaleDown} and {@code c > min}: {@code SCALE_DOWN} to
 * {@code floor(c / factor)}, confidence {@code (scaleDown - m) / scaleDown}</li>
 * <li>otherwise nothing is emitted</li>
 * </ul>
 * <p>
 * Recommended capacities are clamped to {@code [min, max]} and confidences to
 * {@code [0, 1]}. A resource that received a recommendation is not evaluated
 * again until {@code minScalingInterval} has passed, whether or not the
 * recommendation was applied.
 * </p>
 *
 * @since 1.0.0
 */
public class AutoScaler {

    private static final Logger LOG = LoggerFactory.getLogger(AutoScaler.class);

    public static final Duration DEFAULT_MIN_SCALING_INTERVAL = Duration.ofSeconds(300);
    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    private final MetricRecorder recorder;
    private final Clock clock;
    private final Duration minScalingInterval;
    private final int historyLimit;

    private final Map<String, ScalingRule> rules = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastScalingTime = new ConcurrentHashMap<>();
    private final Deque<ScalingRecommendation> history = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    public AutoScaler(MetricRecorder recorder, Clock clock, Duration minScalingInterval, int historyLimit) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(minScalingInterval, "minScalingInterval must not be null");
        if (minScalingInterval.isNegative()) {
            throw new IllegalArgumentException("minScalingInterval must be >= 0, got: " + minScalingInterval);
        }
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be >= 1, got: " + historyLimit);
        }
        this.minScalingInterval = minScalingInterval;
        this.historyLimit = historyLimit;
    }

    public AutoScaler(MetricRecorder recorder, Clock clock) {
        this(recorder, clock, DEFAULT_MIN_SCALING_INTERVAL, DEFAULT_HISTORY_LIMIT);
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    /**
     * Register a rule, replacing any rule for the same resource type.
     *
     * <p>
     * Rules are validated when built; see {@link ScalingRule.Builder#build()},
     * which throws {@link com.perfsentinel.core.config.ConfigurationException}
     * for an invalid definition.
     * </p>
     */
    public void addRule(ScalingRule rule) {
        Objects.requireNonNull(rule, "ScalingRule must not be null");
        ScalingRule previous = rules.put(rule.getResourceType(), rule);
        if (previous == null) {
            LOG.info("Registered scaling rule {}", rule);
        } else {
            LOG.info("Replaced scaling rule for '{}': {}", rule.getResourceType(), rule);
        }
    }

    public boolean removeRule(String resourceType) {
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        boolean removed = rules.remove(resourceType) != null;
        if (removed) {
            lastScalingTime.remove(resourceType);
            LOG.info("Removed scaling rule for '{}'", resourceType);
        }
        return removed;
    }

    public List<ScalingRule> listRules() {
        List<ScalingRule> list = new ArrayList<>(rules.values());
        list.sort((a, b) -> a.getResourceType().compareTo(b.getResourceType()));
        return list;
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate every rule against the given capacities.
     *
     * @param currentCapacities resource type to current capacity; a missing
     *                          entry counts as the rule's minimum capacity
     * @return the recommendations emitted by this pass
     */
    public synchronized List<ScalingRecommendation> evaluate(Map<String, Integer> currentCapacities) {
        Map<String, Integer> capacities = currentCapacities == null ? Map.of() : currentCapacities;
        List<ScalingRecommendation> emitted = new ArrayList<>();
        for (ScalingRule rule : listRules()) {
            try {
                evaluateRule(rule, capacities).ifPresent(emitted::add);
            } catch (RuntimeException e) {
                LOG.error("Error evaluating scaling rule for '{}' – continuing with next rule",
                        rule.getResourceType(), e);
            }
        }
        return emitted;
    }

    private Optional<ScalingRecommendation> evaluateRule(ScalingRule rule, Map<String, Integer> capacities) {
        String resource = rule.getResourceType();
        Instant now = clock.instant();

        Instant last = lastScalingTime.get(resource);
        if (last != null && Duration.between(last, now).compareTo(minScalingInterval) < 0) {
            LOG.debug("Scaling [{}]: within cooldown since {} – skipping", resource, last);
            return Optional.empty();
        }

        Optional<MetricStats> stats = recorder.stats(rule.getMetricName(), rule.getWindow());
        if (stats.isEmpty()) {
            LOG.debug("Scaling [{}]: no samples for '{}' – skipping", resource, rule.getMetricName());
            return Optional.empty();
        }

        double value = stats.get().getMean();
        Integer supplied = capacities.get(resource);
        int capacity = supplied != null ? supplied : rule.getMinCapacity();

        ScalingAction action;
        int recommended;
        double confidence;
        double threshold;
        if (value > rule.getScaleUpThreshold() && capacity < rule.getMaxCapacity()) {
            action = ScalingAction.SCALE_UP;
            threshold = rule.getScaleUpThreshold();
            recommended = clamp((int) Math.ceil(capacity * rule.getScalingFactor()), rule);
            confidence = confidence(value - threshold, threshold);
        } else if (value < rule.getScaleDownThreshold() && capacity > rule.getMinCapacity()) {
            action = ScalingAction.SCALE_DOWN;
            threshold = rule.getScaleDownThreshold();
            recommended = clamp((int) Math.floor(capacity / rule.getScalingFactor()), rule);
            confidence = confidence(threshold - value, threshold);
        } else {
            LOG.debug("Scaling [{}]: MAINTAIN at {} ({} mean {} within [{}, {}])", resource, capacity,
                    rule.getMetricName(), value, rule.getScaleDownThreshold(), rule.getScaleUpThreshold());
            return Optional.empty();
        }

        if (recommended == capacity) {
            LOG.debug("Scaling [{}]: {} would keep capacity at {} – MAINTAIN", resource, action, capacity);
            return Optional.empty();
        }

        ScalingRecommendation recommendation = ScalingRecommendation.builder()
                .id(resource + "-" + now.toEpochMilli() + "-" + sequence.incrementAndGet())
                .action(action)
                .resourceType(resource)
                .metricName(rule.getMetricName())
                .currentCapacity(capacity)
                .recommendedCapacity(recommended)
                .confidence(confidence)
                .reasoning(String.format(Locale.ROOT, "%s mean %.2f %s threshold %.2f",
                        rule.getMetricName(), value,
                        action == ScalingAction.SCALE_UP ? "above" : "below", threshold))
                .estimatedImpact(ScalingImpact.estimate(capacity, recommended))
                .timestamp(now)
                .build();

        lastScalingTime.put(resource, now);
        appendHistory(recommendation);
        LOG.info("Scaling recommendation: {} {} {} -> {} (confidence {})", action, resource,
                capacity, recommended, String.format(Locale.ROOT, "%.3f", confidence));
        return Optional.of(recommendation);
    }

    private static int clamp(int capacity, ScalingRule rule) {
        return Math.max(rule.getMinCapacity(), Math.min(rule.getMaxCapacity(), capacity));
    }

    /** Relative distance past the threshold, clamped to [0, 1]; 1 for a zero threshold. */
    private static double confidence(double distance, double threshold) {
        if (threshold == 0.0) {
            return 1.0;
        }
        double c = distance / Math.abs(threshold);
        return Math.max(0.0, Math.min(1.0, c));
    }

    private void appendHistory(ScalingRecommendation recommendation) {
        synchronized (history) {
            history.addLast(recommendation);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    /**
     * @return emitted recommendations, oldest first
     */
    public List<ScalingRecommendation> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public Duration getMinScalingInterval() {
        return minScalingInterval;
    }
}
