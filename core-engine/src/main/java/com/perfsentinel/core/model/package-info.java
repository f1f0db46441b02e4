/**
 * Domain model classes for Perf Sentinel.
 *
 * <p>
 * Immutable value types shared by the recorder, the evaluation engines and the
 * monitor service:
 * </p>
 * <ul>
 * <li>{@link com.perfsentinel.core.model.Metric} and
 * {@link com.perfsentinel.core.model.MetricStats}: samples and their windowed
 * statistics</li>
 * <li>{@link com.perfsentinel.core.model.AlertRule} and
 * {@link com.perfsentinel.core.model.Alert}: alerting configuration and
 * lifecycle</li>
 * <li>{@link com.perfsentinel.core.model.ScalingRule} and
 * {@link com.perfsentinel.core.model.ScalingRecommendation}: capacity
 * recommendations</li>
 * <li>{@link com.perfsentinel.core.model.HealthReport}: composed health
 * report</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.model;
