package com.perfsentinel.core.model;

/**
 * Direction of a scaling recommendation.
 *
 * <p>
 * A "maintain" outcome is represented by the absence of a recommendation.
 * </p>
 *
 * @since 1.0.0
 */
public enum ScalingAction {
    SCALE_UP,
    SCALE_DOWN
}
