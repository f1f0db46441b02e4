package com.perfsentinel.core.sampling;

/**
 * Source of host and application resource readings.
 *
 * <p>
 * The monitor calls {@link #sample()} on a fixed interval, on a dedicated
 * thread and bounded by a timeout. Implementations may block; a call that
 * outlives the timeout is interrupted and its reading dropped.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceSampler {

    /**
     * Take one reading.
     *
     * @return the current resource utilisation; never {@code null}
     * @throws Exception if the reading could not be taken
     */
    ResourceSample sample() throws Exception;
}
