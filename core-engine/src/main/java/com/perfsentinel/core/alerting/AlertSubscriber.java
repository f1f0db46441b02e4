package com.perfsentinel.core.alerting;

import com.perfsentinel.core.model.Alert;

/**
 * Receives alerts when they trigger and again when they resolve.
 *
 * <p>
 * Called synchronously from the evaluation loop; implementations should
 * return quickly. An exception thrown here is logged by the
 * {@link AlertEngine} and does not prevent delivery to other subscribers.
 * </p>
 */
@FunctionalInterface
public interface AlertSubscriber {

    /**
     * @param alert the triggered or resolved alert; check
     *              {@link Alert#isResolved()} to tell them apart
     */
    void onAlert(Alert alert);
}
