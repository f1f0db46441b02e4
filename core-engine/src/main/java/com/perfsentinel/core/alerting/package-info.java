/**
 * Threshold alerting: rule evaluation, alert lifecycle and subscriber
 * notification.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.alerting;
