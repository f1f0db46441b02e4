/**
 * Rolling per-metric sample storage and windowed statistics.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.recorder;
