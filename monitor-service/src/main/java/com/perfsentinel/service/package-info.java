/**
 * Runtime wiring of Perf Sentinel: configuration, the
 * {@link com.perfsentinel.service.PerformanceMonitor} facade and its loops,
 * and the {@code main} entry point.
 *
 * @since 1.0.0
 */
package com.perfsentinel.service;
