/**
 * Persistence contract and the buffering writer that retries failed batches
 * and bounds what it keeps in memory.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.persistence;
