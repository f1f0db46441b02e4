package com.perfsentinel.core.persistence;

/**
 * Durable store for monitoring history.
 *
 * <p>
 * A write either stores the whole batch or throws; the
 * {@link BufferedPersistenceWriter} retries a failed batch on the next flush.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PersistenceSink {

    void write(PersistenceBatch batch) throws PersistenceException;
}
