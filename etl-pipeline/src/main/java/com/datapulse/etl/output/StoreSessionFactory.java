package com.datapulse.etl.output;

/**
 * Opens the stores for one run.
 */
@FunctionalInterface
public interface StoreSessionFactory {

    /**
     * @throws PersistenceException (connection-level) when a store cannot be reached
     */
    StoreSession open();
}
