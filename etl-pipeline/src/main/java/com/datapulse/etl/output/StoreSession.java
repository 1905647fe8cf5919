package com.datapulse.etl.output;

/**
 * The stores of one pipeline run, acquired together and released together.
 */
public interface StoreSession extends AutoCloseable {

    RelationalStore relationalStore();

    ObjectStore objectStore();

    /** Releases every store; never throws. */
    @Override
    void close();
}
