package com.datapulse.etl.extract;

/**
 * An element on a listing page lacks a mandatory part. The element is skipped.
 */
public class ItemParseException extends RuntimeException {

    public ItemParseException(String message) {
        super(message);
    }
}
