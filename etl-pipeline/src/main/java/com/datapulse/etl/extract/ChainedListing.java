package com.datapulse.etl.extract;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Several listings consumed one after the other, each started only when the previous one
 * is exhausted. Statistics are summed over the listings started so far.
 */
public class ChainedListing<T> implements Iterator<T> {

    private final Iterator<Supplier<PaginatedExtractor.Listing<T>>> pending;
    private final ExtractionStats finished = new ExtractionStats();
    private PaginatedExtractor.Listing<T> current;

    public ChainedListing(List<Supplier<PaginatedExtractor.Listing<T>>> listings) {
        this.pending = listings.iterator();
    }

    @Override
    public boolean hasNext() {
        while (current == null || !current.hasNext()) {
            if (current != null) {
                finished.add(current.getStats());
                current = null;
            }
            if (!pending.hasNext()) {
                return false;
            }
            current = pending.next().get();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    public ExtractionStats getStats() {
        ExtractionStats total = new ExtractionStats();
        total.add(finished);
        if (current != null) {
            total.add(current.getStats());
        }
        return total;
    }
}
