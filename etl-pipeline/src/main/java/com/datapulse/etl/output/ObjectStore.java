package com.datapulse.etl.output;

import java.util.Collection;
import java.util.List;

/**
 * Narrow interface over the object store.
 */
public interface ObjectStore {

    /** Creates the buckets that do not exist yet. */
    void ensureBuckets(Collection<String> buckets);

    /**
     * @return URI of the stored object, e.g. {@code s3://exports/silver/books/books_x.json}
     * @throws PersistenceException if the upload fails
     */
    String upload(String bucket, String objectName, byte[] data, String contentType);

    /**
     * Objects of a bucket whose name starts with {@code prefix}, in key order.
     *
     * @throws PersistenceException if the bucket cannot be listed
     */
    List<StoredObject> listObjects(String bucket, String prefix);
}
