package com.datapulse.etl.output;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link ObjectStore} on S3 or any S3-compatible server such as MinIO.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore, AutoCloseable {

    private final S3Client s3Client;

    public S3ObjectStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void ensureBuckets(Collection<String> buckets) {
        for (String bucket : buckets) {
            try {
                s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            } catch (NoSuchBucketException e) {
                log.info("Creating bucket {}", bucket);
                try {
                    s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
                } catch (SdkException ce) {
                    throw failure("Create bucket " + bucket, ce);
                }
            } catch (SdkException e) {
                throw failure("Check bucket " + bucket, e);
            }
        }
    }

    @Override
    public String upload(String bucket, String objectName, byte[] data, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(objectName)
                            .contentType(contentType)
                            .contentLength((long) data.length)
                            .build(),
                    RequestBody.fromBytes(data));
        } catch (SdkException e) {
            throw failure("Upload " + bucket + "/" + objectName, e);
        }
        String uri = "s3://" + bucket + "/" + objectName;
        log.debug("Uploaded {} ({} bytes)", uri, data.length);
        return uri;
    }

    @Override
    public List<StoredObject> listObjects(String bucket, String prefix) {
        List<StoredObject> objects = new ArrayList<>();
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix == null ? "" : prefix)
                    .build();
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                objects.add(new StoredObject(object.key(), object.size() == null ? 0L : object.size(), object.lastModified()));
            }
        } catch (SdkException e) {
            throw failure("List " + bucket + "/" + prefix, e);
        }
        return objects;
    }

    /** Client-side errors (unreachable endpoint, bad credentials setup) are connection-level. */
    private static PersistenceException failure(String operation, SdkException e) {
        return new PersistenceException(operation + " failed: " + e.getMessage(), e, e instanceof SdkClientException);
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
