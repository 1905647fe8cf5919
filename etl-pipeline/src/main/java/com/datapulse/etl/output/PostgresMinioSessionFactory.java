package com.datapulse.etl.output;

import com.datapulse.etl.config.DataPulseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import javax.sql.DataSource;
import java.net.URI;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens one JDBC connection and one S3 client per run. The connection is held for the
 * whole run so that a lost database surfaces as a connection-level failure instead of
 * silently reconnecting halfway through a batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostgresMinioSessionFactory implements StoreSessionFactory {

    private final DataSource dataSource;
    private final DataPulseProperties properties;

    @Override
    public StoreSession open() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new PersistenceException("Cannot connect to PostgreSQL: " + e.getMessage(), e, true);
        }

        S3Client s3Client;
        try {
            s3Client = s3Client(properties.getStorage());
        } catch (SdkException | IllegalArgumentException e) {
            closeQuietly(connection);
            throw new PersistenceException("Cannot create object store client: " + e.getMessage(), e, true);
        }

        JdbcTemplate jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        RelationalStore relational = new JdbcRelationalStore(jdbcTemplate);
        S3ObjectStore objects = new S3ObjectStore(s3Client);
        log.debug("Store session opened");

        return new StoreSession() {
            @Override
            public RelationalStore relationalStore() {
                return relational;
            }

            @Override
            public ObjectStore objectStore() {
                return objects;
            }

            @Override
            public void close() {
                try {
                    objects.close();
                } catch (SdkException e) {
                    log.warn("Error closing S3 client: {}", e.getMessage());
                }
                closeQuietly(connection);
                log.debug("Store session closed");
            }
        };
    }

    static S3Client s3Client(DataPulseProperties.Storage storage) {
        return S3Client.builder()
                .endpointOverride(URI.create(storage.getEndpoint()))
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey())))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(storage.isPathStyleAccess())
                        .build())
                .build();
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing database connection: {}", e.getMessage());
        }
    }
}
