package com.datapulse.etl.service;

import com.datapulse.etl.config.DataPulseProperties;
import com.datapulse.etl.output.BucketStats;
import com.datapulse.etl.output.LayerExporter;
import com.datapulse.etl.output.StoreSession;
import com.datapulse.etl.output.StoreSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Contents of the object store buckets, outside of any run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StorageReportService {

    private final StoreSessionFactory storeSessionFactory;
    private final ObjectMapper objectMapper;
    private final DataPulseProperties properties;

    /**
     * @throws com.datapulse.etl.output.PersistenceException when the object store cannot be listed
     */
    public List<BucketStats> bucketStats() {
        DataPulseProperties.Storage storage = properties.getStorage();
        try (StoreSession session = storeSessionFactory.open()) {
            LayerExporter exporter = new LayerExporter(session.objectStore(), objectMapper,
                    storage.getExportsBucket(), storage.getBackupsBucket(), storage.getImagesBucket());
            return exporter.storageStats();
        }
    }
}
