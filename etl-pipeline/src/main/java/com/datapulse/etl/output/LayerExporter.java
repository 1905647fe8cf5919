package com.datapulse.etl.output;

import com.datapulse.etl.model.Domain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes layer snapshots, backups and images to the object store.
 *
 * Object name patterns:
 * <pre>
 *   exports/{layer}/{domain}/{domain}_{batchId}.json|csv
 *   backups/backup_{yyyyMMdd_HHmmss}.json
 *   images/books/{bookKey}.{ext}
 * </pre>
 */
@Slf4j
public class LayerExporter {

    private static final DateTimeFormatter BACKUP_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final String exportsBucket;
    private final String backupsBucket;
    private final String imagesBucket;

    public LayerExporter(ObjectStore objectStore, ObjectMapper objectMapper,
                         String exportsBucket, String backupsBucket, String imagesBucket) {
        this.objectStore = objectStore;
        this.objectMapper = objectMapper;
        this.exportsBucket = exportsBucket;
        this.backupsBucket = backupsBucket;
        this.imagesBucket = imagesBucket;
    }

    public void ensureBuckets() {
        objectStore.ensureBuckets(List.of(imagesBucket, exportsBucket, backupsBucket));
    }

    public String exportJson(String layer, Domain domain, List<?> records, String batchId) {
        String name = objectName(layer, domain, batchId, "json");
        String uri = objectStore.upload(exportsBucket, name, toJson(records), "application/json");
        log.info("Exported {} {} {} records to {}", records.size(), layer, domain.key(), uri);
        return uri;
    }

    public String exportCsv(String layer, Domain domain, CsvTable table, String batchId) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(table.header());
            for (String[] row : table.rows()) {
                writer.writeNext(row);
            }
        } catch (IOException e) {
            throw new PersistenceException("CSV export of " + domain.key() + " failed", e, false);
        }
        String name = objectName(layer, domain, batchId, "csv");
        String uri = objectStore.upload(exportsBucket, name, out.toString().getBytes(StandardCharsets.UTF_8), "text/csv");
        log.info("Exported {} {} {} rows to {}", table.rows().size(), layer, domain.key(), uri);
        return uri;
    }

    /** Full snapshot of a run, named after the time it was taken. */
    public String backup(Object snapshot, LocalDateTime takenAt) {
        String name = "backup_" + BACKUP_TIME.format(takenAt) + ".json";
        String uri = objectStore.upload(backupsBucket, name, toJson(snapshot), "application/json");
        log.info("Backup written to {}", uri);
        return uri;
    }

    public String uploadImage(String bookKey, String sourceUrl, byte[] image) {
        String extension = extension(sourceUrl);
        String contentType = "png".equals(extension) ? "image/png" : "image/jpeg";
        return objectStore.upload(imagesBucket, "books/" + bookKey + "." + extension, image, contentType);
    }

    /** Object count and size of the images, exports and backups buckets. */
    public List<BucketStats> storageStats() {
        List<BucketStats> stats = new ArrayList<>();
        for (String bucket : List.of(imagesBucket, exportsBucket, backupsBucket)) {
            BucketStats bucketStats = BucketStats.of(bucket, objectStore.listObjects(bucket, ""));
            log.debug("Bucket {}: {} objects, {} bytes", bucket, bucketStats.objects(), bucketStats.totalBytes());
            stats.add(bucketStats);
        }
        return stats;
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    static String objectName(String layer, Domain domain, String batchId, String extension) {
        return layer + "/" + domain.key() + "/" + domain.key() + "_" + batchId + "." + extension;
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("JSON serialization failed: " + e.getOriginalMessage(), e, false);
        }
    }

    private static String extension(String url) {
        if (url == null) return "jpg";
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.endsWith(".png") ? "png" : "jpg";
    }
}
