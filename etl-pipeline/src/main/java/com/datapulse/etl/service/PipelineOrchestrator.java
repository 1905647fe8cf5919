package com.datapulse.etl.service;

import com.datapulse.etl.config.DataPulseProperties;
import com.datapulse.etl.extract.BookCatalogExtractor;
import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.extract.ChainedListing;
import com.datapulse.etl.extract.ExtractionStats;
import com.datapulse.etl.extract.PaginatedExtractor;
import com.datapulse.etl.extract.PipelineCancelledException;
import com.datapulse.etl.extract.QuoteExtractor;
import com.datapulse.etl.geo.AddressQuery;
import com.datapulse.etl.geo.GeocodingClient;
import com.datapulse.etl.model.CleanBook;
import com.datapulse.etl.model.CleanLibrairie;
import com.datapulse.etl.model.CleanQuote;
import com.datapulse.etl.model.Domain;
import com.datapulse.etl.model.DomainCounters;
import com.datapulse.etl.model.GeocodeLookup;
import com.datapulse.etl.model.PipelinePhase;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.model.PipelineRun;
import com.datapulse.etl.model.RawBook;
import com.datapulse.etl.model.RawLibrairie;
import com.datapulse.etl.model.RawQuote;
import com.datapulse.etl.model.RunStatus;
import com.datapulse.etl.output.CsvTable;
import com.datapulse.etl.output.LayerExporter;
import com.datapulse.etl.output.LoadResult;
import com.datapulse.etl.output.PersistenceException;
import com.datapulse.etl.output.StagedLoader;
import com.datapulse.etl.output.StoreSession;
import com.datapulse.etl.output.StoreSessionFactory;
import com.datapulse.etl.spreadsheet.ImportResult;
import com.datapulse.etl.spreadsheet.LibrairieImporter;
import com.datapulse.etl.spreadsheet.StructuralImportException;
import com.datapulse.etl.transform.BookTransformer;
import com.datapulse.etl.transform.LibrairieTransformer;
import com.datapulse.etl.transform.QuoteTransformer;
import com.datapulse.etl.transform.TransformResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs one batch: EXTRACT, TRANSFORM and LOAD over the selected domains, in that order.
 *
 * Stores are opened once at the start and closed on every exit path. A connection-level
 * failure or any unexpected error moves the run to FAILED; the cancellation token moves it
 * to CANCELLED. Record, row and page failures are counted and reported but never stop the
 * run. A rejected spreadsheet only skips the librairies domain.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    static final String BRONZE = "bronze";
    static final String SILVER = "silver";

    private final BookCatalogExtractor bookExtractor;
    private final QuoteExtractor quoteExtractor;
    private final LibrairieImporter librairieImporter;
    private final GeocodingClient geocodingClient;
    private final BookTransformer bookTransformer;
    private final QuoteTransformer quoteTransformer;
    private final LibrairieTransformer librairieTransformer;
    private final StoreSessionFactory storeSessionFactory;
    private final ObjectMapper objectMapper;
    private final DataPulseProperties properties;

    public PipelineReport run(RunOptions options, CancellationToken token) {
        PipelineRun run = PipelineRun.start(properties.getPipeline().getMaxReportedErrors());
        log.info("Pipeline {} starting, domains {}", run.getBatchId(), options.getDomains());

        StoreSession session = openStores(run);
        if (session == null) {
            return finish(run, PipelinePhase.FAILED, RunStatus.FAILED);
        }
        // geocode answers are only trusted within the run that fetched them
        geocodingClient.clearCache();

        try (session) {
            Batch batch = new Batch(run, options, token, session);
            try {
                batch.execute();
                finish(run, PipelinePhase.DONE, run.getTotalErrors() == 0 ? RunStatus.SUCCESS : RunStatus.PARTIAL);
            } catch (PipelineCancelledException e) {
                Thread.interrupted();
                log.warn("Pipeline {} cancelled during {}", run.getBatchId(), run.getPhase());
                run.addError("Cancelled during " + run.getPhase());
                finish(run, PipelinePhase.CANCELLED, RunStatus.CANCELLED);
            } catch (RuntimeException e) {
                log.error("Pipeline {} failed during {}: {}", run.getBatchId(), run.getPhase(), e.getMessage(), e);
                run.addError("Failed during " + run.getPhase() + ": " + e.getMessage());
                finish(run, PipelinePhase.FAILED, RunStatus.FAILED);
            }
            batch.loader.recordRun(run.toReport(), countersJson(run));
        }
        return run.toReport();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private StoreSession openStores(PipelineRun run) {
        try {
            return storeSessionFactory.open();
        } catch (PersistenceException e) {
            log.error("Pipeline {} could not open its stores: {}", run.getBatchId(), e.getMessage());
            run.addError("Stores unavailable: " + e.getMessage());
            return null;
        }
    }

    private PipelineReport finish(PipelineRun run, PipelinePhase phase, RunStatus status) {
        run.setPhase(phase);
        run.setStatus(status);
        run.setCompletedAt(LocalDateTime.now());
        PipelineReport report = run.toReport();
        log.info("Pipeline {} finished: status={}, phase={}, duration={}s, errors={}",
                report.batchId(), report.status(), report.lastPhase(),
                report.duration().toSeconds(), report.totalErrors());
        report.counters().forEach((domain, c) -> log.info(
                "  {}: extracted={}, transformed={}, loaded={}, duplicates={}, invalid={}, failed={}",
                domain.key(), c.getExtracted(), c.getTransformed(), c.getLoaded(),
                c.getDuplicates(), c.getInvalid(), c.getFailed()));
        return report;
    }

    private String countersJson(PipelineRun run) {
        try {
            return objectMapper.writeValueAsString(run.getCounters());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize counters: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * State of one run. Data moves strictly downstream: bronze lists are filled by extract,
     * read by transform, which fills the silver lists read by load.
     */
    private final class Batch {

        private final PipelineRun run;
        private final RunOptions options;
        private final CancellationToken token;
        private final LayerExporter exporter;
        private final StagedLoader loader;

        private final Map<Domain, Boolean> extracted = new EnumMap<>(Domain.class);
        private List<RawBook> rawBooks = List.of();
        private List<RawQuote> rawQuotes = List.of();
        private List<RawLibrairie> rawLibrairies = List.of();
        private List<GeocodeLookup> geocodes = List.of();

        private List<CleanBook> books = List.of();
        private List<CleanQuote> quotes = List.of();
        private List<CleanLibrairie> librairies = List.of();

        Batch(PipelineRun run, RunOptions options, CancellationToken token, StoreSession session) {
            this.run = run;
            this.options = options;
            this.token = token;
            DataPulseProperties.Storage storage = properties.getStorage();
            this.exporter = new LayerExporter(session.objectStore(), objectMapper,
                    storage.getExportsBucket(), storage.getBackupsBucket(), storage.getImagesBucket());
            this.loader = new StagedLoader(session.relationalStore(), token);
        }

        void execute() {
            exporter.ensureBuckets();

            run.setPhase(PipelinePhase.EXTRACT);
            for (Domain domain : options.getDomains()) {
                token.throwIfCancelled();
                switch (domain) {
                    case BOOKS -> extractBooks();
                    case QUOTES -> extractQuotes();
                    case LIBRAIRIES -> extractLibrairies();
                }
            }

            run.setPhase(PipelinePhase.TRANSFORM);
            for (Domain domain : extracted.keySet()) {
                token.throwIfCancelled();
                switch (domain) {
                    case BOOKS -> books = transformed(domain, bookTransformer.transform(rawBooks),
                            CsvTable::ofBooks);
                    case QUOTES -> quotes = transformed(domain, quoteTransformer.transform(rawQuotes),
                            CsvTable::ofQuotes);
                    case LIBRAIRIES -> librairies = transformed(domain,
                            librairieTransformer.transform(rawLibrairies, geocodes), CsvTable::ofLibrairies);
                }
            }

            run.setPhase(PipelinePhase.LOAD);
            for (Domain domain : extracted.keySet()) {
                token.throwIfCancelled();
                switch (domain) {
                    case BOOKS -> loaded(domain, loader.loadBooks(books, uploadImages()));
                    case QUOTES -> loaded(domain, loader.loadQuotes(quotes));
                    case LIBRAIRIES -> loaded(domain, loader.loadLibrairies(librairies));
                }
            }
            backup();
        }

        // ── Extract ──────────────────────────────────────────────────────────

        private void extractBooks() {
            DataPulseProperties.Books config = properties.getBooks();
            Integer limitCategories = Optional.ofNullable(options.getLimitCategories()).orElse(config.getLimitCategories());
            Integer maxPages = Optional.ofNullable(options.getMaxCategoryPages()).orElse(config.getMaxPages());

            ChainedListing<RawBook> listing = bookExtractor.extractAll(limitCategories, maxPages, run.getBatchId(), token);
            rawBooks = drain(listing);
            extracted(Domain.BOOKS, rawBooks.size(), listing.getStats());
            exportBronze(Domain.BOOKS, rawBooks, CsvTable.ofRawBooks(rawBooks));
        }

        private void extractQuotes() {
            DataPulseProperties.Quotes config = properties.getQuotes();
            Integer maxPages = Optional.ofNullable(options.getMaxQuotePages()).orElse(config.getMaxPages());

            List<RawQuote> all = new ArrayList<>();
            ExtractionStats stats = new ExtractionStats();
            PaginatedExtractor.Listing<RawQuote> main = quoteExtractor.extractAll(maxPages, run.getBatchId(), token);
            all.addAll(drain(main));
            stats.add(main.getStats());
            for (String tag : tagListings(config)) {
                PaginatedExtractor.Listing<RawQuote> byTag = quoteExtractor.extractByTag(tag, maxPages, run.getBatchId(), token);
                all.addAll(drain(byTag));
                stats.add(byTag.getStats());
            }
            rawQuotes = all;
            extracted(Domain.QUOTES, rawQuotes.size(), stats);
            exportBronze(Domain.QUOTES, rawQuotes, CsvTable.ofRawQuotes(rawQuotes));
        }

        private Set<String> tagListings(DataPulseProperties.Quotes config) {
            Set<String> tags = new LinkedHashSet<>(config.getTags());
            if (config.isTopTags()) {
                tags.addAll(quoteExtractor.listTopTags(token));
            }
            return tags;
        }

        private void extractLibrairies() {
            String path = Optional.ofNullable(options.getSpreadsheetPath()).orElse(properties.getSpreadsheet().getPath());
            ImportResult result;
            try {
                result = librairieImporter.importFile(Path.of(path), run.getBatchId(), token);
            } catch (StructuralImportException e) {
                log.error("Librairies import aborted: {}", e.getMessage());
                run.counters(Domain.LIBRAIRIES).addFailed(1);
                run.addError("librairies: " + e.getMessage());
                return;
            }

            DomainCounters counters = run.counters(Domain.LIBRAIRIES);
            counters.setExtracted(result.librairies().size());
            counters.addInvalid(result.invalidRows());
            result.fieldErrors().forEach(error -> run.addError("librairies: " + error));
            rawLibrairies = result.librairies();
            extracted.put(Domain.LIBRAIRIES, true);

            if (properties.getGeocoding().isEnabled()) {
                geocodes = geocodingClient.geocodeBatch(rawLibrairies.stream()
                        .map(l -> new AddressQuery(l.getAddress(), l.getCity(), l.getPostcode()))
                        .toList(), token);
                for (int i = 0; i < geocodes.size(); i++) {
                    GeocodeLookup lookup = geocodes.get(i);
                    if (lookup.status() == GeocodeLookup.Status.FAILED) {
                        run.addError("librairies: geocoding failed for row "
                                + rawLibrairies.get(i).getRowNumber() + ": " + lookup.reason());
                    }
                }
            }
            exportBronze(Domain.LIBRAIRIES, rawLibrairies, CsvTable.ofRawLibrairies(rawLibrairies));
        }

        private void exportBronze(Domain domain, List<?> records, CsvTable csv) {
            export(() -> exporter.exportJson(BRONZE, domain, records, run.getBatchId()));
            export(() -> exporter.exportCsv(BRONZE, domain, csv, run.getBatchId()));
        }

        private <T> List<T> drain(Iterator<T> listing) {
            List<T> items = new ArrayList<>();
            while (listing.hasNext()) {
                items.add(listing.next());
            }
            return items;
        }

        private void extracted(Domain domain, int count, ExtractionStats stats) {
            DomainCounters counters = run.counters(domain);
            counters.setExtracted(count);
            counters.addInvalid(stats.getItemErrors());
            counters.addFailed(stats.getPageErrors());
            stats.getErrors().forEach(error -> run.addError(domain.key() + ": " + error));
            extracted.put(domain, true);
            log.info("Extracted {} {} from {} pages", count, domain.key(), stats.getPagesFetched());
        }

        // ── Transform ────────────────────────────────────────────────────────

        private <T> List<T> transformed(Domain domain, TransformResult<T> result,
                                        Function<List<T>, CsvTable> csv) {
            DomainCounters counters = run.counters(domain);
            counters.setTransformed(result.records().size());
            counters.addDuplicates(result.duplicates());
            counters.addFailed(result.failed());
            result.errors().forEach(error -> run.addError(domain.key() + ": " + error));

            export(() -> exporter.exportJson(SILVER, domain, result.records(), run.getBatchId()));
            export(() -> exporter.exportCsv(SILVER, domain, csv.apply(result.records()), run.getBatchId()));
            return result.records();
        }

        // ── Load ─────────────────────────────────────────────────────────────

        private void loaded(Domain domain, LoadResult result) {
            DomainCounters counters = run.counters(domain);
            counters.addLoaded(result.inserted());
            counters.addDuplicates(result.existing());
            counters.addFailed(result.failed());
            result.errors().forEach(error -> run.addError(domain.key() + ": " + error));
        }

        private Map<String, String> uploadImages() {
            boolean enabled = Optional.ofNullable(options.getDownloadImages()).orElse(properties.getBooks().isDownloadImages());
            if (!enabled || books.isEmpty()) {
                return Map.of();
            }
            Map<String, String> uris = new HashMap<>();
            for (CleanBook book : books) {
                token.throwIfCancelled();
                bookExtractor.downloadImage(book.getImageUrl(), token).ifPresent(bytes -> export(() ->
                        uris.put(book.getBookKey(), exporter.uploadImage(book.getBookKey(), book.getImageUrl(), bytes))));
            }
            log.info("Uploaded {}/{} cover images", uris.size(), books.size());
            return uris;
        }

        private void backup() {
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("batchId", run.getBatchId());
            snapshot.put("books", books);
            snapshot.put("quotes", quotes);
            snapshot.put("librairies", librairies);
            export(() -> exporter.backup(snapshot, LocalDateTime.now()));
        }

        /**
         * Object store writes are best effort: a record-level failure is reported, a
         * connection-level one aborts the run like any lost store.
         */
        private void export(Runnable upload) {
            try {
                upload.run();
            } catch (PersistenceException e) {
                if (e.isConnectionLevel()) throw e;
                log.warn("Export failed: {}", e.getMessage());
                run.addError("export: " + e.getMessage());
            }
        }
    }
}
