package com.datapulse.etl.output;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.model.CleanBook;
import com.datapulse.etl.model.CleanLibrairie;
import com.datapulse.etl.model.CleanQuote;
import com.datapulse.etl.model.Domain;
import com.datapulse.etl.model.DomainCounters;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.transform.ContentDeduplicator;
import lombok.extern.slf4j.Slf4j;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Silver to gold. The only component that writes to the relational store.
 *
 * Dimensions are upserted first (insert-or-ignore, then one lookup pass to map each
 * natural key to its id), facts next, associations last. A record-level failure is logged
 * and the record skipped; a connection-level failure propagates and aborts the batch.
 */
@Slf4j
public class StagedLoader {

    private final RelationalStore store;
    private final CancellationToken token;

    public StagedLoader(RelationalStore store) {
        this(store, CancellationToken.none());
    }

    public StagedLoader(RelationalStore store, CancellationToken token) {
        this.store = store;
        this.token = token;
    }

    // ── Books ─────────────────────────────────────────────────────────────────

    /**
     * @param imageUris object store URI per book key, for books whose cover was uploaded
     */
    public LoadResult loadBooks(List<CleanBook> books, Map<String, String> imageUris) {
        List<String> errors = new ArrayList<>();
        List<Map<String, Object>> categories = ContentDeduplicator
                .deduplicate(books, CleanBook::getCategorySlug).retained().stream()
                .map(b -> row("name", b.getCategory(), "slug", b.getCategorySlug()))
                .toList();
        Map<String, Long> categoryIds = upsertDimension("dim_categories", "category_id", "slug", categories, errors);

        Counter counter = new Counter();
        for (CleanBook book : books) {
            token.throwIfCancelled();
            Long categoryId = categoryIds.get(book.getCategorySlug());
            if (categoryId == null) {
                counter.failed++;
                errors.add("Book '" + book.getTitle() + "': category " + book.getCategorySlug() + " not loaded");
                continue;
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("book_key", book.getBookKey());
            fields.put("title", book.getTitle());
            fields.put("category_id", categoryId);
            fields.put("price_gbp", book.getPriceGbp());
            fields.put("price_eur", book.getPriceEur());
            fields.put("rating", book.getRating());
            fields.put("in_stock", book.isInStock());
            fields.put("stock_count", book.getStockCount());
            fields.put("url", book.getUrl());
            fields.put("image_url", book.getImageUrl());
            fields.put("image_uri", imageUris.get(book.getBookKey()));
            fields.put("scraped_at", timestamp(book.getScrapedAt()));
            fields.put("batch_id", book.getBatchId());
            counter.record(upsertFact("fact_books", "book_id", fields, "Book '" + book.getTitle() + "'", errors));
        }
        return counter.result(errors, "books");
    }

    // ── Quotes ────────────────────────────────────────────────────────────────

    public LoadResult loadQuotes(List<CleanQuote> quotes) {
        List<String> errors = new ArrayList<>();

        List<Map<String, Object>> authors = ContentDeduplicator
                .deduplicate(quotes, CleanQuote::getAuthorSlug).retained().stream()
                .map(q -> row("name", q.getAuthor(), "slug", q.getAuthorSlug(), "url", q.getAuthorUrl()))
                .toList();
        Map<String, Long> authorIds = upsertDimension("dim_authors", "author_id", "slug", authors, errors);

        Map<String, String> tagNames = new LinkedHashMap<>();
        for (CleanQuote quote : quotes) {
            for (String slug : quote.getTags()) {
                tagNames.putIfAbsent(slug, quote.getTagNames().getOrDefault(slug, slug));
            }
        }
        List<Map<String, Object>> tags = tagNames.entrySet().stream()
                .map(tag -> row("name", tag.getValue(), "slug", tag.getKey()))
                .toList();
        Map<String, Long> tagIds = upsertDimension("dim_tags", "tag_id", "slug", tags, errors);

        Counter counter = new Counter();
        List<CleanQuote> persisted = new ArrayList<>();
        for (CleanQuote quote : quotes) {
            token.throwIfCancelled();
            Long authorId = authorIds.get(quote.getAuthorSlug());
            if (authorId == null) {
                counter.failed++;
                errors.add("Quote by " + quote.getAuthor() + ": author not loaded");
                continue;
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("quote_hash", quote.getTextHash());
            fields.put("text", quote.getText());
            fields.put("author_id", authorId);
            fields.put("text_length", quote.getTextLength());
            fields.put("scraped_at", timestamp(quote.getScrapedAt()));
            fields.put("batch_id", quote.getBatchId());
            FactOutcome outcome = upsertFact("fact_quotes", "quote_id", fields,
                    "Quote " + quote.getTextHash().substring(0, 8), errors);
            counter.record(outcome);
            if (outcome != FactOutcome.FAILED) {
                persisted.add(quote);
            }
        }

        linkQuoteTags(persisted, tagIds, errors);
        return counter.result(errors, "quotes");
    }

    /** Links each stored quote to its tags, for new and previously loaded quotes alike. */
    private void linkQuoteTags(List<CleanQuote> quotes, Map<String, Long> tagIds, List<String> errors) {
        if (quotes.isEmpty()) return;
        Map<String, Long> quoteIds = store.lookupIds("fact_quotes", "quote_id", "quote_hash",
                quotes.stream().map(CleanQuote::getTextHash).toList());
        int links = 0;
        for (CleanQuote quote : quotes) {
            Long quoteId = quoteIds.get(quote.getTextHash());
            if (quoteId == null) continue;
            for (String tag : quote.getTags()) {
                Long tagId = tagIds.get(tag);
                if (tagId == null) continue;
                try {
                    if (store.insertLink("quote_tags", row("quote_id", quoteId, "tag_id", tagId))) {
                        links++;
                    }
                } catch (PersistenceException e) {
                    if (e.isConnectionLevel()) throw e;
                    log.warn("Tag link {} → {} failed: {}", quoteId, tag, e.getMessage());
                    errors.add("Tag link " + quoteId + "/" + tag + ": " + e.getMessage());
                }
            }
        }
        log.info("Linked {} new quote/tag pairs", links);
    }

    // ── Librairies ────────────────────────────────────────────────────────────

    public LoadResult loadLibrairies(List<CleanLibrairie> librairies) {
        List<String> errors = new ArrayList<>();
        Counter counter = new Counter();
        for (CleanLibrairie l : librairies) {
            token.throwIfCancelled();
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("librairie_key", l.getLibrairieKey());
            fields.put("name", l.getName());
            fields.put("address", l.getAddress());
            fields.put("postcode", l.getPostcode());
            fields.put("city", l.getCity());
            fields.put("specialty", l.getSpecialty());
            fields.put("partnership_date", l.getPartnershipDate() == null ? null : Date.valueOf(l.getPartnershipDate()));
            fields.put("revenue_range", l.getRevenueRange());
            fields.put("contact_hash", l.getContactHash());
            fields.put("latitude", l.getLatitude());
            fields.put("longitude", l.getLongitude());
            fields.put("geocode_score", l.getGeocodeScore());
            fields.put("geocode_label", l.getGeocodeLabel());
            fields.put("imported_at", timestamp(l.getImportedAt()));
            fields.put("batch_id", l.getBatchId());
            counter.record(upsertFact("dim_librairies", "librairie_id", fields, "Librairie " + l.getLibrairieKey(), errors));
        }
        return counter.result(errors, "librairies");
    }

    // ── Run metadata ──────────────────────────────────────────────────────────

    /** Writes the run summary; a failure here is logged and never fails the run. */
    public void recordRun(PipelineReport report, String countersJson) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("batch_id", report.batchId());
        fields.put("started_at", timestamp(report.startedAt()));
        fields.put("completed_at", timestamp(report.completedAt()));
        fields.put("status", report.status().name());
        fields.put("last_phase", report.lastPhase().name());
        fields.put("books_loaded", loaded(report, Domain.BOOKS));
        fields.put("quotes_loaded", loaded(report, Domain.QUOTES));
        fields.put("librairies_loaded", loaded(report, Domain.LIBRAIRIES));
        fields.put("total_errors", report.totalErrors());
        fields.put("counters", countersJson);
        fields.put("errors", String.join("\n", report.errors()));
        try {
            store.insert("pipeline_runs", "run_id", fields);
        } catch (PersistenceException e) {
            log.warn("Failed to write pipeline run {}: {}", report.batchId(), e.getMessage());
        }
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    /**
     * Insert-or-ignore every row, then resolve all natural keys to ids in one pass, so keys
     * loaded by an earlier run are mapped too.
     */
    Map<String, Long> upsertDimension(String table, String idColumn, String keyColumn,
                                      List<Map<String, Object>> rows, List<String> errors) {
        if (rows.isEmpty()) return Map.of();
        int inserted = 0;
        for (Map<String, Object> row : rows) {
            try {
                if (store.insert(table, idColumn, row) != null) {
                    inserted++;
                }
            } catch (PersistenceException e) {
                if (e.isConnectionLevel()) throw e;
                log.warn("{} row {} skipped: {}", table, row.get(keyColumn), e.getMessage());
                errors.add(table + " " + row.get(keyColumn) + ": " + e.getMessage());
            }
        }
        List<String> keys = rows.stream().map(r -> String.valueOf(r.get(keyColumn))).toList();
        Map<String, Long> ids = store.lookupIds(table, idColumn, keyColumn, keys);
        log.info("{}: {} new, {} resolved", table, inserted, ids.size());
        return ids;
    }

    enum FactOutcome { INSERTED, EXISTING, FAILED }

    FactOutcome upsertFact(String table, String idColumn, Map<String, Object> fields,
                           String description, List<String> errors) {
        try {
            Long id = store.insert(table, idColumn, fields);
            return id == null ? FactOutcome.EXISTING : FactOutcome.INSERTED;
        } catch (PersistenceException e) {
            if (e.isConnectionLevel()) throw e;
            log.warn("{} skipped: {}", description, e.getMessage());
            errors.add(description + ": " + e.getMessage());
            return FactOutcome.FAILED;
        }
    }

    private static int loaded(PipelineReport report, Domain domain) {
        DomainCounters counters = report.counters().get(domain);
        return counters == null ? 0 : counters.getLoaded();
    }

    private static Timestamp timestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static final class Counter {
        int inserted;
        int existing;
        int failed;

        void record(FactOutcome outcome) {
            switch (outcome) {
                case INSERTED -> inserted++;
                case EXISTING -> existing++;
                case FAILED -> failed++;
            }
        }

        LoadResult result(List<String> errors, String domain) {
            log.info("Loaded {}: {} new, {} already present, {} failed", domain, inserted, existing, failed);
            return new LoadResult(inserted, existing, failed, List.copyOf(errors));
        }
    }
}
