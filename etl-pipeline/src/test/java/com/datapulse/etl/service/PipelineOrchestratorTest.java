package com.datapulse.etl.service;

import com.datapulse.etl.config.DataPulseProperties;
import com.datapulse.etl.extract.BookCatalogExtractor;
import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.extract.QuoteExtractor;
import com.datapulse.etl.extract.StubPageFetcher;
import com.datapulse.etl.geo.GeocodingClient;
import com.datapulse.etl.model.Domain;
import com.datapulse.etl.model.DomainCounters;
import com.datapulse.etl.model.PipelinePhase;
import com.datapulse.etl.model.PipelineReport;
import com.datapulse.etl.model.RunStatus;
import com.datapulse.etl.output.InMemoryRelationalStore;
import com.datapulse.etl.output.ObjectStore;
import com.datapulse.etl.output.PersistenceException;
import com.datapulse.etl.output.RelationalStore;
import com.datapulse.etl.output.StoreSession;
import com.datapulse.etl.spreadsheet.Anonymizer;
import com.datapulse.etl.spreadsheet.LibrairieImporter;
import com.datapulse.etl.spreadsheet.SpreadsheetReader;
import com.datapulse.etl.spreadsheet.SpreadsheetValidator;
import com.datapulse.etl.spreadsheet.Workbooks;
import com.datapulse.etl.transform.BookTransformer;
import com.datapulse.etl.transform.LibrairieTransformer;
import com.datapulse.etl.transform.QuoteTransformer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final String BOOKS = "http://books.test/";
    private static final String TRAVEL = BOOKS + "catalogue/category/books/travel_2/index.html";
    private static final String QUOTES = "http://quotes.test";
    private static final String GEO = "http://adresse.test";

    @Mock
    private ObjectStore objectStore;

    @TempDir
    Path dir;

    private StubPageFetcher web;
    private InMemoryRelationalStore store;
    private TestSession session;
    private DataPulseProperties properties;
    private PipelineOrchestrator orchestrator;
    private Path spreadsheet;

    /** Session over the in-memory store and the mocked object store. */
    private final class TestSession implements StoreSession {
        boolean closed;

        @Override
        public RelationalStore relationalStore() {
            return store;
        }

        @Override
        public ObjectStore objectStore() {
            return objectStore;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static String book(String slug, String title, String price) {
        return "<article class=\"product_pod\"><p class=\"star-rating Four\"></p>"
                + "<h3><a href=\"../../../" + slug + "/index.html\" title=\"" + title + "\">" + title + "</a></h3>"
                + "<p class=\"price_color\">" + price + "</p>"
                + "<p class=\"instock availability\">In stock (4 available)</p></article>";
    }

    private static String quote(String text, String author, String tag) {
        return "<div class=\"quote\"><span class=\"text\">“" + text + "”</span>"
                + "<small class=\"author\">" + author + "</small>"
                + "<a class=\"tag\" href=\"/tag/" + tag + "/\">" + tag + "</a></div>";
    }

    @BeforeEach
    void setUp() throws IOException {
        web = new StubPageFetcher()
                .page(BOOKS, "<div class=\"side_categories\"><ul class=\"nav-list\"><li><a href=\"#\">Books</a><ul>"
                        + "<li><a href=\"catalogue/category/books/travel_2/index.html\">Travel</a></li>"
                        + "</ul></li></ul></div>")
                .page(TRAVEL, "<ol>" + book("dune", "Dune", "£10.00") + book("emma", "Emma", "£20.00") + "</ol>")
                .page(QUOTES + "/", quote("Be yourself.", "Oscar Wilde", "honesty")
                        + quote("Stay hungry.", "Steve Jobs", "life")
                        + quote("be yourself.", "Oscar Wilde", "honesty"));
        store = new InMemoryRelationalStore();
        session = new TestSession();

        properties = new DataPulseProperties();
        properties.getGeocoding().setEnabled(false);

        spreadsheet = Workbooks.write(dir.resolve("partenaire_librairies.xlsx"), Workbooks.HEADERS, List.of(
                Workbooks.validRow("Le Livre Ouvert", "75011"),
                Workbooks.validRow("La Plume", "69002")));

        SpreadsheetReader reader = new SpreadsheetReader();
        orchestrator = new PipelineOrchestrator(
                new BookCatalogExtractor(StubPageFetcher.resilient(web), 10, BOOKS),
                new QuoteExtractor(StubPageFetcher.resilient(web), 10, QUOTES),
                new LibrairieImporter(reader, new SpreadsheetValidator(reader)),
                new GeocodingClient(StubPageFetcher.resilient(web), new ObjectMapper(), GEO, 1),
                new BookTransformer(new BigDecimal("1.17")),
                new QuoteTransformer(),
                new LibrairieTransformer(new Anonymizer("test-salt")),
                () -> session,
                new ObjectMapper().findAndRegisterModules(),
                properties);
    }

    private RunOptions options(Domain... domains) {
        return RunOptions.builder()
                .domains(EnumSet.copyOf(List.of(domains)))
                .spreadsheetPath(spreadsheet.toString())
                .build();
    }

    @Test
    void cleanRunLoadsEveryDomainAndSucceeds() {
        PipelineReport report = orchestrator.run(options(Domain.BOOKS, Domain.QUOTES, Domain.LIBRAIRIES),
                CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(report.lastPhase()).isEqualTo(PipelinePhase.DONE);
        assertThat(report.exitCode()).isZero();
        assertThat(report.batchId()).matches("pipeline_\\d{8}_\\d{6}_[0-9a-f]{8}");

        DomainCounters quotes = report.counters().get(Domain.QUOTES);
        assertThat(quotes.getExtracted()).isEqualTo(3);
        assertThat(quotes.getTransformed()).isEqualTo(2);
        assertThat(quotes.getDuplicates()).isEqualTo(1);
        assertThat(quotes.getLoaded()).isEqualTo(2);
        assertThat(report.counters().get(Domain.BOOKS).getLoaded()).isEqualTo(2);
        assertThat(report.counters().get(Domain.LIBRAIRIES).getLoaded()).isEqualTo(2);

        assertThat(store.count("fact_books")).isEqualTo(2);
        assertThat(store.count("dim_librairies")).isEqualTo(2);
        assertThat(store.rows("pipeline_runs")).singleElement()
                .satisfies(row -> assertThat(row.get("status")).isEqualTo("SUCCESS"));
        assertThat(session.closed).isTrue();
    }

    @Test
    void layersAreExportedUnderTheBatchId() {
        PipelineReport report = orchestrator.run(options(Domain.BOOKS), CancellationToken.none());
        String batch = report.batchId();

        verify(objectStore).ensureBuckets(List.of("images", "exports", "backups"));
        verify(objectStore).upload(eq("exports"), eq("bronze/books/books_" + batch + ".json"), any(), anyString());
        verify(objectStore).upload(eq("exports"), eq("bronze/books/books_" + batch + ".csv"), any(), eq("text/csv"));
        verify(objectStore).upload(eq("exports"), eq("silver/books/books_" + batch + ".json"), any(), anyString());
        verify(objectStore).upload(eq("exports"), eq("silver/books/books_" + batch + ".csv"), any(), eq("text/csv"));
        verify(objectStore).upload(eq("backups"), anyString(), any(), eq("application/json"));
    }

    @Test
    void secondRunOverTheSameDataInsertsNothing() {
        orchestrator.run(options(Domain.BOOKS, Domain.QUOTES), CancellationToken.none());
        PipelineReport second = orchestrator.run(options(Domain.BOOKS, Domain.QUOTES), CancellationToken.none());

        assertThat(second.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(second.counters().get(Domain.BOOKS).getLoaded()).isZero();
        assertThat(second.counters().get(Domain.BOOKS).getDuplicates()).isEqualTo(2);
        assertThat(store.count("fact_books")).isEqualTo(2);
        assertThat(store.count("fact_quotes")).isEqualTo(2);
        assertThat(store.count("pipeline_runs")).isEqualTo(2);
    }

    @Test
    void topTagListingsAreScrapedOnceEach() {
        properties.getQuotes().setTags(List.of("honesty"));
        properties.getQuotes().setTopTags(true);
        web.page(QUOTES + "/", "<div class=\"tags-box\"><a class=\"tag\" href=\"/tag/honesty/\">honesty</a>"
                        + "<a class=\"tag\" href=\"/tag/inspiration/\">inspiration</a></div>")
                .page(QUOTES + "/tag/honesty/", quote("Be yourself.", "Oscar Wilde", "honesty"))
                .page(QUOTES + "/tag/inspiration/", quote("Dream big.", "Walt Disney", "inspiration"));

        PipelineReport report = orchestrator.run(options(Domain.QUOTES), CancellationToken.none());

        assertThat(web.calls(QUOTES + "/tag/honesty/")).isEqualTo(1);
        assertThat(web.calls(QUOTES + "/tag/inspiration/")).isEqualTo(1);
        assertThat(report.counters().get(Domain.QUOTES).getExtracted()).isEqualTo(5);
        assertThat(store.count("fact_quotes")).isEqualTo(3);
    }

    @Test
    void rejectedSpreadsheetOnlySkipsLibrairies() {
        RunOptions options = RunOptions.builder()
                .domains(EnumSet.of(Domain.BOOKS, Domain.LIBRAIRIES))
                .spreadsheetPath(dir.resolve("missing.xlsx").toString())
                .build();

        PipelineReport report = orchestrator.run(options, CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.lastPhase()).isEqualTo(PipelinePhase.DONE);
        assertThat(report.exitCode()).isZero();
        assertThat(report.counters().get(Domain.LIBRAIRIES).getFailed()).isEqualTo(1);
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("librairies: ").contains("File not found"));
        assertThat(store.count("fact_books")).isEqualTo(2);
        assertThat(store.count("dim_librairies")).isZero();
    }

    @Test
    void invalidRowsMakeThePartialRunAndAreCounted() throws IOException {
        Workbooks.write(spreadsheet, Workbooks.HEADERS, List.of(
                Workbooks.validRow("Le Livre Ouvert", "75011"),
                Workbooks.validRow("Sans Code", "7501")));

        PipelineReport report = orchestrator.run(options(Domain.LIBRAIRIES), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.counters().get(Domain.LIBRAIRIES).getInvalid()).isEqualTo(1);
        assertThat(report.counters().get(Domain.LIBRAIRIES).getLoaded()).isEqualTo(1);
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).contains("code_postal"));
    }

    @Test
    void geocodingFailureIsReportedAndTheLibrairieIsStillLoaded() {
        properties.getGeocoding().setEnabled(true);
        String found = GEO + "/search/?q=" + URLEncoder.encode("12 rue des Lilas paris 75011", StandardCharsets.UTF_8)
                + "&limit=1&postcode=75011";
        web.page(found, "{\"features\": [{\"geometry\": {\"coordinates\": [2.38, 48.86]},"
                + " \"properties\": {\"label\": \"12 Rue des Lilas 75011 Paris\", \"score\": 0.9}}]}");
        String failing = GEO + "/search/?q=" + URLEncoder.encode("12 rue des Lilas paris 69002", StandardCharsets.UTF_8)
                + "&limit=1&postcode=69002";
        web.failing(failing, 503);

        PipelineReport report = orchestrator.run(options(Domain.LIBRAIRIES), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).contains("geocoding failed"));
        assertThat(store.rows("dim_librairies")).extracting(row -> row.get("latitude"))
                .containsExactlyInAnyOrder(48.86, null);
    }

    @Test
    void everyRunAsksTheGeocoderAgain() {
        properties.getGeocoding().setEnabled(true);
        String lilas = GEO + "/search/?q=" + URLEncoder.encode("12 rue des Lilas paris 75011", StandardCharsets.UTF_8)
                + "&limit=1&postcode=75011";
        web.page(lilas, "{\"type\": \"FeatureCollection\", \"features\": []}");

        orchestrator.run(options(Domain.LIBRAIRIES), CancellationToken.none());
        orchestrator.run(options(Domain.LIBRAIRIES), CancellationToken.none());

        assertThat(web.calls(lilas)).isEqualTo(2);
    }

    @Test
    void bronzeLibrairiesAreExportedAsCsv() {
        PipelineReport report = orchestrator.run(options(Domain.LIBRAIRIES, Domain.QUOTES), CancellationToken.none());
        String batch = report.batchId();

        verify(objectStore).upload(eq("exports"), eq("bronze/librairies/librairies_" + batch + ".csv"), any(), eq("text/csv"));
        verify(objectStore).upload(eq("exports"), eq("bronze/quotes/quotes_" + batch + ".csv"), any(), eq("text/csv"));
    }

    @Test
    void unreachableStoresFailTheRunBeforeExtracting() {
        PipelineOrchestrator offline = new PipelineOrchestrator(null, null, null, null, null, null, null,
                () -> {
                    throw new PersistenceException("connection refused", null, true);
                },
                new ObjectMapper(), properties);

        PipelineReport report = offline.run(RunOptions.defaults(), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.errors()).singleElement().satisfies(e -> assertThat(e).contains("connection refused"));
    }

    @Test
    void lostDatabaseFailsTheRunAndClosesTheSession() {
        store.disconnect();

        PipelineReport report = orchestrator.run(options(Domain.BOOKS), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.lastPhase()).isEqualTo(PipelinePhase.FAILED);
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("Failed during LOAD"));
        assertThat(session.closed).isTrue();
    }

    @Test
    void lostObjectStoreFailsTheRun() {
        doThrow(new PersistenceException("bucket check failed", null, true))
                .when(objectStore).ensureBuckets(any());

        PipelineReport report = orchestrator.run(options(Domain.BOOKS), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(web.totalCalls()).isZero();
    }

    @Test
    void recordLevelExportFailureIsOnlyReported() {
        doThrow(new PersistenceException("object too large", null, false))
                .when(objectStore).upload(anyString(), anyString(), any(), anyString());

        PipelineReport report = orchestrator.run(options(Domain.QUOTES), CancellationToken.none());

        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(report.lastPhase()).isEqualTo(PipelinePhase.DONE);
        assertThat(store.count("fact_quotes")).isEqualTo(2);
    }

    @Test
    void cancelledRunStopsAndIsRecorded() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        PipelineReport report = orchestrator.run(options(Domain.BOOKS, Domain.QUOTES), token);

        assertThat(report.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(report.exitCode()).isEqualTo(130);
        assertThat(web.totalCalls()).isZero();
        assertThat(store.rows("pipeline_runs")).singleElement()
                .satisfies(row -> assertThat(row.get("status")).isEqualTo("CANCELLED"));
        assertThat(session.closed).isTrue();
    }
}
