package com.datapulse.etl.output;

import com.datapulse.etl.extract.CancellationToken;
import com.datapulse.etl.extract.PipelineCancelledException;
import com.datapulse.etl.model.CleanBook;
import com.datapulse.etl.model.CleanLibrairie;
import com.datapulse.etl.model.CleanQuote;
import com.datapulse.etl.model.Domain;
import com.datapulse.etl.model.PipelinePhase;
import com.datapulse.etl.model.PipelineRun;
import com.datapulse.etl.model.RunStatus;
import com.datapulse.etl.transform.ContentHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagedLoaderTest {

    private InMemoryRelationalStore store;
    private StagedLoader loader;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelationalStore();
        loader = new StagedLoader(store);
    }

    static CleanBook book(String title, String category, int rating) {
        return CleanBook.builder()
                .bookKey(ContentHasher.hash("http://books.test/" + title))
                .title(title)
                .category(category)
                .categorySlug(category.toLowerCase().replace(' ', '-'))
                .priceGbp(new BigDecimal("10.00"))
                .priceEur(new BigDecimal("11.70"))
                .rating(rating)
                .inStock(true)
                .stockCount(5)
                .url("http://books.test/" + title)
                .scrapedAt(LocalDateTime.now())
                .batchId("batch-1")
                .build();
    }

    static CleanQuote quote(String text, String author, String... tags) {
        return CleanQuote.builder()
                .text(text)
                .textHash(ContentHasher.hash(text))
                .author(author)
                .authorSlug(author.toLowerCase().replace(' ', '-'))
                .tags(List.of(tags))
                .textLength(text.length())
                .scrapedAt(LocalDateTime.now())
                .batchId("batch-1")
                .build();
    }

    static CleanLibrairie librairie(String key) {
        return CleanLibrairie.builder()
                .librairieKey(key)
                .name(key)
                .address("1 rue Haute")
                .postcode("75011")
                .city("Paris")
                .partnershipDate(LocalDate.of(2020, 1, 1))
                .revenueRange("< 100k€")
                .importedAt(LocalDateTime.now())
                .batchId("batch-1")
                .build();
    }

    @Test
    void loadingTheSameBooksTwiceKeepsOneRowEach() {
        List<CleanBook> books = List.of(book("Dune", "Science Fiction", 5), book("Emma", "Classics", 4),
                book("Solaris", "Science Fiction", 4));

        LoadResult first = loader.loadBooks(books, Map.of());
        LoadResult second = loader.loadBooks(books, Map.of());

        assertThat(first.inserted()).isEqualTo(3);
        assertThat(second.inserted()).isZero();
        assertThat(second.existing()).isEqualTo(3);
        assertThat(store.count("fact_books")).isEqualTo(3);
        assertThat(store.count("dim_categories")).isEqualTo(2);
    }

    @Test
    void booksReferenceTheirCategoryAndImage() {
        CleanBook dune = book("Dune", "Science Fiction", 5);

        loader.loadBooks(List.of(dune), Map.of(dune.getBookKey(), "s3://images/books/x.jpg"));

        Map<String, Object> category = store.rows("dim_categories").get(0);
        Map<String, Object> fact = store.rows("fact_books").get(0);
        assertThat(fact.get("category_id")).isEqualTo(category.get("category_id"));
        assertThat(fact.get("image_uri")).isEqualTo("s3://images/books/x.jpg");
    }

    @Test
    void rejectedRecordIsSkippedAndTheRestLoads() {
        store.rejectRowsWhere(row -> Integer.valueOf(9).equals(row.get("rating")));

        LoadResult result = loader.loadBooks(List.of(
                book("Dune", "Science Fiction", 5),
                book("Broken", "Science Fiction", 9),
                book("Emma", "Classics", 4)), Map.of());

        assertThat(result.inserted()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).singleElement().satisfies(e -> assertThat(e).contains("Broken"));
    }

    @Test
    void lostConnectionAbortsTheLoad() {
        store.disconnect();

        assertThatThrownBy(() -> loader.loadBooks(List.of(book("Dune", "Science Fiction", 5)), Map.of()))
                .isInstanceOf(PersistenceException.class)
                .satisfies(e -> assertThat(((PersistenceException) e).isConnectionLevel()).isTrue());
    }

    @Test
    void quotesAreLinkedToAuthorsAndTagsIdempotently() {
        List<CleanQuote> quotes = List.of(
                quote("Be yourself.", "Oscar Wilde", "inspirational", "honesty"),
                quote("We are all in the gutter.", "Oscar Wilde", "inspirational"));

        LoadResult first = loader.loadQuotes(quotes);
        LoadResult second = loader.loadQuotes(quotes);

        assertThat(first.inserted()).isEqualTo(2);
        assertThat(second.existing()).isEqualTo(2);
        assertThat(store.count("dim_authors")).isEqualTo(1);
        assertThat(store.count("dim_tags")).isEqualTo(2);
        assertThat(store.count("quote_tags")).isEqualTo(3);
        assertThat(store.count("fact_quotes")).isEqualTo(2);
    }

    @Test
    void quoteLoadedEarlierStillGetsNewTagLinks() {
        loader.loadQuotes(List.of(quote("Be yourself.", "Oscar Wilde")));
        loader.loadQuotes(List.of(quote("Be yourself.", "Oscar Wilde", "honesty")));

        assertThat(store.count("fact_quotes")).isEqualTo(1);
        assertThat(store.count("quote_tags")).isEqualTo(1);
    }

    @Test
    void tagsKeepTheirDisplayName() {
        CleanQuote quote = CleanQuote.builder()
                .text("Be yourself.")
                .textHash(ContentHasher.hash("Be yourself."))
                .author("Oscar Wilde")
                .authorSlug("oscar-wilde")
                .tag("be-yourself")
                .tagName("be-yourself", "Be Yourself")
                .tag("honesty")
                .textLength(12)
                .scrapedAt(LocalDateTime.now())
                .batchId("batch-1")
                .build();

        loader.loadQuotes(List.of(quote));

        assertThat(store.rows("dim_tags"))
                .extracting(row -> row.get("slug"), row -> row.get("name"))
                .containsExactly(tuple("be-yourself", "Be Yourself"), tuple("honesty", "honesty"));
    }

    @Test
    void librairiesAreKeyedByNaturalKey() {
        loader.loadLibrairies(List.of(librairie("le-livre-ouvert-75011"), librairie("la-plume-69002")));
        LoadResult again = loader.loadLibrairies(List.of(librairie("le-livre-ouvert-75011")));

        assertThat(again.existing()).isEqualTo(1);
        assertThat(store.count("dim_librairies")).isEqualTo(2);
        assertThat(store.rows("dim_librairies").get(0).get("partnership_date"))
                .isEqualTo(java.sql.Date.valueOf(LocalDate.of(2020, 1, 1)));
    }

    @Test
    void cancellationStopsBetweenRecords() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        StagedLoader cancelled = new StagedLoader(store, token);

        assertThatThrownBy(() -> cancelled.loadLibrairies(List.of(librairie("a-75011"))))
                .isInstanceOf(PipelineCancelledException.class);
        assertThat(store.count("dim_librairies")).isZero();
    }

    @Test
    void runSummaryIsRecordedAndFailureToDoSoIsIgnored() {
        PipelineRun run = PipelineRun.start(20);
        run.counters(Domain.BOOKS).addLoaded(12);
        run.setStatus(RunStatus.SUCCESS);
        run.setPhase(PipelinePhase.DONE);
        run.setCompletedAt(LocalDateTime.now());

        loader.recordRun(run.toReport(), "{}");

        Map<String, Object> row = store.rows("pipeline_runs").get(0);
        assertThat(row.get("batch_id")).isEqualTo(run.getBatchId());
        assertThat(row.get("books_loaded")).isEqualTo(12);
        assertThat(row.get("quotes_loaded")).isEqualTo(0);
        assertThat(row.get("status")).isEqualTo("SUCCESS");

        store.disconnect();
        loader.recordRun(run.toReport(), "{}");
    }
}
