package com.datapulse.etl.extract;

import com.datapulse.etl.model.RawQuote;
import org.junit.jupiter.api.Test;

import static com.datapulse.etl.extract.QuotePages.page;
import static com.datapulse.etl.extract.QuotePages.quote;
import static org.assertj.core.api.Assertions.assertThat;

class QuoteExtractorTest {

    private static final String BASE = "http://quotes.test";

    private final StubPageFetcher stub = new StubPageFetcher();
    private final QuoteExtractor extractor = new QuoteExtractor(StubPageFetcher.resilient(stub), 50, BASE + "/");

    @Test
    void parsesTextAuthorAndTags() {
        stub.page(BASE + "/", page(null,
                quote("“The world as we have created it is a process of our thinking.”",
                        "Albert Einstein", "change", "deep-thoughts")));

        RawQuote quote = extractor.extractAll(null, "batch-1", CancellationToken.none()).next();

        assertThat(quote.getText()).startsWith("“The world");
        assertThat(quote.getAuthor()).isEqualTo("Albert Einstein");
        assertThat(quote.getAuthorUrl()).isEqualTo(BASE + "/author/Albert-Einstein");
        assertThat(quote.getTags()).containsExactly("change", "deep-thoughts");
        assertThat(quote.getMetadata().source()).isEqualTo("quotes.toscrape.com");
        assertThat(quote.getMetadata().batchId()).isEqualTo("batch-1");
    }

    @Test
    void missingAuthorFallsBackToUnknown() {
        stub.page(BASE + "/", page(null,
                "<div class=\"quote\"><span class=\"text\">Anonymous wisdom</span></div>"));

        RawQuote quote = extractor.extractAll(null, "b", CancellationToken.none()).next();

        assertThat(quote.getAuthor()).isEqualTo("Unknown");
        assertThat(quote.getAuthorUrl()).isNull();
        assertThat(quote.getTags()).isEmpty();
    }

    @Test
    void tagListingStartsFromTheTagPage() {
        stub.page(BASE + "/tag/deep+thoughts/", page(null, quote("Deep", "Ann", "deep thoughts")));

        RawQuote quote = extractor.extractByTag("deep thoughts", 1, "b", CancellationToken.none()).next();

        assertThat(quote.getText()).isEqualTo("Deep");
        assertThat(stub.requests()).containsExactly(BASE + "/tag/deep+thoughts/");
    }

    @Test
    void readsTopTagsFromTheHomePage() {
        stub.page(BASE + "/", "<div class=\"tags-box\"><a class=\"tag\" href=\"/tag/love/\">love</a>"
                + "<a class=\"tag\" href=\"/tag/life/\"> life </a></div>");

        assertThat(extractor.listTopTags(CancellationToken.none())).containsExactly("love", "life");
    }
}
