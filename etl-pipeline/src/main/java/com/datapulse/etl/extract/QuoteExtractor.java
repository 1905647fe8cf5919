package com.datapulse.etl.extract;

import com.datapulse.etl.model.RawQuote;
import com.datapulse.etl.model.RecordMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes quotes.toscrape.com, either the main listing or the listing of one tag.
 */
@Slf4j
public class QuoteExtractor extends PaginatedExtractor<RawQuote> {

    static final String SOURCE = "quotes.toscrape.com";

    private final String baseUrl;

    public QuoteExtractor(ResilientFetcher fetcher, int hardPageCap, String baseUrl) {
        super(fetcher, hardPageCap);
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    public Listing<RawQuote> extractAll(Integer maxPages, String batchId, CancellationToken token) {
        String seed = baseUrl + "/";
        return extract(seed, maxPages, new ListingContext("all", SOURCE, batchId, seed), token);
    }

    public Listing<RawQuote> extractByTag(String tag, Integer maxPages, String batchId, CancellationToken token) {
        String seed = baseUrl + "/tag/" + URLEncoder.encode(tag.trim(), StandardCharsets.UTF_8) + "/";
        return extract(seed, maxPages, new ListingContext("tag:" + tag, SOURCE, batchId, seed), token);
    }

    /** Tag names from the "Top Ten tags" box of the home page. */
    public List<String> listTopTags(CancellationToken token) {
        String home = baseUrl + "/";
        FetchOutcome outcome = fetcher.fetch(home, token);
        if (!outcome.isOk()) {
            log.error("Could not read tag list from {}: {}", home, outcome.reason());
            return List.of();
        }
        Document page = Jsoup.parse(outcome.text(), home);
        List<String> tags = new ArrayList<>();
        for (Element tag : page.select("div.tags-box a.tag")) {
            tags.add(tag.text().trim());
        }
        return tags;
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    @Override
    protected List<Element> selectItems(Document page) {
        return page.select("div.quote");
    }

    @Override
    protected RawQuote parseItem(Element quote, ListingContext context) {
        Element text = quote.selectFirst("span.text");
        if (text == null || text.text().isBlank()) {
            throw new ItemParseException("quote without text");
        }
        Element author = quote.selectFirst("small.author");
        Element authorLink = quote.selectFirst("a[href*=/author/]");

        RawQuote.RawQuoteBuilder builder = RawQuote.builder()
                .text(text.text())
                .author(author == null || author.text().isBlank() ? "Unknown" : author.text().trim())
                .authorUrl(authorLink == null ? null : authorLink.absUrl("href"))
                .metadata(new RecordMetadata(context.source(), LocalDateTime.now(), context.batchId()));
        for (Element tag : quote.select("a.tag")) {
            String name = tag.text().trim();
            if (!name.isEmpty()) {
                builder.tag(name);
            }
        }
        return builder.build();
    }
}
