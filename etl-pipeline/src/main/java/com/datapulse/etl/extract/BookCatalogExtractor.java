package com.datapulse.etl.extract;

import com.datapulse.etl.model.RawBook;
import com.datapulse.etl.model.RecordMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scrapes books.toscrape.com: reads the category menu from the home page, then walks each
 * category's paginated listing.
 *
 * Page structure:
 * <pre>
 *   div.side_categories ul.nav-list > li > ul > li > a   category links
 *   article.product_pod                                  one book
 *     h3 > a[title]  p.price_color  p.star-rating.Three  p.availability  img.thumbnail
 *   li.next > a                                          next page
 * </pre>
 */
@Slf4j
public class BookCatalogExtractor extends PaginatedExtractor<RawBook> {

    static final String CATEGORY_SELECTOR = "div.side_categories ul.nav-list > li > ul > li > a";
    static final String SOURCE = "books.toscrape.com";

    private final String baseUrl;

    public BookCatalogExtractor(ResilientFetcher fetcher, int hardPageCap, String baseUrl) {
        super(fetcher, hardPageCap);
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/") + "/";
    }

    /**
     * Categories listed in the side menu of the home page, in menu order.
     * Empty if the home page cannot be fetched.
     */
    public List<CatalogCategory> listCategories(CancellationToken token) {
        FetchOutcome outcome = fetcher.fetch(baseUrl, token);
        if (!outcome.isOk()) {
            log.error("Could not read category menu from {}: {}", baseUrl, outcome.reason());
            return List.of();
        }
        Document home = Jsoup.parse(outcome.text(), baseUrl);
        List<CatalogCategory> categories = new ArrayList<>();
        for (Element link : home.select(CATEGORY_SELECTOR)) {
            String name = StringUtils.normalizeSpace(link.text());
            String url = link.absUrl("href");
            if (!name.isEmpty() && !url.isEmpty()) {
                categories.add(new CatalogCategory(name, url));
            }
        }
        log.info("Found {} book categories", categories.size());
        return categories;
    }

    public Listing<RawBook> extractCategory(CatalogCategory category, Integer maxPages,
                                            String batchId, CancellationToken token) {
        ListingContext context = new ListingContext(category.name(), SOURCE, batchId, category.url());
        return extract(category.url(), maxPages, context, token);
    }

    /**
     * Every book of the first {@code limitCategories} categories (all when null),
     * at most {@code maxPagesPerCategory} pages each.
     */
    public ChainedListing<RawBook> extractAll(Integer limitCategories, Integer maxPagesPerCategory,
                                              String batchId, CancellationToken token) {
        List<CatalogCategory> categories = listCategories(token);
        if (limitCategories != null && limitCategories > 0 && limitCategories < categories.size()) {
            categories = categories.subList(0, limitCategories);
        }
        List<Supplier<Listing<RawBook>>> listings = new ArrayList<>();
        for (CatalogCategory category : categories) {
            listings.add(() -> {
                log.info("Scraping category '{}'", category.name());
                return extractCategory(category, maxPagesPerCategory, batchId, token);
            });
        }
        return new ChainedListing<>(listings);
    }

    /** Cover image bytes, empty when the download fails. */
    public Optional<byte[]> downloadImage(String imageUrl, CancellationToken token) {
        if (StringUtils.isBlank(imageUrl)) {
            return Optional.empty();
        }
        FetchOutcome outcome = fetcher.fetch(imageUrl, token);
        if (!outcome.isOk()) {
            log.warn("Image download failed for {}: {}", imageUrl, outcome.reason());
            return Optional.empty();
        }
        return Optional.ofNullable(outcome.body());
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    @Override
    protected List<Element> selectItems(Document page) {
        return page.select("article.product_pod");
    }

    @Override
    protected RawBook parseItem(Element article, ListingContext context) {
        Element link = article.selectFirst("h3 > a");
        if (link == null) {
            throw new ItemParseException("book without title link");
        }
        String title = link.hasAttr("title") ? link.attr("title") : link.text();
        if (StringUtils.isBlank(title)) {
            throw new ItemParseException("book without title");
        }

        Element price = article.selectFirst("p.price_color");
        if (price == null) {
            throw new ItemParseException("no price for '" + title + "'");
        }

        return RawBook.builder()
                .title(title.trim())
                .priceText(price.text().trim())
                .ratingToken(ratingToken(article))
                .availabilityText(textOf(article.selectFirst("p.availability")))
                .imageUrl(absUrlOf(article.selectFirst("img.thumbnail, img"), "src"))
                .detailUrl(link.absUrl("href"))
                .category(context.label())
                .metadata(new RecordMetadata(context.source(), LocalDateTime.now(), context.batchId()))
                .build();
    }

    private static String ratingToken(Element article) {
        Element rating = article.selectFirst("p.star-rating");
        if (rating == null) {
            return null;
        }
        return rating.classNames().stream()
                .filter(c -> !c.equals("star-rating"))
                .findFirst()
                .orElse(null);
    }

    private static String textOf(Element element) {
        return element == null ? null : StringUtils.normalizeSpace(element.text());
    }

    private static String absUrlOf(Element element, String attribute) {
        if (element == null) {
            return null;
        }
        String url = element.absUrl(attribute);
        return url.isEmpty() ? null : url;
    }
}
