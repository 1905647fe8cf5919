package com.datapulse.etl.transform;

import com.datapulse.etl.model.CleanBook;
import com.datapulse.etl.model.RawBook;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bronze to silver for books: price conversion, rating and stock parsing, content key.
 */
@Slf4j
public class BookTransformer {

    private static final Map<String, Integer> RATINGS = Map.of(
            "one", 1, "two", 2, "three", 3, "four", 4, "five", 5);

    private static final Pattern PRICE = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern AVAILABLE_COUNT = Pattern.compile("\\((\\d+) available\\)");

    private final BigDecimal gbpToEur;

    public BookTransformer(BigDecimal gbpToEur) {
        this.gbpToEur = gbpToEur;
    }

    public TransformResult<CleanBook> transform(List<RawBook> rawBooks) {
        List<CleanBook> converted = new ArrayList<>(rawBooks.size());
        List<String> errors = new ArrayList<>();
        for (RawBook raw : rawBooks) {
            try {
                converted.add(toClean(raw));
            } catch (IllegalArgumentException e) {
                String message = "Book '" + raw.getTitle() + "': " + e.getMessage();
                log.warn("Skipping {}", message);
                errors.add(message);
            }
        }
        DedupResult<CleanBook> deduplicated = ContentDeduplicator.deduplicate(converted, CleanBook::getBookKey);
        log.info("Books: {} → {} clean ({} duplicates, {} failed)",
                rawBooks.size(), deduplicated.retained().size(), deduplicated.duplicates(), errors.size());
        return new TransformResult<>(deduplicated.retained(), deduplicated.duplicates(), errors.size(), errors);
    }

    CleanBook toClean(RawBook raw) {
        BigDecimal priceGbp = parsePrice(raw.getPriceText());
        int stock = parseStockCount(raw.getAvailabilityText());
        String title = StringUtils.normalizeSpace(raw.getTitle());
        String category = StringUtils.defaultIfBlank(StringUtils.normalizeSpace(raw.getCategory()), "Uncategorized");

        return CleanBook.builder()
                .bookKey(bookKey(raw.getDetailUrl(), title, category))
                .title(title)
                .category(category)
                .categorySlug(Slugs.slugify(category))
                .priceGbp(priceGbp)
                .priceEur(convert(priceGbp))
                .rating(parseRating(raw.getRatingToken()))
                .inStock(stock > 0)
                .stockCount(stock)
                .url(raw.getDetailUrl())
                .imageUrl(raw.getImageUrl())
                .scrapedAt(raw.getMetadata().fetchedAt())
                .batchId(raw.getMetadata().batchId())
                .build();
    }

    /** Source price times the configured rate, rounded half-up to cents. */
    public BigDecimal convert(BigDecimal priceGbp) {
        return priceGbp.multiply(gbpToEur).setScale(2, RoundingMode.HALF_UP);
    }

    /** "£51.77" → 51.77 */
    public static BigDecimal parsePrice(String priceText) {
        if (priceText == null) {
            throw new IllegalArgumentException("missing price");
        }
        Matcher m = PRICE.matcher(priceText);
        if (!m.find()) {
            throw new IllegalArgumentException("unreadable price '" + priceText + "'");
        }
        return new BigDecimal(m.group(1).replace(',', '.'));
    }

    /** "One".."Five" (any case) → 1..5; anything else → 0. */
    public static int parseRating(String token) {
        if (token == null) {
            return 0;
        }
        return RATINGS.getOrDefault(token.trim().toLowerCase(Locale.ROOT), 0);
    }

    /** "In stock (22 available)" → 22, "In stock" → 1, anything else → 0. */
    public static int parseStockCount(String availability) {
        if (availability == null) {
            return 0;
        }
        Matcher m = AVAILABLE_COUNT.matcher(availability);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        return availability.toLowerCase(Locale.ROOT).contains("in stock") ? 1 : 0;
    }

    /** Hash of the normalized product URL, or of title and category when there is none. */
    static String bookKey(String detailUrl, String title, String category) {
        if (StringUtils.isNotBlank(detailUrl)) {
            return ContentHasher.hash(StringUtils.removeEnd(detailUrl.trim(), "/"));
        }
        return ContentHasher.hash(title + "|" + category);
    }
}
