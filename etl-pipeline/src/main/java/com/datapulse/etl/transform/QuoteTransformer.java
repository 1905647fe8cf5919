package com.datapulse.etl.transform;

import com.datapulse.etl.model.CleanQuote;
import com.datapulse.etl.model.RawQuote;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bronze to silver for quotes: strips decorative quotation marks, hashes the text,
 * slugifies author and tags, drops repeated quotes.
 */
@Slf4j
public class QuoteTransformer {

    private static final Pattern DECORATIVE_QUOTES = Pattern.compile("^[“”«»\"\\s]+|[“”«»\"\\s]+$");

    public TransformResult<CleanQuote> transform(List<RawQuote> rawQuotes) {
        List<CleanQuote> converted = new ArrayList<>(rawQuotes.size());
        List<String> errors = new ArrayList<>();
        for (RawQuote raw : rawQuotes) {
            String text = cleanText(raw.getText());
            if (text.isEmpty()) {
                errors.add("Empty quote from " + raw.getAuthor());
                continue;
            }
            converted.add(toClean(raw, text));
        }
        DedupResult<CleanQuote> deduplicated = ContentDeduplicator.deduplicate(converted, CleanQuote::getTextHash);
        log.info("Quotes: {} → {} clean ({} duplicates, {} failed)",
                rawQuotes.size(), deduplicated.retained().size(), deduplicated.duplicates(), errors.size());
        return new TransformResult<>(deduplicated.retained(), deduplicated.duplicates(), errors.size(), errors);
    }

    private CleanQuote toClean(RawQuote raw, String text) {
        String author = StringUtils.defaultIfBlank(StringUtils.normalizeSpace(raw.getAuthor()), "Unknown");
        Map<String, String> tags = new LinkedHashMap<>();
        for (String tag : raw.getTags()) {
            String slug = Slugs.slugify(tag);
            if (!slug.isEmpty()) {
                tags.putIfAbsent(slug, StringUtils.normalizeSpace(tag));
            }
        }
        return CleanQuote.builder()
                .text(text)
                .textHash(ContentHasher.hash(text))
                .author(author)
                .authorSlug(Slugs.slugify(author))
                .authorUrl(raw.getAuthorUrl())
                .tags(tags.keySet())
                .tagNames(tags)
                .textLength(text.length())
                .scrapedAt(raw.getMetadata().fetchedAt())
                .batchId(raw.getMetadata().batchId())
                .build();
    }

    /** “The world as we have created it…” → The world as we have created it… */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return DECORATIVE_QUOTES.matcher(text).replaceAll("");
    }
}
