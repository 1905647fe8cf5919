package com.datapulse.etl.extract;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Walks a paginated HTML listing and yields one item per listed element.
 *
 * Each call to {@link #extract} returns a fresh {@link Listing} that fetches lazily: a page
 * is only requested once the items of the previous one have been consumed. A listing is
 * not restartable; call {@code extract} again to start over from the seed.
 *
 * @param <T> bronze record type produced by {@link #parseItem}
 */
@Slf4j
public abstract class PaginatedExtractor<T> {

    static final String NEXT_LINK_SELECTOR = "li.next > a";

    protected final ResilientFetcher fetcher;
    private final int hardPageCap;

    protected PaginatedExtractor(ResilientFetcher fetcher, int hardPageCap) {
        this.fetcher = fetcher;
        this.hardPageCap = hardPageCap;
    }

    /** Elements on the page that each describe one item. */
    protected abstract List<Element> selectItems(Document page);

    /**
     * Builds one record from a listed element.
     *
     * @throws ItemParseException or any runtime exception to skip the element
     */
    protected abstract T parseItem(Element element, ListingContext context);

    /** Absolute URL of the next page, or null on the last one. */
    protected String nextPageUrl(Document page) {
        Element next = page.selectFirst(NEXT_LINK_SELECTOR);
        if (next == null) {
            return null;
        }
        String href = next.absUrl("href");
        return href.isEmpty() ? null : href;
    }

    /**
     * @param maxPages stop after this many pages; null or non-positive means no limit other
     *                 than the hard page cap
     */
    public Listing<T> extract(String seedUrl, Integer maxPages, ListingContext context, CancellationToken token) {
        int limit = (maxPages == null || maxPages <= 0) ? hardPageCap : Math.min(maxPages, hardPageCap);
        return new Listing<>(this, seedUrl, limit, context, token);
    }

    // ── Listing ──────────────────────────────────────────────────────────────

    enum State { FETCH, PARSE, FOLLOW_NEXT, TERMINATE }

    /**
     * Iterator over one listing, driven by the FETCH, PARSE, FOLLOW_NEXT and TERMINATE states.
     */
    public static final class Listing<T> implements Iterator<T> {

        private final PaginatedExtractor<T> extractor;
        private final int pageLimit;
        private final ListingContext context;
        private final CancellationToken token;
        private final ExtractionStats stats = new ExtractionStats();
        private final Set<String> visited = new HashSet<>();
        private final Deque<T> buffer = new ArrayDeque<>();

        private State state = State.FETCH;
        private String currentUrl;
        private Document currentPage;

        Listing(PaginatedExtractor<T> extractor, String seedUrl, int pageLimit,
                ListingContext context, CancellationToken token) {
            this.extractor = extractor;
            this.pageLimit = pageLimit;
            this.context = context;
            this.token = token;
            this.currentUrl = seedUrl;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && state != State.TERMINATE) {
                step();
            }
            return !buffer.isEmpty();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        public ExtractionStats getStats() {
            return stats;
        }

        State getState() {
            return state;
        }

        private void step() {
            switch (state) {
                case FETCH -> fetch();
                case PARSE -> parse();
                case FOLLOW_NEXT -> followNext();
                case TERMINATE -> { }
            }
        }

        private void fetch() {
            token.throwIfCancelled();
            if (!visited.add(currentUrl)) {
                log.warn("[{}] page {} already visited, stopping", context.label(), currentUrl);
                state = State.TERMINATE;
                return;
            }
            FetchOutcome outcome = extractor.fetcher.fetch(currentUrl, token);
            switch (outcome.kind()) {
                case OK -> {
                    currentPage = Jsoup.parse(outcome.text(), currentUrl);
                    stats.setPagesFetched(stats.getPagesFetched() + 1);
                    state = State.PARSE;
                }
                case NOT_FOUND -> {
                    log.info("[{}] {} not found, end of listing", context.label(), currentUrl);
                    state = State.TERMINATE;
                }
                default -> {
                    String message = "Page " + currentUrl + " failed: " + outcome.reason();
                    log.error("[{}] {}", context.label(), message);
                    stats.pageError(message);
                    state = State.TERMINATE;
                }
            }
        }

        private void parse() {
            ListingContext pageContext = context.onPage(currentUrl);
            List<Element> elements = extractor.selectItems(currentPage);
            int parsed = 0;
            for (Element element : elements) {
                try {
                    T item = extractor.parseItem(element, pageContext);
                    if (item != null) {
                        buffer.add(item);
                        parsed++;
                    }
                } catch (RuntimeException e) {
                    String message = "Skipped item on " + currentUrl + ": " + e.getMessage();
                    log.warn("[{}] {}", context.label(), message);
                    stats.itemError(message);
                }
            }
            stats.setItemsParsed(stats.getItemsParsed() + parsed);
            log.debug("[{}] page {} -> {} items", context.label(), stats.getPagesFetched(), parsed);
            state = State.FOLLOW_NEXT;
        }

        private void followNext() {
            String next = extractor.nextPageUrl(currentPage);
            currentPage = null;
            if (next == null) {
                state = State.TERMINATE;
            } else if (stats.getPagesFetched() >= pageLimit) {
                log.info("[{}] page limit {} reached", context.label(), pageLimit);
                state = State.TERMINATE;
            } else {
                currentUrl = next;
                state = State.FETCH;
            }
        }
    }
}
