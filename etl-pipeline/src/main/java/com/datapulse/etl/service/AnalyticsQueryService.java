package com.datapulse.etl.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only analytics over the gold layer.
 *
 * Every join goes from a fact's foreign key to the dimension's primary key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalyticsQueryService {

    private final JdbcTemplate jdbcTemplate;

    /** Book count, price and rating statistics per category. */
    public List<Map<String, Object>> categoryStats() {
        return jdbcTemplate.queryForList("""
            SELECT
                c.name                         AS category,
                COUNT(b.book_id)               AS books,
                ROUND(AVG(b.price_eur), 2)     AS avg_price_eur,
                ROUND(AVG(b.rating), 2)        AS avg_rating,
                MIN(b.price_eur)               AS min_price_eur,
                MAX(b.price_eur)               AS max_price_eur,
                SUM(b.stock_count)             AS total_stock
            FROM fact_books b
            JOIN dim_categories c ON b.category_id = c.category_id
            GROUP BY c.category_id, c.name
            ORDER BY books DESC, category
            """);
    }

    /** Authors with the most quotes, with their quote lengths and tags. */
    public List<Map<String, Object>> topAuthors(int limit) {
        return jdbcTemplate.queryForList("""
            SELECT
                a.name                                   AS author,
                COUNT(DISTINCT q.quote_id)               AS quotes,
                ROUND(AVG(q.text_length), 0)             AS avg_length,
                STRING_AGG(DISTINCT t.name, ', ')        AS tags
            FROM fact_quotes q
            JOIN dim_authors a ON q.author_id = a.author_id
            LEFT JOIN quote_tags qt ON qt.quote_id = q.quote_id
            LEFT JOIN dim_tags t ON qt.tag_id = t.tag_id
            GROUP BY a.author_id, a.name
            ORDER BY quotes DESC, author
            LIMIT ?
            """, limit);
    }

    /** Most expensive books of each category, ranked with RANK(). */
    public List<Map<String, Object>> topBooksByPrice(int perCategory) {
        return jdbcTemplate.queryForList("""
            SELECT category, title, price_eur, rating, price_rank, diff_from_avg_eur
            FROM (
                SELECT
                    c.name       AS category,
                    b.title,
                    b.price_eur,
                    b.rating,
                    RANK() OVER (PARTITION BY b.category_id ORDER BY b.price_eur DESC) AS price_rank,
                    ROUND(b.price_eur - AVG(b.price_eur) OVER (PARTITION BY b.category_id), 2) AS diff_from_avg_eur
                FROM fact_books b
                JOIN dim_categories c ON b.category_id = c.category_id
            ) ranked
            WHERE price_rank <= ?
            ORDER BY category, price_rank
            """, perCategory);
    }

    /** Partner bookshops with coordinates. */
    public List<Map<String, Object>> geolocatedLibrairies() {
        return jdbcTemplate.queryForList("""
            SELECT name, address, postcode, city, specialty, revenue_range,
                   latitude, longitude, geocode_score
            FROM dim_librairies
            WHERE latitude IS NOT NULL AND longitude IS NOT NULL
            ORDER BY city, name
            """);
    }

    /** Completeness of each gold table. */
    public Map<String, Object> dataQuality() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("books", jdbcTemplate.queryForMap("""
            SELECT
                COUNT(*)                                          AS total,
                COUNT(*) FILTER (WHERE price_eur IS NULL)         AS missing_price,
                COUNT(*) FILTER (WHERE rating = 0)                AS unrated,
                COUNT(*) FILTER (WHERE NOT in_stock)              AS out_of_stock,
                COUNT(*) FILTER (WHERE image_uri IS NULL)         AS without_image
            FROM fact_books
            """));
        report.put("quotes", jdbcTemplate.queryForMap("""
            SELECT
                COUNT(*)                                                         AS total,
                COUNT(*) FILTER (WHERE NOT EXISTS
                    (SELECT 1 FROM quote_tags qt WHERE qt.quote_id = q.quote_id)) AS without_tags
            FROM fact_quotes q
            """));
        report.put("librairies", jdbcTemplate.queryForMap("""
            SELECT
                COUNT(*)                                              AS total,
                COUNT(*) FILTER (WHERE latitude IS NULL)              AS not_geocoded,
                COUNT(*) FILTER (WHERE contact_hash IS NULL)          AS without_contact,
                COUNT(*) FILTER (WHERE revenue_range = 'Non renseigné') AS revenue_not_provided
            FROM dim_librairies
            """));
        return report;
    }

    /** Headline counts plus the last recorded run. */
    public Map<String, Object> dashboard() {
        Map<String, Object> dashboard = new LinkedHashMap<>(jdbcTemplate.queryForMap("""
            SELECT
                (SELECT COUNT(*) FROM fact_books)       AS books,
                (SELECT COUNT(*) FROM dim_categories)   AS categories,
                (SELECT COUNT(*) FROM fact_quotes)      AS quotes,
                (SELECT COUNT(*) FROM dim_authors)      AS authors,
                (SELECT COUNT(*) FROM dim_tags)         AS tags,
                (SELECT COUNT(*) FROM dim_librairies)   AS librairies,
                (SELECT ROUND(AVG(price_eur), 2) FROM fact_books) AS avg_book_price_eur
            """));
        List<Map<String, Object>> lastRun = jdbcTemplate.queryForList("""
            SELECT batch_id, started_at, completed_at, status, last_phase, total_errors
            FROM pipeline_runs
            ORDER BY started_at DESC
            LIMIT 1
            """);
        dashboard.put("lastRun", lastRun.isEmpty() ? null : lastRun.get(0));
        log.debug("Dashboard computed: {}", dashboard);
        return dashboard;
    }
}
