package com.datapulse.etl.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Dimensional schema of the gold layer. Every statement is idempotent.
 *
 * Dimensions are unique on their natural slug or key, facts on their content key, and every
 * fact references its dimension through a foreign key to the dimension's primary key.
 */
@Slf4j
@RequiredArgsConstructor
public class GoldSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring PostgreSQL schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_categories
            (
                category_id     SERIAL PRIMARY KEY,
                name            VARCHAR(100) NOT NULL,
                slug            VARCHAR(100) NOT NULL UNIQUE,
                created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fact_books
            (
                book_id         SERIAL PRIMARY KEY,
                book_key        VARCHAR(64) NOT NULL UNIQUE,
                title           VARCHAR(500) NOT NULL,
                category_id     INTEGER NOT NULL REFERENCES dim_categories (category_id),
                price_gbp       NUMERIC(10, 2),
                price_eur       NUMERIC(10, 2),
                rating          SMALLINT CHECK (rating BETWEEN 0 AND 5),
                in_stock        BOOLEAN NOT NULL DEFAULT FALSE,
                stock_count     INTEGER NOT NULL DEFAULT 0,
                url             TEXT,
                image_url       TEXT,
                image_uri       TEXT,
                scraped_at      TIMESTAMP,
                batch_id        VARCHAR(64),
                created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_authors
            (
                author_id       SERIAL PRIMARY KEY,
                name            VARCHAR(200) NOT NULL,
                slug            VARCHAR(200) NOT NULL UNIQUE,
                url             TEXT,
                created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_tags
            (
                tag_id          SERIAL PRIMARY KEY,
                name            VARCHAR(100) NOT NULL,
                slug            VARCHAR(100) NOT NULL UNIQUE,
                created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fact_quotes
            (
                quote_id        SERIAL PRIMARY KEY,
                quote_hash      VARCHAR(64) NOT NULL UNIQUE,
                text            TEXT NOT NULL,
                author_id       INTEGER NOT NULL REFERENCES dim_authors (author_id),
                text_length     INTEGER,
                scraped_at      TIMESTAMP,
                batch_id        VARCHAR(64),
                created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS quote_tags
            (
                quote_id        INTEGER NOT NULL REFERENCES fact_quotes (quote_id) ON DELETE CASCADE,
                tag_id          INTEGER NOT NULL REFERENCES dim_tags (tag_id) ON DELETE CASCADE,
                PRIMARY KEY (quote_id, tag_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_librairies
            (
                librairie_id     SERIAL PRIMARY KEY,
                librairie_key    VARCHAR(250) NOT NULL UNIQUE,
                name             VARCHAR(200) NOT NULL,
                address          VARCHAR(300),
                postcode         CHAR(5),
                city             VARCHAR(100),
                specialty        VARCHAR(100),
                partnership_date DATE,
                revenue_range    VARCHAR(30),
                contact_hash     CHAR(64),
                latitude         DOUBLE PRECISION,
                longitude        DOUBLE PRECISION,
                geocode_score    DOUBLE PRECISION,
                geocode_label    TEXT,
                imported_at      TIMESTAMP,
                batch_id         VARCHAR(64),
                created_at       TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs
            (
                run_id            SERIAL PRIMARY KEY,
                batch_id          VARCHAR(64) NOT NULL UNIQUE,
                started_at        TIMESTAMP NOT NULL,
                completed_at      TIMESTAMP,
                status            VARCHAR(20) NOT NULL,
                last_phase        VARCHAR(20) NOT NULL,
                books_loaded      INTEGER NOT NULL DEFAULT 0,
                quotes_loaded     INTEGER NOT NULL DEFAULT 0,
                librairies_loaded INTEGER NOT NULL DEFAULT 0,
                total_errors      INTEGER NOT NULL DEFAULT 0,
                counters          TEXT,
                errors            TEXT
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fact_books_category ON fact_books (category_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fact_quotes_author ON fact_quotes (author_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_dim_librairies_city ON dim_librairies (city)");

        log.info("PostgreSQL schema ready.");
    }
}
