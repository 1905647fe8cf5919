package com.datapulse.etl.config;

import com.datapulse.etl.extract.BookCatalogExtractor;
import com.datapulse.etl.extract.HttpPageFetcher;
import com.datapulse.etl.extract.PageFetcher;
import com.datapulse.etl.extract.QuoteExtractor;
import com.datapulse.etl.extract.RequestThrottle;
import com.datapulse.etl.extract.ResilientFetcher;
import com.datapulse.etl.geo.GeocodingClient;
import com.datapulse.etl.output.GoldSchema;
import com.datapulse.etl.spreadsheet.Anonymizer;
import com.datapulse.etl.spreadsheet.LibrairieImporter;
import com.datapulse.etl.spreadsheet.SpreadsheetReader;
import com.datapulse.etl.spreadsheet.SpreadsheetValidator;
import com.datapulse.etl.transform.BookTransformer;
import com.datapulse.etl.transform.LibrairieTransformer;
import com.datapulse.etl.transform.QuoteTransformer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.net.http.HttpClient;

/**
 * Wires the pipeline components. Each HTTP client gets its own throttle and retry policy
 * from its configuration group; they only share the underlying connection pool.
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public HttpClient httpClient(DataPulseProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public PageFetcher pageFetcher(HttpClient httpClient, DataPulseProperties properties) {
        DataPulseProperties.Http http = properties.getHttp();
        return new HttpPageFetcher(httpClient, http.getRequestTimeout(), http.getUserAgent());
    }

    @Bean
    public BookCatalogExtractor bookCatalogExtractor(PageFetcher pageFetcher, DataPulseProperties properties) {
        DataPulseProperties.Books books = properties.getBooks();
        return new BookCatalogExtractor(resilient("books", pageFetcher, books),
                properties.getHttp().getHardPageCap(), books.getBaseUrl());
    }

    @Bean
    public QuoteExtractor quoteExtractor(PageFetcher pageFetcher, DataPulseProperties properties) {
        DataPulseProperties.Quotes quotes = properties.getQuotes();
        return new QuoteExtractor(resilient("quotes", pageFetcher, quotes),
                properties.getHttp().getHardPageCap(), quotes.getBaseUrl());
    }

    @Bean
    public GeocodingClient geocodingClient(PageFetcher pageFetcher, ObjectMapper objectMapper,
                                           DataPulseProperties properties) {
        DataPulseProperties.Geocoding geocoding = properties.getGeocoding();
        return new GeocodingClient(resilient("geocoding", pageFetcher, geocoding), objectMapper,
                geocoding.getBaseUrl(), geocoding.getLimit());
    }

    @Bean
    public SpreadsheetReader spreadsheetReader() {
        return new SpreadsheetReader();
    }

    @Bean
    public SpreadsheetValidator spreadsheetValidator(SpreadsheetReader reader) {
        return new SpreadsheetValidator(reader);
    }

    @Bean
    public LibrairieImporter librairieImporter(SpreadsheetReader reader, SpreadsheetValidator validator) {
        return new LibrairieImporter(reader, validator);
    }

    @Bean
    public Anonymizer anonymizer(DataPulseProperties properties) {
        return new Anonymizer(properties.getAnonymization().getSalt());
    }

    @Bean
    public BookTransformer bookTransformer(DataPulseProperties properties) {
        return new BookTransformer(properties.getBooks().getGbpToEur());
    }

    @Bean
    public QuoteTransformer quoteTransformer() {
        return new QuoteTransformer();
    }

    @Bean
    public LibrairieTransformer librairieTransformer(Anonymizer anonymizer) {
        return new LibrairieTransformer(anonymizer);
    }

    @Bean
    public GoldSchema goldSchema(JdbcTemplate jdbcTemplate) {
        return new GoldSchema(jdbcTemplate);
    }

    private static ResilientFetcher resilient(String name, PageFetcher fetcher, DataPulseProperties.Client client) {
        return new ResilientFetcher(name, fetcher, client.retryPolicy(), new RequestThrottle(client.getDelay()));
    }
}
