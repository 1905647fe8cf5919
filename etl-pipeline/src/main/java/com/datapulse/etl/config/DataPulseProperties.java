package com.datapulse.etl.config;

import com.datapulse.etl.extract.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "datapulse")
@Validated
@Data
public class DataPulseProperties {

    private Http http = new Http();
    private Books books = new Books();
    private Quotes quotes = new Quotes();
    private Geocoding geocoding = new Geocoding();
    private Spreadsheet spreadsheet = new Spreadsheet();

    @Valid
    private Anonymization anonymization = new Anonymization();

    private Storage storage = new Storage();
    private Pipeline pipeline = new Pipeline();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String userAgent = "DataPulse-ETL/1.0 (+https://github.com/datapulse/etl)";
        /** Upper bound on pages per listing, applied even when no page limit is set */
        private int hardPageCap = 1000;
    }

    /** Throttle and retry settings shared by the scraped sites and the geocoding API. */
    @Data
    public static class Client {
        private Duration delay = Duration.ofSeconds(1);
        /** Total tries per request, the first one included */
        private int maxAttempts = 3;
        private RetryPolicy.Backoff backoff = RetryPolicy.Backoff.LINEAR;

        public RetryPolicy retryPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .baseDelay(delay)
                    .backoff(backoff)
                    .build();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Books extends Client {
        private String baseUrl = "https://books.toscrape.com/";
        /** Pages per category; 0 means no limit */
        private int maxPages = 0;
        /** Only scrape the first N categories; 0 means all */
        private int limitCategories = 0;
        private BigDecimal gbpToEur = new BigDecimal("1.17");
        private boolean downloadImages = false;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Quotes extends Client {
        private String baseUrl = "https://quotes.toscrape.com/";
        private int maxPages = 20;
        /** Extra tag listings scraped after the main one */
        private List<String> tags = new ArrayList<>();
        /** Also scrape the listing of every tag in the home page's "Top Ten tags" box */
        private boolean topTags = false;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Geocoding extends Client {
        private String baseUrl = "https://api-adresse.data.gouv.fr";
        private int limit = 1;
        private boolean enabled = true;

        public Geocoding() {
            // 50 requests per second allowed by the API
            setDelay(Duration.ofMillis(20));
        }
    }

    @Data
    public static class Spreadsheet {
        private String path = "data/partenaire_librairies.xlsx";
    }

    @Data
    public static class Anonymization {
        @NotBlank(message = "datapulse.anonymization.salt must be set (DATAPULSE_ANONYMIZATION_SALT)")
        private String salt;
    }

    @Data
    public static class Storage {
        private String endpoint = "http://localhost:9000";
        private String region = "us-east-1";
        private String accessKey = "minioadmin";
        private String secretKey = "minioadmin";
        private boolean pathStyleAccess = true;
        private String imagesBucket = "images";
        private String exportsBucket = "exports";
        private String backupsBucket = "backups";
    }

    @Data
    public static class Pipeline {
        private int maxReportedErrors = 20;
    }

    @Data
    public static class Scheduling {
        /** Spring cron expression; "-" disables the scheduled run */
        private String cron = "-";
        private boolean runOnStartup = false;
        /** Stop the application after the startup run, exiting with its exit code */
        private boolean exitAfterRun = false;
    }
}
