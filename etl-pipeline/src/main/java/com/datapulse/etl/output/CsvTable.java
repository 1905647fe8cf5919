package com.datapulse.etl.output;

import com.datapulse.etl.model.CleanBook;
import com.datapulse.etl.model.CleanLibrairie;
import com.datapulse.etl.model.CleanQuote;
import com.datapulse.etl.model.RawBook;
import com.datapulse.etl.model.RawLibrairie;
import com.datapulse.etl.model.RawQuote;
import com.datapulse.etl.model.RecordMetadata;

import java.util.Arrays;
import java.util.List;

/**
 * A header and its rows, ready for CSV export.
 */
public record CsvTable(String[] header, List<String[]> rows) {

    private static final String[] BOOK_HEADERS = {
            "book_key", "title", "category", "category_slug",
            "price_gbp", "price_eur", "rating", "in_stock", "stock_count",
            "url", "image_url", "scraped_at", "batch_id"
    };

    private static final String[] QUOTE_HEADERS = {
            "quote_hash", "text", "author", "author_slug", "author_url",
            "tags", "text_length", "scraped_at", "batch_id"
    };

    private static final String[] LIBRAIRIE_HEADERS = {
            "librairie_key", "name", "address", "postcode", "city", "specialty",
            "partnership_date", "revenue_range", "contact_hash",
            "latitude", "longitude", "geocode_score", "geocode_label",
            "imported_at", "batch_id"
    };

    private static final String[] RAW_BOOK_HEADERS = {
            "title", "price_text", "rating_token", "availability_text",
            "image_url", "detail_url", "category", "source", "fetched_at", "batch_id"
    };

    private static final String[] RAW_QUOTE_HEADERS = {
            "text", "author", "author_url", "tags", "source", "fetched_at", "batch_id"
    };

    private static final String[] RAW_LIBRAIRIE_HEADERS = {
            "row_number", "nom_librairie", "adresse", "code_postal", "ville",
            "contact_nom", "contact_email", "contact_telephone",
            "ca_annuel", "date_partenariat", "specialite", "source", "fetched_at", "batch_id"
    };

    // ── Bronze ───────────────────────────────────────────────────────────────

    public static CsvTable ofRawBooks(List<RawBook> books) {
        return new CsvTable(RAW_BOOK_HEADERS, books.stream().map(b -> withMetadata(new String[]{
                str(b.getTitle()), str(b.getPriceText()), str(b.getRatingToken()), str(b.getAvailabilityText()),
                str(b.getImageUrl()), str(b.getDetailUrl()), str(b.getCategory())
        }, b.getMetadata())).toList());
    }

    public static CsvTable ofRawQuotes(List<RawQuote> quotes) {
        return new CsvTable(RAW_QUOTE_HEADERS, quotes.stream().map(q -> withMetadata(new String[]{
                str(q.getText()), str(q.getAuthor()), str(q.getAuthorUrl()), String.join(",", q.getTags())
        }, q.getMetadata())).toList());
    }

    /** Contains the contact's personal data; bronze only. */
    public static CsvTable ofRawLibrairies(List<RawLibrairie> librairies) {
        return new CsvTable(RAW_LIBRAIRIE_HEADERS, librairies.stream().map(l -> withMetadata(new String[]{
                str(l.getRowNumber()), str(l.getName()), str(l.getAddress()), str(l.getPostcode()), str(l.getCity()),
                str(l.getContactName()), str(l.getContactEmail()), str(l.getContactPhone()),
                str(l.getAnnualRevenue()), str(l.getPartnershipDate()), str(l.getSpecialty())
        }, l.getMetadata())).toList());
    }

    // ── Silver ───────────────────────────────────────────────────────────────

    public static CsvTable ofBooks(List<CleanBook> books) {
        return new CsvTable(BOOK_HEADERS, books.stream().map(b -> new String[]{
                str(b.getBookKey()), str(b.getTitle()), str(b.getCategory()), str(b.getCategorySlug()),
                str(b.getPriceGbp()), str(b.getPriceEur()), str(b.getRating()),
                str(b.isInStock()), str(b.getStockCount()),
                str(b.getUrl()), str(b.getImageUrl()), str(b.getScrapedAt()), str(b.getBatchId())
        }).toList());
    }

    public static CsvTable ofQuotes(List<CleanQuote> quotes) {
        return new CsvTable(QUOTE_HEADERS, quotes.stream().map(q -> new String[]{
                str(q.getTextHash()), str(q.getText()), str(q.getAuthor()), str(q.getAuthorSlug()),
                str(q.getAuthorUrl()), String.join(",", q.getTags()), str(q.getTextLength()),
                str(q.getScrapedAt()), str(q.getBatchId())
        }).toList());
    }

    public static CsvTable ofLibrairies(List<CleanLibrairie> librairies) {
        return new CsvTable(LIBRAIRIE_HEADERS, librairies.stream().map(l -> new String[]{
                str(l.getLibrairieKey()), str(l.getName()), str(l.getAddress()), str(l.getPostcode()),
                str(l.getCity()), str(l.getSpecialty()), str(l.getPartnershipDate()),
                str(l.getRevenueRange()), str(l.getContactHash()),
                str(l.getLatitude()), str(l.getLongitude()), str(l.getGeocodeScore()), str(l.getGeocodeLabel()),
                str(l.getImportedAt()), str(l.getBatchId())
        }).toList());
    }

    private static String[] withMetadata(String[] values, RecordMetadata metadata) {
        String[] row = Arrays.copyOf(values, values.length + 3);
        if (metadata != null) {
            row[values.length] = str(metadata.source());
            row[values.length + 1] = str(metadata.fetchedAt());
            row[values.length + 2] = str(metadata.batchId());
        } else {
            Arrays.fill(row, values.length, row.length, "");
        }
        return row;
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
