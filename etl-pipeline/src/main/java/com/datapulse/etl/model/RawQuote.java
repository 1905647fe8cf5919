package com.datapulse.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bronze quote as found in a div.quote block.
 */
@Value
@Builder
public class RawQuote {

    /** Quote text including its decorative quotation marks */
    String text;

    String author;

    /** Absolute link to the author page, null when absent */
    String authorUrl;

    @Singular
    List<String> tags;

    RecordMetadata metadata;
}
