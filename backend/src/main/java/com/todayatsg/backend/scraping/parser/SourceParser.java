package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.model.dto.FetchedDocument;
import com.todayatsg.backend.model.dto.ParseOutcome;

/**
 * Turns one fetched listing page of a single source into candidate records.
 * <p>
 * Implementations skip entries they cannot read and report how many they skipped;
 * a page whose overall shape is unusable raises
 * {@link com.todayatsg.backend.exception.ParseException}.
 */
public interface SourceParser {

    /**
     * Id of the source this parser handles, as used in sources.yml
     */
    String sourceId();

    ParseOutcome parse(FetchedDocument document, SourceDefinition source);
}
