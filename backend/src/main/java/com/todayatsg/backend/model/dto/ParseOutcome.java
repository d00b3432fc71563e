package com.todayatsg.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Candidates extracted from one page plus the number of entries skipped as malformed.
 */
@Getter
@AllArgsConstructor
public class ParseOutcome {
    private final List<ScrapeCandidate> candidates;
    private final int malformedCount;
}
