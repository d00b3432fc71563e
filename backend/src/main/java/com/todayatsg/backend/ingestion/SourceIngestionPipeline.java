package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.event.EventRepository;
import com.todayatsg.backend.exception.FetchException;
import com.todayatsg.backend.exception.GeocodeException;
import com.todayatsg.backend.exception.ParseException;
import com.todayatsg.backend.exception.PersistenceException;
import com.todayatsg.backend.exception.ValidationException;
import com.todayatsg.backend.model.dto.DedupDecision;
import com.todayatsg.backend.model.dto.FetchedDocument;
import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.dto.ParseOutcome;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import com.todayatsg.backend.model.dto.SourceRunReport;
import com.todayatsg.backend.model.dto.WriteOutcome;
import com.todayatsg.backend.model.entity.Event;
import com.todayatsg.backend.model.enums.PipelineStage;
import com.todayatsg.backend.scraping.SourceFetcher;
import com.todayatsg.backend.scraping.parser.SourceParser;
import com.todayatsg.backend.scraping.parser.SourceParserRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one source through fetch, parse, normalize, dedup, geocode and write.
 * <p>
 * Work within a source is sequential. A failing record is counted in the report and the
 * next record is processed; the source itself fails only when none of its pages could be
 * fetched and parsed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceIngestionPipeline {

    private final SourceFetcher fetcher;
    private final SourceParserRegistry parserRegistry;
    private final EventNormalizer normalizer;
    private final EventDeduplicator deduplicator;
    private final GeolocationResolver geolocationResolver;
    private final EventPersistenceWriter writer;
    private final EventRepository eventRepository;

    /**
     * @param source           source to ingest
     * @param maxEvents        cap on candidates taken from this source
     * @param dryRun           when true nothing is written; normalized events are kept as samples
     * @param report           receives stage changes and counters
     * @param cancelRequested  checked between pages
     */
    public void run(SourceDefinition source, int maxEvents, boolean dryRun, SourceRunReport report,
                    BooleanSupplier cancelRequested) {
        SourceParser parser = parserRegistry.getParser(source.getId());
        int limit = source.getMaxEvents() != null && source.getMaxEvents() > 0
                ? Math.min(maxEvents, source.getMaxEvents())
                : maxEvents;
        report.start();
        log.info("Ingesting {} ({} listing pages, max {} events{})", source.getId(),
                source.getListingUrls().size(), limit, dryRun ? ", dry run" : "");

        List<ScrapeCandidate> candidates = new ArrayList<>();
        int pagesOk = 0;
        for (String url : source.getListingUrls()) {
            if (cancelRequested.getAsBoolean()) {
                report.skip("Cancelled");
                log.info("Run cancelled, stopping {} after {} pages", source.getId(), pagesOk);
                return;
            }
            if (candidates.size() >= limit) break;

            Optional<ParseOutcome> outcome = fetchAndParse(source, parser, url, report);
            if (outcome.isEmpty()) continue;
            pagesOk++;

            report.recordCandidates(outcome.get().getCandidates().size(), outcome.get().getMalformedCount());
            for (ScrapeCandidate candidate : outcome.get().getCandidates()) {
                if (candidates.size() >= limit) break;
                candidates.add(candidate);
            }
        }

        if (pagesOk == 0) {
            report.fail("No listing page of " + source.getId() + " could be fetched and parsed");
            log.error("Source {} failed: {}", source.getId(), report.getFailureReason());
            return;
        }

        processCandidates(candidates, dryRun, report);
        report.complete();
        log.info("Finished {}: {} candidates, {} inserted, {} updated, {} duplicates, {} record errors",
                source.getId(), candidates.size(), report.getInserted(), report.getUpdated(),
                report.getDuplicates(), report.getRecordErrors());
    }

    private Optional<ParseOutcome> fetchAndParse(SourceDefinition source, SourceParser parser, String url,
                                                 SourceRunReport report) {
        report.enter(PipelineStage.FETCHING);
        FetchedDocument document;
        try {
            document = fetcher.fetch(source, url);
            report.recordPageFetched();
        } catch (FetchException e) {
            log.warn("Fetch failed for {} ({}): {}", url, e.getReason(), e.getMessage());
            report.recordFetchError(url, e.getMessage());
            return Optional.empty();
        }

        report.enter(PipelineStage.PARSING);
        try {
            return Optional.of(parser.parse(document, source));
        } catch (ParseException e) {
            log.warn("Parse failed for {}: {}", url, e.getMessage());
            report.recordParseError(url, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Parser for {} crashed on {}: {}", source.getId(), url, e.getMessage(), e);
            report.recordParseError(url, e.getClass().getSimpleName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void processCandidates(List<ScrapeCandidate> candidates, boolean dryRun, SourceRunReport report) {
        Set<String> seenThisRun = new HashSet<>();
        Map<LocalDate, List<Event>> windows = new HashMap<>();

        for (ScrapeCandidate candidate : candidates) {
            try {
                processOne(candidate, dryRun, report, seenThisRun, windows);
            } catch (ValidationException e) {
                log.debug("Invalid record '{}': {}", candidate.getTitle(), e.getMessage());
                report.recordValidationError(e.getMessage());
            } catch (GeocodeException e) {
                log.debug("Unresolvable location for '{}': {}", candidate.getTitle(), e.getMessage());
                report.recordGeocodeError(e.getMessage());
            } catch (PersistenceException e) {
                report.recordPersistenceError(e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error on record '{}': {}", candidate.getTitle(), e.getMessage(), e);
                report.recordUnexpectedError(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private void processOne(ScrapeCandidate candidate, boolean dryRun, SourceRunReport report,
                            Set<String> seenThisRun, Map<LocalDate, List<Event>> windows) {
        report.enter(PipelineStage.NORMALIZING);
        NormalizedEvent event = normalizer.normalize(candidate);
        report.recordProcessed();

        report.enter(PipelineStage.DEDUPLICATING);
        if (!seenThisRun.add(EventDeduplicator.runKey(event))) {
            report.recordDuplicate();
            return;
        }

        // A row from an earlier run of this source is refreshed in place, never treated as a duplicate
        boolean knownListing = eventRepository
                .findByScrapedFromAndExternalId(event.getSourceId(), event.getExternalId())
                .isPresent();
        if (!knownListing) {
            List<Event> window = windows.computeIfAbsent(event.getDate(), eventRepository::findActiveOnDate);
            DedupDecision decision = deduplicator.decide(event, window);
            if (decision.isDuplicate()) {
                log.debug("Skipping '{}': duplicate of {} ({})", event.getTitle(), decision.getExistingId(),
                        decision.getReason());
                report.recordDuplicate();
                return;
            }
        }

        report.enter(PipelineStage.GEOCODING);
        geolocationResolver.resolve(event);

        if (dryRun) {
            report.addSample(event);
            return;
        }
        WriteOutcome outcome = writer.write(event);
        report.recordWrite(outcome);
        if (outcome.isInserted()) {
            windows.remove(event.getDate());
        }
    }
}
