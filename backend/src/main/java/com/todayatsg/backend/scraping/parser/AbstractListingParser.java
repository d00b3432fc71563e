package com.todayatsg.backend.scraping.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.ParseException;
import com.todayatsg.backend.model.dto.FetchedDocument;
import com.todayatsg.backend.model.dto.ParseOutcome;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Listing-page parsing shared by every source.
 * <p>
 * JSON-LD Event data wins when the page has any; otherwise each element matched by the
 * source's container selectors becomes one candidate, read through the field selectors.
 * Subclasses adjust the raw candidate in {@link #refine(ScrapeCandidate, Element, String)}.
 */
@Slf4j
public abstract class AbstractListingParser implements SourceParser {

    protected final JsonLdEventExtractor jsonLdExtractor;

    protected AbstractListingParser(JsonLdEventExtractor jsonLdExtractor) {
        this.jsonLdExtractor = jsonLdExtractor;
    }

    @Override
    public ParseOutcome parse(FetchedDocument document, SourceDefinition source) {
        Document doc = document.toHtml();
        List<ScrapeCandidate> candidates = new ArrayList<>();
        int malformed = 0;

        JsonLdEventExtractor.Result jsonLd = jsonLdExtractor.extract(doc);
        if (!jsonLd.getEvents().isEmpty()) {
            log.debug("Using {} JSON-LD events from {}", jsonLd.getEvents().size(), document.getUrl());
            for (JsonNode node : jsonLd.getEvents()) {
                ScrapeCandidate candidate = readSafely(() -> jsonLdExtractor.toCandidate(node, document.getUrl()),
                        source, null, document.getUrl());
                if (candidate == null) {
                    malformed++;
                } else {
                    candidates.add(candidate);
                }
            }
        } else {
            Elements containers = selectContainers(doc, source);
            if (containers.isEmpty()) {
                throw new ParseException(jsonLd.getBrokenBlocks() > 0
                        ? "Only unreadable JSON-LD and no listing containers on " + document.getUrl()
                        : "No event listings found on " + document.getUrl());
            }
            log.debug("Found {} listing containers on {}", containers.size(), document.getUrl());
            for (Element container : containers) {
                ScrapeCandidate candidate = readSafely(() -> fromElement(container, source),
                        source, container, document.getUrl());
                if (candidate == null) {
                    malformed++;
                } else {
                    candidates.add(candidate);
                }
            }
        }

        if (malformed > 0) {
            log.warn("Skipped {} malformed entries on {} ({} usable)", malformed, document.getUrl(), candidates.size());
        }
        return new ParseOutcome(candidates, malformed);
    }

    /**
     * Generic selector-driven extraction of one listing card
     */
    protected ScrapeCandidate fromElement(Element container, SourceDefinition source) {
        ScrapeCandidate candidate = new ScrapeCandidate();

        String title = ListingText.firstText(container, source.getTitleSelectors());
        if (title == null) {
            title = ListingText.firstText(container, List.of("h1", "h2", "h3", "h4"));
        }
        candidate.setTitle(title);
        candidate.setDescription(ListingText.firstText(container, source.getDescriptionSelectors()));
        candidate.setDateText(ListingText.firstText(container, source.getDateSelectors()));
        candidate.setTimeText(ListingText.firstText(container, source.getTimeSelectors()));
        candidate.setVenue(ListingText.firstText(container, source.getVenueSelectors()));
        candidate.setAddress(ListingText.firstText(container, source.getAddressSelectors()));
        candidate.setLocationText(candidate.getVenue() != null ? candidate.getVenue() : candidate.getAddress());
        candidate.setCategoryHint(ListingText.firstText(container, source.getCategorySelectors()));

        String cardText = container.text();
        String priceText = ListingText.firstText(container, source.getPriceSelectors());
        String price = ListingText.extractPrice(priceText != null ? priceText : cardText);
        candidate.setPriceInfo(price != null ? price : priceText);
        candidate.setAgeRestrictions(ListingText.extractAgeRestriction(cardText));

        candidate.setImageUrl(ListingText.imageUrl(container));
        candidate.setExternalUrl(ListingText.link(container));
        for (String attr : List.of("data-event-id", "data-id", "data-eid")) {
            if (container.hasAttr(attr) && !container.attr(attr).isBlank()) {
                candidate.setExternalId(container.attr(attr).trim());
                break;
            }
        }
        return candidate;
    }

    /**
     * Source-specific clean-up of a candidate. {@code container} is null for JSON-LD records.
     */
    protected void refine(ScrapeCandidate candidate, Element container, String pageUrl) {
    }

    protected Elements selectContainers(Document doc, SourceDefinition source) {
        for (String selector : source.getContainerSelectors()) {
            try {
                Elements found = doc.select(selector);
                if (!found.isEmpty()) return found;
            } catch (RuntimeException e) {
                log.debug("Error with container selector '{}': {}", selector, e.getMessage());
            }
        }
        return new Elements();
    }

    private ScrapeCandidate readSafely(Supplier<ScrapeCandidate> reader, SourceDefinition source, Element container, String url) {
        try {
            ScrapeCandidate candidate = reader.get();
            if (candidate == null || candidate.getTitle() == null) {
                log.debug("Listing entry without a title on {}", url);
                return null;
            }
            applyDefaults(candidate, source);
            refine(candidate, container, url);
            return candidate.getTitle() == null ? null : candidate;
        } catch (RuntimeException e) {
            log.debug("Malformed listing entry on {}: {}", url, e.getMessage());
            return null;
        }
    }

    private void applyDefaults(ScrapeCandidate candidate, SourceDefinition source) {
        candidate.setSourceId(source.getId());
        if (candidate.getVenue() == null && candidate.getLocationText() == null && source.getDefaultVenue() != null) {
            candidate.setVenue(source.getDefaultVenue());
            candidate.setLocationText(source.getDefaultVenue());
        }
        if (candidate.getCategoryHint() == null) {
            candidate.setCategoryHint(source.getDefaultCategory());
        }
        for (String tag : source.getDefaultTags()) {
            if (!candidate.getTagHints().contains(tag)) candidate.getTagHints().add(tag);
        }
    }
}
