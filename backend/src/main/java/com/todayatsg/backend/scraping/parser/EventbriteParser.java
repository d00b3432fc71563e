package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Eventbrite's Singapore discovery pages. These usually carry an ItemList of events in
 * JSON-LD; the card markup is the fallback.
 */
@Component
public class EventbriteParser extends AbstractListingParser {

    public static final String SOURCE_ID = "eventbrite";

    private static final Pattern TICKET_ID = Pattern.compile("-tickets-(\\d+)");

    public EventbriteParser(JsonLdEventExtractor jsonLdExtractor) {
        super(jsonLdExtractor);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    protected void refine(ScrapeCandidate candidate, Element container, String pageUrl) {
        String url = candidate.getExternalUrl();
        if (url != null) {
            Matcher matcher = TICKET_ID.matcher(url);
            if (matcher.find()) {
                candidate.setExternalId("eb-" + matcher.group(1));
            }
        }

        // Card locations read "Singapore · Esplanade Annexe Studio"
        String location = candidate.getLocationText();
        if (location != null && location.contains("·")) {
            String venue = ListingText.clean(location.substring(location.lastIndexOf('·') + 1));
            if (venue != null) {
                candidate.setVenue(venue);
                candidate.setLocationText(venue);
            }
        }

        String price = candidate.getPriceInfo();
        if (price != null && price.toLowerCase().startsWith("from ")) {
            candidate.setPriceInfo(price.substring(5).trim());
        }
    }
}
