package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.List;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Happenings at Suntec City mall and convention centre
 */
@Component
public class SuntecCityParser extends AbstractListingParser {

    public static final String SOURCE_ID = "sunteccity";

    static final String ADDRESS = "3 Temasek Blvd, Singapore 038983";

    private static final List<String> VENUES = List.of(
            "Suntec Convention Centre", "Convention Hall", "Exhibition Hall", "Sky Garden",
            "Atrium", "North Wing", "South Wing", "East Wing", "West Wing");

    public SuntecCityParser(JsonLdEventExtractor jsonLdExtractor) {
        super(jsonLdExtractor);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    protected void refine(ScrapeCandidate candidate, Element container, String pageUrl) {
        if (container != null) {
            String text = container.text().toLowerCase();
            for (String venue : VENUES) {
                if (text.contains(venue.toLowerCase())) {
                    candidate.setVenue(venue.startsWith("Suntec") ? venue : venue + ", Suntec City");
                    candidate.setLocationText("Suntec City");
                    break;
                }
            }
        }
        if (candidate.getAddress() == null) {
            candidate.setAddress(ADDRESS);
        }

        String title = candidate.getTitle().toLowerCase();
        boolean promotion = (pageUrl != null && pageUrl.toLowerCase().contains("promotion"))
                || title.contains("sale") || title.contains("discount") || title.contains("promotion");
        if (promotion && !candidate.getTagHints().contains("promotion")) {
            candidate.getTagHints().add("promotion");
        }
    }
}
