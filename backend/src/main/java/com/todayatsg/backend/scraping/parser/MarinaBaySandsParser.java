package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.List;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Entertainment, exhibition and dining listings of Marina Bay Sands
 */
@Component
public class MarinaBaySandsParser extends AbstractListingParser {

    public static final String SOURCE_ID = "marinabaysands";

    static final String ADDRESS = "10 Bayfront Ave, Singapore 018956";

    private static final List<String> VENUES = List.of(
            "Sands Theatre", "ArtScience Museum", "Sands Expo", "Convention Centre", "SkyPark",
            "Event Plaza", "Grand Theatre", "Studio Theatre", "Roof Deck", "Shopping Mall");

    public MarinaBaySandsParser(JsonLdEventExtractor jsonLdExtractor) {
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
                    candidate.setVenue(venue + ", Marina Bay Sands");
                    candidate.setLocationText("Marina Bay Sands");
                    break;
                }
            }
        }
        if (candidate.getAddress() == null) {
            candidate.setAddress(ADDRESS);
        }

        String section = pageUrl == null ? "" : pageUrl.toLowerCase();
        String title = candidate.getTitle().toLowerCase();
        if (section.contains("concert") || section.contains("show")
                || title.contains("concert") || title.contains("performance")) {
            candidate.setCategoryHint("concerts");
        } else if (section.contains("exhibition") || section.contains("museum")) {
            candidate.setCategoryHint("exhibitions");
        } else if (section.contains("dining")) {
            candidate.setCategoryHint("food");
        }
    }
}
