package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.model.dto.ScrapeCandidate;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Singapore Tourism Board listings on visitsingapore.com
 */
@Component
public class VisitSingaporeParser extends AbstractListingParser {

    public static final String SOURCE_ID = "visitsingapore";

    public VisitSingaporeParser(JsonLdEventExtractor jsonLdExtractor) {
        super(jsonLdExtractor);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    protected void refine(ScrapeCandidate candidate, Element container, String pageUrl) {
        // Cards without a real heading pick up labels like "New" or "Top"
        if (candidate.getTitle().length() <= 3) {
            candidate.setTitle(null);
            return;
        }
        if (candidate.getDescription() != null && candidate.getDescription().length() < 20) {
            candidate.setDescription(null);
        }
        if (candidate.getCategoryHint() == null && pageUrl != null) {
            candidate.setCategoryHint(hintFromSection(pageUrl));
        }
    }

    private String hintFromSection(String pageUrl) {
        String url = pageUrl.toLowerCase();
        if (url.contains("concerts-gigs")) return "concerts";
        if (url.contains("festivals")) return "festivals";
        if (url.contains("arts-design")) return "exhibitions";
        if (url.contains("nightlife")) return "nightlife";
        if (url.contains("food-drink")) return "food";
        return null;
    }
}
