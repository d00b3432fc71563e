package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Programme pages of People's Association community clubs. Each listing page belongs to
 * one club, which supplies the venue, address and coordinates of its events.
 */
@Component
public class CommunityCentreParser extends AbstractListingParser {

    public static final String SOURCE_ID = "community_centres";

    @Getter
    @AllArgsConstructor
    static class CommunityCentre {
        private final String slug;
        private final String name;
        private final String address;
        private final double latitude;
        private final double longitude;
    }

    static final List<CommunityCentre> CENTRES = List.of(
            new CommunityCentre("ang-mo-kio", "Ang Mo Kio CC", "53 Ang Mo Kio Ave 3, Singapore 569933", 1.3691, 103.8454),
            new CommunityCentre("bedok", "Bedok CC", "850 New Upper Changi Rd, Singapore 467352", 1.3236, 103.9273),
            new CommunityCentre("bishan", "Bishan CC", "51 Bishan Street 13, Singapore 579799", 1.3506, 103.8480),
            new CommunityCentre("bukit-batok", "Bukit Batok CC", "23 Bukit Batok Central, Singapore 659526", 1.3490, 103.7498),
            new CommunityCentre("clementi", "Clementi CC", "220 Clementi Ave 4, Singapore 129880", 1.3142, 103.7649),
            new CommunityCentre("hougang", "Hougang CC", "35 Hougang Ave 3, Singapore 538840", 1.3613, 103.8929),
            new CommunityCentre("jurong-west", "Jurong West CC", "20 Jurong West Street 93, Singapore 648965", 1.3404, 103.7090),
            new CommunityCentre("pasir-ris", "Pasir Ris CC", "1 Pasir Ris Drive 4, Singapore 519457", 1.3721, 103.9474),
            new CommunityCentre("sengkang", "Sengkang CC", "2 Sengkang Square, Singapore 545025", 1.3868, 103.8947),
            new CommunityCentre("tampines", "Tampines CC", "1 Tampines Street 86, Singapore 528651", 1.3496, 103.9568),
            new CommunityCentre("toa-payoh", "Toa Payoh CC", "93 Toa Payoh Central, Singapore 319194", 1.3343, 103.8563),
            new CommunityCentre("woodlands", "Woodlands CC", "1 Woodlands Street 83, Singapore 738520", 1.4302, 103.7890),
            new CommunityCentre("yishun", "Yishun CC", "51 Yishun Ave 4, Singapore 768670", 1.4231, 103.8298));

    public CommunityCentreParser(JsonLdEventExtractor jsonLdExtractor) {
        super(jsonLdExtractor);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    protected void refine(ScrapeCandidate candidate, Element container, String pageUrl) {
        CommunityCentre centre = centreFor(pageUrl);
        if (centre != null) {
            if (candidate.getVenue() == null) {
                candidate.setVenue(centre.getName());
                candidate.setLocationText(centre.getName());
            }
            if (candidate.getAddress() == null) {
                candidate.setAddress(centre.getAddress());
            }
            if (candidate.getLatitude() == null || candidate.getLongitude() == null) {
                candidate.setLatitude(centre.getLatitude());
                candidate.setLongitude(centre.getLongitude());
            }
        }
        if (candidate.getPriceInfo() == null) {
            candidate.setPriceInfo("Free");
        }
    }

    static CommunityCentre centreFor(String pageUrl) {
        if (pageUrl == null) return null;
        String url = pageUrl.toLowerCase();
        CommunityCentre best = null;
        for (CommunityCentre centre : CENTRES) {
            if (url.contains("/" + centre.getSlug())
                    && (best == null || centre.getSlug().length() > best.getSlug().length())) {
                best = centre;
            }
        }
        return best;
    }
}
