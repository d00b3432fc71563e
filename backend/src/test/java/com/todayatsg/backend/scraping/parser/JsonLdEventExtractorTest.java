package com.todayatsg.backend.scraping.parser;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class JsonLdEventExtractorTest {

    private final JsonLdEventExtractor extractor = new JsonLdEventExtractor(new ObjectMapper());

    @Test
    void readsEventsFromGraphAndItemList() {
        Document doc = Jsoup.parse("""
                <html><head>
                <script type="application/ld+json">
                {"@context": "https://schema.org", "@graph": [
                  {"@type": "WebPage", "name": "Listing"},
                  {"@type": "MusicEvent", "name": "Jazz by the Bay", "startDate": "2024-08-01T19:30:00+08:00"}
                ]}
                </script>
                <script type="application/ld+json">
                {"@type": "ItemList", "itemListElement": [
                  {"@type": "ListItem", "position": 1, "item": {"@type": "Event", "name": "Night Market"}},
                  {"@type": "ListItem", "position": 2, "item": {"@type": "Festival", "name": "Lantern Festival"}}
                ]}
                </script>
                <script type="application/ld+json">{ not json</script>
                </head><body></body></html>
                """, "https://example.sg/events");

        JsonLdEventExtractor.Result result = extractor.extract(doc);

        assertThat(result.getEvents()).extracting(node -> node.get("name").asText())
                .containsExactly("Jazz by the Bay", "Night Market", "Lantern Festival");
        assertThat(result.getBrokenBlocks()).isEqualTo(1);
    }

    @Test
    void mapsPlaceOffersAndKeywords() throws Exception {
        JsonNode event = new ObjectMapper().readTree("""
                {
                  "@type": "TheaterEvent",
                  "@id": "https://example.sg/e/42",
                  "name": "  Phantom   of the Opera ",
                  "description": "The musical returns to Singapore.",
                  "startDate": "2024-09-14T20:00:00+08:00",
                  "endDate": "2024-09-30",
                  "location": {
                    "@type": "Place",
                    "name": "Sands Theatre",
                    "address": {"streetAddress": "10 Bayfront Ave", "addressLocality": "Singapore", "postalCode": "018956"},
                    "geo": {"latitude": "1.2834", "longitude": 103.8607}
                  },
                  "offers": [{"@type": "AggregateOffer", "lowPrice": "68", "highPrice": "228", "priceCurrency": "SGD"}],
                  "typicalAgeRange": "7+",
                  "image": ["https://example.sg/img/phantom.jpg"],
                  "keywords": "musical, broadway"
                }
                """);

        ScrapeCandidate candidate = extractor.toCandidate(event, "https://example.sg/events");

        assertThat(candidate.getTitle()).isEqualTo("Phantom of the Opera");
        assertThat(candidate.getDateText()).isEqualTo("2024-09-14T20:00:00+08:00");
        assertThat(candidate.getEndDateText()).isEqualTo("2024-09-30");
        assertThat(candidate.getVenue()).isEqualTo("Sands Theatre");
        assertThat(candidate.getAddress()).isEqualTo("10 Bayfront Ave, Singapore, 018956");
        assertThat(candidate.getLatitude()).isEqualTo(1.2834);
        assertThat(candidate.getLongitude()).isEqualTo(103.8607);
        assertThat(candidate.getPriceInfo()).isEqualTo("S$68 - S$228");
        assertThat(candidate.getAgeRestrictions()).isEqualTo("7+");
        assertThat(candidate.getImageUrl()).isEqualTo("https://example.sg/img/phantom.jpg");
        assertThat(candidate.getExternalUrl()).isEqualTo("https://example.sg/events");
        assertThat(candidate.getExternalId()).isEqualTo("https://example.sg/e/42");
        assertThat(candidate.getCategoryHint()).isEqualTo("Theater");
        assertThat(candidate.getTagHints()).containsExactly("musical", "broadway");
    }

    @Test
    void freeEventsAndTextLocations() throws Exception {
        JsonNode event = new ObjectMapper().readTree("""
                {"@type": "Event", "name": "Park Yoga", "location": "Fort Canning Park",
                 "isAccessibleForFree": true, "url": "https://example.sg/yoga"}
                """);

        ScrapeCandidate candidate = extractor.toCandidate(event, "https://example.sg/events");

        assertThat(candidate.getLocationText()).isEqualTo("Fort Canning Park");
        assertThat(candidate.getVenue()).isNull();
        assertThat(candidate.getPriceInfo()).isEqualTo("Free");
        assertThat(candidate.getExternalUrl()).isEqualTo("https://example.sg/yoga");
        assertThat(candidate.getCategoryHint()).isNull();
    }
}
