package com.todayatsg.backend.scraping.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.ParseException;
import com.todayatsg.backend.model.dto.FetchedDocument;
import com.todayatsg.backend.model.dto.ParseOutcome;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListingParsersTest {

    private final JsonLdEventExtractor jsonLd = new JsonLdEventExtractor(new ObjectMapper());

    @Test
    void visitSingaporeReadsCardsAndSkipsMalformedOnes() {
        String html = """
                <html><body>
                <div class="event-card" data-id="vs-1">
                  <h3 class="title">Singapore Night Festival</h3>
                  <p class="description">Light installations and performances across the Bras Basah precinct.</p>
                  <span class="date">23 Aug 2024 - 31 Aug 2024</span>
                  <span class="venue">Bras Basah.Bugis</span>
                  <span class="price">Free admission</span>
                  <a href="/festivals-events-singapore/night-festival/">More</a>
                  <img data-src="/images/snf.jpg">
                </div>
                <div class="event-card">
                  <h3 class="title">New</h3>
                  <span class="date">1 Sep 2024</span>
                </div>
                <div class="event-card">
                  <span class="date">2 Sep 2024</span>
                </div>
                </body></html>
                """;
        VisitSingaporeParser parser = new VisitSingaporeParser(jsonLd);

        ParseOutcome outcome = parser.parse(page("https://www.visitsingapore.com/festivals-events-singapore/", html),
                source("visitsingapore"));

        assertThat(outcome.getMalformedCount()).isEqualTo(2);
        assertThat(outcome.getCandidates()).hasSize(1);
        ScrapeCandidate candidate = outcome.getCandidates().get(0);
        assertThat(candidate.getSourceId()).isEqualTo("visitsingapore");
        assertThat(candidate.getExternalId()).isEqualTo("vs-1");
        assertThat(candidate.getTitle()).isEqualTo("Singapore Night Festival");
        assertThat(candidate.getDateText()).isEqualTo("23 Aug 2024 - 31 Aug 2024");
        assertThat(candidate.getVenue()).isEqualTo("Bras Basah.Bugis");
        assertThat(candidate.getPriceInfo()).isEqualTo("Free");
        assertThat(candidate.getCategoryHint()).isEqualTo("festivals");
        assertThat(candidate.getExternalUrl())
                .isEqualTo("https://www.visitsingapore.com/festivals-events-singapore/night-festival/");
        assertThat(candidate.getImageUrl()).isEqualTo("https://www.visitsingapore.com/images/snf.jpg");
    }

    @Test
    void jsonLdIsPreferredOverCards() {
        String html = """
                <html><head><script type="application/ld+json">
                {"@type": "ItemList", "itemListElement": [{"item": {
                  "@type": "Event", "name": "Startup Networking Night",
                  "startDate": "2024-08-20T18:30:00+08:00",
                  "url": "https://www.eventbrite.sg/e/startup-networking-night-tickets-123456789",
                  "location": {"@type": "Place", "name": "Block71"},
                  "offers": {"price": "0", "priceCurrency": "SGD"}
                }}]}
                </script></head>
                <body><div class="event-card"><h3>Card only event</h3></div></body></html>
                """;
        EventbriteParser parser = new EventbriteParser(jsonLd);

        ParseOutcome outcome = parser.parse(page("https://www.eventbrite.sg/d/singapore--singapore/events/", html),
                source("eventbrite"));

        assertThat(outcome.getCandidates()).extracting(ScrapeCandidate::getTitle)
                .containsExactly("Startup Networking Night");
        ScrapeCandidate candidate = outcome.getCandidates().get(0);
        assertThat(candidate.getExternalId()).isEqualTo("eb-123456789");
        assertThat(candidate.getPriceInfo()).isEqualTo("Free");
        assertThat(candidate.getVenue()).isEqualTo("Block71");
    }

    @Test
    void eventbriteCardsSplitLocationAndPrice() {
        String html = """
                <html><body>
                <div class="event-card">
                  <h3>Sunday Comedy Club</h3>
                  <time datetime="2024-08-25T20:00:00+08:00">Sun, Aug 25, 8:00 PM</time>
                  <p class="event-card__location">Singapore · The Merry Lion</p>
                  <p class="event-card__price">From S$25.00</p>
                  <a href="https://www.eventbrite.sg/e/sunday-comedy-club-tickets-987654321?aff=ebdssbdestsearch">Details</a>
                </div>
                </body></html>
                """;
        SourceDefinition source = source("eventbrite");
        source.setDateSelectors(List.of("time"));
        source.setVenueSelectors(List.of(".event-card__location"));
        source.setPriceSelectors(List.of(".event-card__price"));
        EventbriteParser parser = new EventbriteParser(jsonLd);

        ScrapeCandidate candidate = parser.parse(page("https://www.eventbrite.sg/d/singapore--singapore/events/", html),
                source).getCandidates().get(0);

        assertThat(candidate.getExternalId()).isEqualTo("eb-987654321");
        assertThat(candidate.getDateText()).isEqualTo("2024-08-25T20:00:00+08:00");
        assertThat(candidate.getVenue()).isEqualTo("The Merry Lion");
        assertThat(candidate.getPriceInfo()).isEqualTo("S$25.00");
    }

    @Test
    void marinaBaySandsAddsVenueAddressAndCategory() {
        String html = """
                <html><body>
                <div class="event-item">
                  <h3 class="title">Disney's The Lion King</h3>
                  <span class="date">1 Oct 2024</span>
                  <p>Playing at Sands Theatre</p>
                </div>
                </body></html>
                """;
        MarinaBaySandsParser parser = new MarinaBaySandsParser(jsonLd);
        SourceDefinition source = source("marinabaysands");
        source.setContainerSelectors(List.of(".event-item"));

        ScrapeCandidate candidate = parser.parse(
                page("https://www.marinabaysands.com/entertainment/concerts-shows.html", html), source)
                .getCandidates().get(0);

        assertThat(candidate.getVenue()).isEqualTo("Sands Theatre, Marina Bay Sands");
        assertThat(candidate.getLocationText()).isEqualTo("Marina Bay Sands");
        assertThat(candidate.getAddress()).isEqualTo(MarinaBaySandsParser.ADDRESS);
        assertThat(candidate.getCategoryHint()).isEqualTo("concerts");
    }

    @Test
    void suntecCityTagsPromotions() {
        String html = """
                <html><body>
                <div class="promotion-item">
                  <h3 class="title">Great Singapore Sale Weekend</h3>
                  <span class="date">7 Sep 2024</span>
                  <p>At the Convention Hall</p>
                </div>
                </body></html>
                """;
        SuntecCityParser parser = new SuntecCityParser(jsonLd);
        SourceDefinition source = source("sunteccity");
        source.setContainerSelectors(List.of(".promotion-item"));

        ScrapeCandidate candidate = parser.parse(page("https://www.sunteccity.com.sg/promotions/", html), source)
                .getCandidates().get(0);

        assertThat(candidate.getVenue()).isEqualTo("Convention Hall, Suntec City");
        assertThat(candidate.getAddress()).isEqualTo(SuntecCityParser.ADDRESS);
        assertThat(candidate.getTagHints()).contains("promotion");
    }

    @Test
    void communityCentreFillsCentreDetails() {
        String html = """
                <html><body>
                <div class="activity-item">
                  <h3 class="title">Line Dance for Seniors</h3>
                  <span class="date">12 Sep 2024</span>
                </div>
                </body></html>
                """;
        CommunityCentreParser parser = new CommunityCentreParser(jsonLd);
        SourceDefinition source = source("community_centres");
        source.setContainerSelectors(List.of(".activity-item"));

        ScrapeCandidate candidate = parser.parse(page(
                "https://www.pa.gov.sg/our-network/grassroots-organisations/community-clubs/jurong-west", html), source)
                .getCandidates().get(0);

        assertThat(candidate.getVenue()).isEqualTo("Jurong West CC");
        assertThat(candidate.getAddress()).isEqualTo("20 Jurong West Street 93, Singapore 648965");
        assertThat(candidate.getLatitude()).isEqualTo(1.3404);
        assertThat(candidate.getPriceInfo()).isEqualTo("Free");
    }

    @Test
    void pageWithoutListingsIsAParseError() {
        VisitSingaporeParser parser = new VisitSingaporeParser(jsonLd);

        assertThatThrownBy(() -> parser.parse(page("https://www.visitsingapore.com/x", "<html><body><p>Nothing</p></body></html>"),
                source("visitsingapore")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("No event listings");
    }

    private static FetchedDocument page(String url, String html) {
        return new FetchedDocument(url, 200, html, "text/html", LocalDateTime.now());
    }

    private static SourceDefinition source(String id) {
        SourceDefinition source = new SourceDefinition();
        source.setId(id);
        source.setName(id);
        source.setBaseUrl("https://example.sg");
        source.setContainerSelectors(List.of(".event-card", "[class*=event]"));
        source.setTitleSelectors(List.of(".title"));
        source.setDescriptionSelectors(List.of(".description"));
        source.setDateSelectors(List.of(".date", "time"));
        source.setVenueSelectors(List.of(".venue"));
        source.setPriceSelectors(List.of(".price"));
        return source;
    }
}
