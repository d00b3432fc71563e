package com.todayatsg.backend.model.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

@Getter
@AllArgsConstructor
@ToString(exclude = "body")
public class FetchedDocument {
    private final String url;
    private final int statusCode;
    private final String body;
    private final String contentType;
    private final LocalDateTime fetchedAt;

    /**
     * Parse the body as HTML, resolving relative links against the page URL
     */
    public Document toHtml() {
        return Jsoup.parse(body == null ? "" : body, url);
    }
}
