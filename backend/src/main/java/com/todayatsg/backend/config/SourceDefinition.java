package com.todayatsg.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * One external event listing site, as declared in sources.yml.
 * <p>
 * Selectors are tried in priority order (high to low); the first one yielding a
 * non-empty value wins. JSON-LD Event blocks are used ahead of any selector when
 * the page carries them.
 */
@Data
public class SourceDefinition {
    private String id;
    private String name;
    private String baseUrl;
    private boolean enabled = true;

    private List<String> listingPaths = new ArrayList<>();

    // Politeness and transport; null means "use the scraping.* default"
    private Integer requestsPerMinute;
    private Integer timeoutSeconds;
    private Boolean respectRobotsTxt;
    private boolean javascript;

    private Integer maxEvents;

    private List<String> containerSelectors = new ArrayList<>();
    private List<String> titleSelectors = new ArrayList<>();
    private List<String> descriptionSelectors = new ArrayList<>();
    private List<String> dateSelectors = new ArrayList<>();
    private List<String> timeSelectors = new ArrayList<>();
    private List<String> venueSelectors = new ArrayList<>();
    private List<String> addressSelectors = new ArrayList<>();
    private List<String> priceSelectors = new ArrayList<>();
    private List<String> categorySelectors = new ArrayList<>();

    private String defaultVenue;
    private String defaultCategory;
    private List<String> defaultTags = new ArrayList<>();

    /**
     * Get the domain name from the base URL
     */
    public String getDomain() {
        if (baseUrl == null) return null;
        return baseUrl.replaceAll("https?://", "").replaceAll("/.*", "");
    }

    /**
     * Check if a URL belongs to this source
     */
    public boolean matchesUrl(String url) {
        String domain = getDomain();
        return url != null && domain != null && url.toLowerCase().contains(domain.toLowerCase());
    }

    /**
     * Absolute URLs of the listing pages to fetch, in declaration order
     */
    public List<String> getListingUrls() {
        if (listingPaths == null || listingPaths.isEmpty()) return List.of(baseUrl);
        return listingPaths.stream()
                .map(this::resolvePath)
                .toList();
    }

    public int effectiveRequestsPerMinute(ScrapingConfig defaults) {
        return requestsPerMinute != null && requestsPerMinute > 0
                ? requestsPerMinute : defaults.getDefaultRequestsPerMinute();
    }

    public int effectiveTimeoutSeconds(ScrapingConfig defaults) {
        return timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : defaults.getDefaultTimeout();
    }

    public boolean effectiveRespectRobots(ScrapingConfig defaults) {
        return respectRobotsTxt != null ? respectRobotsTxt : defaults.isRespectRobotsTxt();
    }

    private String resolvePath(String path) {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        if (baseUrl.endsWith("/") && path.startsWith("/")) {
            return baseUrl + path.substring(1);
        } else if (!baseUrl.endsWith("/") && !path.startsWith("/")) {
            return baseUrl + "/" + path;
        }
        return baseUrl + path;
    }
}
