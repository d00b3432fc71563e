package com.todayatsg.backend.scraping;

import com.google.common.util.concurrent.RateLimiter;
import com.todayatsg.backend.config.ScrapingConfig;
import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.FetchException;
import com.todayatsg.backend.model.dto.FetchedDocument;
import io.github.resilience4j.retry.Retry;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

/**
 * Polite HTTP access to event sources.
 * <p>
 * Every request of a source goes through that source's rate limiter, is checked against
 * its robots.txt first, and is retried through the shared fetch retry policy when the
 * failure is transient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceFetcher {

    private final ScrapingConfig scrapingConfig;
    private final Retry sourceFetchRetry;
    private final PageRenderer pageRenderer;

    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, RobotsRules> robotsCache = new ConcurrentHashMap<>();

    /**
     * Fetch one page of a source
     */
    public FetchedDocument fetch(SourceDefinition source, String url) {
        if (source.effectiveRespectRobots(scrapingConfig) && !isAllowedByRobots(source, url)) {
            log.warn("Skipping {} for source {}: disallowed by robots.txt", url, source.getId());
            throw FetchException.robotsDisallowed(url);
        }

        return Retry.decorateSupplier(sourceFetchRetry, () -> fetchOnce(source, url)).get();
    }

    /**
     * Check the URL against the (cached) robots.txt rules of its source
     */
    public boolean isAllowedByRobots(SourceDefinition source, String url) {
        RobotsRules rules = robotsCache.computeIfAbsent(source.getId(), id -> loadRobots(source));
        return rules.isAllowed(pathOf(url));
    }

    /**
     * Forget cached robots rules and limiters, e.g. after sources.yml changed
     */
    public void reset() {
        robotsCache.clear();
        rateLimiters.clear();
    }

    private FetchedDocument fetchOnce(SourceDefinition source, String url) {
        rateLimiter(source).acquire();

        if (source.isJavascript()) {
            return pageRenderer.render(url);
        }

        try {
            log.debug("Fetching {} for source {}", url, source.getId());
            Connection.Response response = connect(source, url).execute();

            int status = response.statusCode();
            if (status >= 400) {
                throw FetchException.httpStatus(url, status);
            }

            return new FetchedDocument(url, status, response.body(), response.contentType(), LocalDateTime.now());

        } catch (SocketTimeoutException e) {
            throw FetchException.timeout(url, e);
        } catch (IOException e) {
            throw FetchException.io(url, e);
        }
    }

    private RobotsRules loadRobots(SourceDefinition source) {
        String robotsUrl = robotsUrlOf(source.getBaseUrl());
        try {
            rateLimiter(source).acquire();
            Connection.Response response = connect(source, robotsUrl).execute();
            if (response.statusCode() >= 400) {
                log.info("No robots.txt for {} (HTTP {}), allowing all paths", source.getId(), response.statusCode());
                return RobotsRules.allowAll();
            }
            RobotsRules rules = RobotsRules.parse(response.body(), scrapingConfig.getUserAgent());
            log.info("Loaded robots.txt for {}: {} applicable rules", source.getId(), rules.size());
            return rules;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read robots.txt for {} ({}), allowing all paths", source.getId(), e.getMessage());
            return RobotsRules.allowAll();
        }
    }

    private Connection connect(SourceDefinition source, String url) {
        return Jsoup.connect(url)
                .userAgent(scrapingConfig.getUserAgent())
                .headers(scrapingConfig.getDefaultHeaders())
                .timeout(source.effectiveTimeoutSeconds(scrapingConfig) * 1000)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0);
    }

    private RateLimiter rateLimiter(SourceDefinition source) {
        return rateLimiters.computeIfAbsent(source.getId(),
                id -> RateLimiter.create(source.effectiveRequestsPerMinute(scrapingConfig) / 60.0));
    }

    static String robotsUrlOf(String baseUrl) {
        URI uri = URI.create(baseUrl);
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return uri.getScheme() + "://" + uri.getHost() + port + "/robots.txt";
    }

    static String pathOf(String url) {
        URI uri = URI.create(url);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }
}
