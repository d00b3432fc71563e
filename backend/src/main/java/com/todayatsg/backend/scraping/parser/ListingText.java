package com.todayatsg.backend.scraping.parser;

import java.net.URI;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Text and attribute helpers shared by the listing parsers
 */
@Slf4j
public final class ListingText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FREE = Pattern.compile("\\bfree\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRICE = Pattern.compile(
            "(?:S\\$|SGD\\s?|\\$)\\s?\\d{1,5}(?:[.,]\\d{2})?(?:\\s?(?:-|–|to)\\s?(?:S\\$|SGD\\s?|\\$)?\\s?\\d{1,5}(?:[.,]\\d{2})?)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AGE_PLUS = Pattern.compile("\\b(\\d{1,2})\\s?\\+(?!\\d)");
    private static final Pattern AGE_RATING = Pattern.compile("\\b(R21|M18|NC16|PG13)\\b");
    private static final Pattern AGE_PHRASE = Pattern.compile(
            "\\b(all ages|family[- ]friendly|adults only|kids only|children only)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKGROUND_URL = Pattern.compile("url\\(['\"]?([^'\")]+)['\"]?\\)");

    private ListingText() {
    }

    /**
     * Collapse whitespace and trim; blank becomes null
     */
    public static String clean(String text) {
        if (text == null) return null;
        String cleaned = WHITESPACE.matcher(text.replace('\u00A0', ' ')).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * First non-empty value among the selectors, in priority order
     */
    public static String firstText(Element root, List<String> selectors) {
        if (selectors == null) return null;
        for (String selector : selectors) {
            try {
                Elements elements = root.select(selector);
                for (Element element : elements) {
                    String value = valueOf(element);
                    if (value != null) return value;
                }
            } catch (RuntimeException e) {
                log.debug("Error with selector '{}': {}", selector, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Prefer machine-readable attributes (datetime, content) over visible text
     */
    public static String valueOf(Element element) {
        for (String attr : List.of("datetime", "content")) {
            if (element.hasAttr(attr)) {
                String value = clean(element.attr(attr));
                if (value != null) return value;
            }
        }
        return clean(element.text());
    }

    public static String extractPrice(String text) {
        if (text == null) return null;
        Matcher price = PRICE.matcher(text);
        if (price.find()) {
            return clean(price.group());
        }
        return FREE.matcher(text).find() ? "Free" : null;
    }

    public static String extractAgeRestriction(String text) {
        if (text == null) return null;
        Matcher plus = AGE_PLUS.matcher(text);
        if (plus.find()) {
            return plus.group(1) + "+";
        }
        Matcher phrase = AGE_PHRASE.matcher(text);
        if (phrase.find()) {
            String found = phrase.group(1).toLowerCase();
            return found.startsWith("family") ? "All ages" : capitalize(found);
        }
        Matcher rating = AGE_RATING.matcher(text);
        return rating.find() ? rating.group(1) : null;
    }

    /**
     * Image URL of a card: img src, lazy-load attributes, then inline background-image
     */
    public static String imageUrl(Element container) {
        Element img = container.selectFirst("img");
        if (img != null) {
            for (String attr : List.of("src", "data-src", "data-lazy-src", "data-original")) {
                String url = img.absUrl(attr);
                if (!url.isEmpty() && !url.startsWith("data:")) return url;
            }
        }
        for (Element styled : container.select("[style*=background-image]")) {
            Matcher matcher = BACKGROUND_URL.matcher(styled.attr("style"));
            if (matcher.find()) {
                String raw = matcher.group(1).trim();
                return raw.startsWith("http") ? raw : resolve(styled.baseUri(), raw);
            }
        }
        return null;
    }

    /**
     * Absolute URL of the first real link in a card (or of the card itself when it is a link)
     */
    public static String link(Element container) {
        if (container.is("a[href]")) {
            String own = container.absUrl("href");
            if (!own.isEmpty()) return own;
        }
        for (Element anchor : container.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.startsWith("javascript:")) continue;
            String url = anchor.absUrl("href");
            if (!url.isEmpty()) return url;
        }
        return null;
    }

    private static String resolve(String base, String relative) {
        try {
            return URI.create(base).resolve(relative).toString();
        } catch (IllegalArgumentException e) {
            return relative;
        }
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
