package com.todayatsg.backend.scraping.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.todayatsg.backend.model.dto.ScrapeCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Reads schema.org Event objects out of {@code application/ld+json} script blocks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonLdEventExtractor {

    private static final int MAX_DEPTH = 6;

    // schema.org Event subtypes, mapped to a category hint
    private static final Set<String> EVENT_TYPES = Set.of(
            "event", "musicevent", "festival", "theaterevent", "sportsevent", "exhibitionevent",
            "foodevent", "childrensevent", "businessevent", "educationevent", "socialevent",
            "comedyevent", "danceevent", "literaryevent", "screeningevent", "visualartsevent");

    private final ObjectMapper objectMapper;

    @Getter
    public static class Result {
        private final List<JsonNode> events = new ArrayList<>();
        private int brokenBlocks;
    }

    /**
     * Collect every Event object on the page, including ones nested in @graph,
     * ItemList and EventSeries wrappers
     */
    public Result extract(Document doc) {
        Result result = new Result();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String json = script.data();
            if (json == null || json.isBlank()) continue;
            try {
                collect(objectMapper.readTree(json), result.events, 0);
            } catch (JsonProcessingException e) {
                result.brokenBlocks++;
                log.debug("Unreadable JSON-LD block on {}: {}", doc.location(), e.getOriginalMessage());
            }
        }
        return result;
    }

    /**
     * Map one schema.org Event onto a candidate record
     */
    public ScrapeCandidate toCandidate(JsonNode event, String pageUrl) {
        ScrapeCandidate candidate = new ScrapeCandidate();

        candidate.setTitle(ListingText.clean(text(event, "name")));
        candidate.setDescription(ListingText.clean(text(event, "description")));
        candidate.setDateText(text(event, "startDate"));
        candidate.setEndDateText(text(event, "endDate"));

        JsonNode location = first(event.get("location"));
        if (location != null) {
            if (location.isTextual()) {
                candidate.setLocationText(ListingText.clean(location.asText()));
            } else {
                candidate.setVenue(ListingText.clean(text(location, "name")));
                candidate.setAddress(address(location.get("address")));
                candidate.setLocationText(candidate.getVenue() != null ? candidate.getVenue() : candidate.getAddress());
                JsonNode geo = location.get("geo");
                if (geo != null) {
                    candidate.setLatitude(number(geo.get("latitude")));
                    candidate.setLongitude(number(geo.get("longitude")));
                }
            }
        }

        candidate.setPriceInfo(price(event.get("offers"), event.get("isAccessibleForFree")));
        candidate.setAgeRestrictions(ListingText.clean(text(event, "typicalAgeRange")));
        candidate.setImageUrl(image(event.get("image")));

        String url = text(event, "url");
        candidate.setExternalUrl(url != null ? url : pageUrl);
        String id = text(event, "@id");
        if (id != null && !id.startsWith("_:")) {
            candidate.setExternalId(id);
        }

        String type = primaryType(event);
        if (type != null && !type.equalsIgnoreCase("Event")) {
            candidate.setCategoryHint(type.replaceAll("(?i)event$", ""));
        }
        String keywords = text(event, "keywords");
        if (keywords != null) {
            for (String keyword : keywords.split(",")) {
                String cleaned = ListingText.clean(keyword);
                if (cleaned != null) candidate.getTagHints().add(cleaned);
            }
        }
        return candidate;
    }

    private void collect(JsonNode node, List<JsonNode> events, int depth) {
        if (node == null || depth > MAX_DEPTH) return;
        if (node.isArray()) {
            for (JsonNode child : node) collect(child, events, depth + 1);
            return;
        }
        if (!node.isObject()) return;

        if (node.has("@graph")) {
            collect(node.get("@graph"), events, depth + 1);
        }
        if (node.has("itemListElement")) {
            for (JsonNode element : node.get("itemListElement")) {
                collect(element.has("item") ? element.get("item") : element, events, depth + 1);
            }
        }
        if (hasType(node, "EventSeries")) {
            JsonNode children = node.has("subEvent") ? node.get("subEvent") : node.get("event");
            if (children != null) {
                collect(children, events, depth + 1);
                return;
            }
        }
        if (isEvent(node)) {
            events.add(node);
        }
    }

    private boolean isEvent(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type == null) return false;
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (EVENT_TYPES.contains(t.asText().toLowerCase())) return true;
            }
            return false;
        }
        return EVENT_TYPES.contains(type.asText().toLowerCase());
    }

    private boolean hasType(JsonNode node, String wanted) {
        JsonNode type = node.get("@type");
        if (type == null) return false;
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.asText().equalsIgnoreCase(wanted)) return true;
            }
            return false;
        }
        return type.asText().equalsIgnoreCase(wanted);
    }

    private String primaryType(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type == null) return null;
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (EVENT_TYPES.contains(t.asText().toLowerCase())) return t.asText();
            }
            return null;
        }
        return type.asText();
    }

    private String address(JsonNode address) {
        JsonNode node = first(address);
        if (node == null) return null;
        if (node.isTextual()) return ListingText.clean(node.asText());

        List<String> parts = new ArrayList<>();
        for (String field : List.of("streetAddress", "addressLocality", "postalCode")) {
            String value = ListingText.clean(text(node, field));
            if (value != null && !parts.contains(value)) parts.add(value);
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String price(JsonNode offers, JsonNode accessibleForFree) {
        if (accessibleForFree != null && accessibleForFree.asBoolean(false)) {
            return "Free";
        }
        JsonNode offer = first(offers);
        if (offer == null || !offer.isObject()) return null;

        String currency = text(offer, "priceCurrency");
        String prefix = currency == null || currency.equalsIgnoreCase("SGD") ? "S$" : currency + " ";
        String low = text(offer, "lowPrice");
        String high = text(offer, "highPrice");
        if (low != null && high != null && !low.equals(high)) {
            return isZero(low) ? "Free - " + prefix + high : prefix + low + " - " + prefix + high;
        }
        String single = text(offer, "price");
        if (single == null) single = low;
        if (single == null) return null;
        return isZero(single) ? "Free" : prefix + single;
    }

    private String image(JsonNode image) {
        JsonNode node = first(image);
        if (node == null) return null;
        if (node.isTextual()) return node.asText();
        return text(node, "url");
    }

    private static boolean isZero(String amount) {
        try {
            return Double.parseDouble(amount) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static JsonNode first(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isArray()) return node.isEmpty() ? null : node.get(0);
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : value) {
                if (item.isValueNode()) parts.add(item.asText());
            }
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
        if (!value.isValueNode()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        try {
            return Double.valueOf(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
