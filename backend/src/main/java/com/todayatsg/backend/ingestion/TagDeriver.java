package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.model.dto.NormalizedEvent;
import com.todayatsg.backend.model.enums.EventCategory;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds an event's tag slugs from source hints plus tags derived from its time, price,
 * venue and area.
 */
@Component
@RequiredArgsConstructor
public class TagDeriver {

    public static final int MAX_TAGS = 10;
    public static final int MAX_TAG_LENGTH = 50;

    private static final Pattern AMOUNT = Pattern.compile("(\\d{1,5})(?:[.,]\\d{2})?");
    private static final int PREMIUM_FROM_SGD = 100;

    private final SingaporeLandmarks landmarks;

    public List<String> derive(NormalizedEvent event, Collection<String> hints) {
        Set<String> tags = new LinkedHashSet<>();
        if (hints != null) {
            for (String hint : hints) {
                String slug = slugify(hint);
                if (slug != null) tags.add(slug);
            }
        }

        if (event.getTime() != null) {
            int hour = event.getTime().getHour();
            if (hour >= 6 && hour < 12) {
                tags.add("morning");
            } else if (hour >= 12 && hour < 17) {
                tags.add("afternoon");
            } else if (hour >= 17 && hour < 21) {
                tags.add("evening");
            } else {
                tags.add("night");
            }
        }

        if (event.getDate() != null) {
            DayOfWeek day = event.getDate().getDayOfWeek();
            tags.add(day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? "weekend" : "weekday");
        }

        String price = event.getPriceInfo() == null ? "" : event.getPriceInfo().toLowerCase(Locale.ROOT);
        if (price.contains("free") || price.contains("complimentary") || price.contains("no charge")) {
            tags.add("free");
        } else if (price.contains("premium") || price.contains("vip") || price.contains("exclusive")
                || highestAmount(price) >= PREMIUM_FROM_SGD) {
            tags.add("premium");
        }

        String venue = String.join(" ", nullToEmpty(event.getVenue()), nullToEmpty(event.getLocation()))
                .toLowerCase(Locale.ROOT);
        if (venue.contains("mall") || venue.contains("shopping") || venue.contains("suntec")) {
            tags.add("shopping-mall");
        } else if (venue.contains("hotel") || venue.contains("resort")) {
            tags.add("hotel");
        } else if (venue.contains("community") || venue.matches(".*\\bcc\\b.*")) {
            tags.add("community-center");
        } else if (venue.contains("park") || venue.contains("garden") || venue.contains("beach")) {
            tags.add("outdoor");
        }

        if (event.getCategory() == EventCategory.FAMILY
                || "all ages".equalsIgnoreCase(nullToEmpty(event.getAgeRestrictions()))) {
            tags.add("family-friendly");
        }

        landmarks.match(event.getVenue(), event.getLocation(), event.getAddress())
                .ifPresent(match -> tags.add(match.getLandmark().getSlug()));

        List<String> result = new ArrayList<>(tags);
        return result.size() > MAX_TAGS ? new ArrayList<>(result.subList(0, MAX_TAGS)) : result;
    }

    /**
     * Lower-case slug of [a-z0-9-], at most 50 characters; null when nothing is left
     */
    public static String slugify(String text) {
        if (text == null) return null;
        String slug = text.toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_TAG_LENGTH) {
            slug = slug.substring(0, MAX_TAG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? null : slug;
    }

    private static int highestAmount(String price) {
        int highest = 0;
        Matcher matcher = AMOUNT.matcher(price);
        while (matcher.find()) {
            highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
        }
        return highest;
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
