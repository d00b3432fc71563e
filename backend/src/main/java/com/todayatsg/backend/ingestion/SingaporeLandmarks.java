package com.todayatsg.backend.ingestion;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Known Singapore places with reference coordinates, matched by name.
 */
@Component
public class SingaporeLandmarks {

    @Getter
    public static class Landmark {
        private final String slug;
        private final String name;
        private final double latitude;
        private final double longitude;
        private final List<String> aliases;

        Landmark(String slug, String name, double latitude, double longitude, String... aliases) {
            this.slug = slug;
            this.name = name;
            this.latitude = latitude;
            this.longitude = longitude;
            this.aliases = List.of(aliases);
        }
    }

    /**
     * A landmark together with the alias that matched, so the longest alias can win
     */
    @Getter
    public static class Match {
        private final Landmark landmark;
        private final String alias;

        Match(Landmark landmark, String alias) {
            this.landmark = landmark;
            this.alias = alias;
        }
    }

    private static final List<Landmark> LANDMARKS = List.of(
            new Landmark("marina-bay", "Marina Bay", 1.2806, 103.8598,
                    "marina bay", "marina bay sands", "mbs", "sands theatre", "sands expo", "artscience museum",
                    "the float", "bayfront"),
            new Landmark("gardens-by-the-bay", "Gardens by the Bay", 1.2816, 103.8636,
                    "gardens by the bay", "supertree grove", "flower dome", "cloud forest"),
            new Landmark("esplanade", "Esplanade", 1.2897, 103.8555,
                    "esplanade", "theatres on the bay"),
            new Landmark("suntec-city", "Suntec City", 1.2937, 103.8572,
                    "suntec", "suntec city", "suntec convention centre", "suntec singapore"),
            new Landmark("orchard", "Orchard Road", 1.3048, 103.8318,
                    "orchard", "orchard road", "ion orchard", "ngee ann city", "takashimaya", "paragon", "313 somerset"),
            new Landmark("clarke-quay", "Clarke Quay", 1.2884, 103.8470,
                    "clarke quay", "robertson quay", "boat quay"),
            new Landmark("sentosa", "Sentosa", 1.2494, 103.8303,
                    "sentosa", "resorts world sentosa", "universal studios", "siloso", "palawan beach"),
            new Landmark("chinatown", "Chinatown", 1.2820, 103.8439,
                    "chinatown", "pagoda street", "kreta ayer"),
            new Landmark("little-india", "Little India", 1.3067, 103.8524,
                    "little india", "serangoon road", "tekka"),
            new Landmark("bugis", "Bugis", 1.2966, 103.8520,
                    "bugis", "bugis junction", "kampong glam", "arab street", "haji lane"),
            new Landmark("raffles-place", "Raffles Place", 1.2834, 103.8519,
                    "raffles place", "one raffles place", "fullerton"),
            new Landmark("city-hall", "City Hall", 1.2930, 103.8520,
                    "city hall", "raffles city", "padang", "capitol"),
            new Landmark("national-gallery", "National Gallery Singapore", 1.2903, 103.8515,
                    "national gallery"),
            new Landmark("national-museum", "National Museum of Singapore", 1.2966, 103.8485,
                    "national museum"),
            new Landmark("fort-canning", "Fort Canning Park", 1.2950, 103.8465,
                    "fort canning"),
            new Landmark("dhoby-ghaut", "Dhoby Ghaut", 1.2990, 103.8456,
                    "dhoby ghaut", "plaza singapura", "the cathay"),
            new Landmark("tanjong-pagar", "Tanjong Pagar", 1.2764, 103.8458,
                    "tanjong pagar", "duxton"),
            new Landmark("harbourfront", "HarbourFront", 1.2653, 103.8220,
                    "harbourfront", "harbour front", "vivocity", "mount faber"),
            new Landmark("botanic-gardens", "Singapore Botanic Gardens", 1.3138, 103.8159,
                    "botanic gardens", "botanic garden"),
            new Landmark("holland-village", "Holland Village", 1.3112, 103.7960,
                    "holland village", "holland v"),
            new Landmark("national-stadium", "National Stadium", 1.3039, 103.8748,
                    "national stadium", "sports hub", "kallang", "singapore indoor stadium", "kallang wave"),
            new Landmark("singapore-expo", "Singapore EXPO", 1.3349, 103.9580,
                    "singapore expo", "expo hall", "max atria"),
            new Landmark("changi", "Changi", 1.3644, 103.9915,
                    "changi", "changi airport", "jewel changi"),
            new Landmark("tampines", "Tampines", 1.3496, 103.9568,
                    "tampines", "tampines hub", "our tampines hub"),
            new Landmark("bedok", "Bedok", 1.3236, 103.9273,
                    "bedok", "east coast park", "east coast"),
            new Landmark("pasir-ris", "Pasir Ris", 1.3721, 103.9474,
                    "pasir ris"),
            new Landmark("punggol", "Punggol", 1.4043, 103.9021,
                    "punggol"),
            new Landmark("sengkang", "Sengkang", 1.3868, 103.8947,
                    "sengkang"),
            new Landmark("hougang", "Hougang", 1.3613, 103.8929,
                    "hougang"),
            new Landmark("serangoon", "Serangoon", 1.3554, 103.8679,
                    "serangoon", "nex"),
            new Landmark("ang-mo-kio", "Ang Mo Kio", 1.3691, 103.8454,
                    "ang mo kio", "amk"),
            new Landmark("bishan", "Bishan", 1.3506, 103.8480,
                    "bishan", "bishan park"),
            new Landmark("toa-payoh", "Toa Payoh", 1.3343, 103.8563,
                    "toa payoh"),
            new Landmark("yishun", "Yishun", 1.4231, 103.8298,
                    "yishun"),
            new Landmark("woodlands", "Woodlands", 1.4382, 103.7890,
                    "woodlands", "causeway point"),
            new Landmark("mandai", "Mandai", 1.4043, 103.7930,
                    "singapore zoo", "mandai", "night safari", "river wonders", "bird paradise"),
            new Landmark("jurong-east", "Jurong East", 1.3329, 103.7436,
                    "jurong east", "jem", "westgate", "science centre", "jurong"),
            new Landmark("jurong-west", "Jurong West", 1.3404, 103.7090,
                    "jurong west", "jurong lake"),
            new Landmark("bukit-batok", "Bukit Batok", 1.3490, 103.7498,
                    "bukit batok"),
            new Landmark("clementi", "Clementi", 1.3142, 103.7649,
                    "clementi"));

    public List<Landmark> all() {
        return LANDMARKS;
    }

    public Optional<Landmark> findBySlug(String slug) {
        return LANDMARKS.stream().filter(l -> l.getSlug().equals(slug)).findFirst();
    }

    /**
     * Best landmark named anywhere in the given texts. The longest matching alias wins, so
     * "jurong west" beats "jurong" and "marina bay sands" beats "marina bay".
     */
    public Optional<Match> match(String... texts) {
        Match best = null;
        for (String text : texts) {
            String haystack = " " + simplify(text) + " ";
            if (haystack.isBlank()) continue;
            for (Landmark landmark : LANDMARKS) {
                for (String alias : landmark.getAliases()) {
                    if (haystack.contains(" " + alias + " ")
                            && (best == null || alias.length() > best.getAlias().length())) {
                        best = new Match(landmark, alias);
                    }
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Landmark closest to a point
     */
    public Landmark nearest(double latitude, double longitude) {
        Landmark nearest = LANDMARKS.get(0);
        double best = Double.MAX_VALUE;
        for (Landmark landmark : LANDMARKS) {
            double distance = GeolocationResolver.haversineKm(latitude, longitude,
                    landmark.getLatitude(), landmark.getLongitude());
            if (distance < best) {
                best = distance;
                nearest = landmark;
            }
        }
        return nearest;
    }

    private static String simplify(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }
}
