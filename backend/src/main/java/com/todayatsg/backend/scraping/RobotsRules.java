package com.todayatsg.backend.scraping;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The Allow/Disallow rules of a robots.txt file that apply to one user agent.
 * <p>
 * The group naming our agent is used when there is one, otherwise the {@code *} group.
 * Among matching rules the longest pattern wins and Allow wins a tie. Patterns support
 * {@code *} wildcards and a trailing {@code $} end anchor.
 */
public class RobotsRules {

    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of());

    private final List<Rule> rules;

    private RobotsRules(List<Rule> rules) {
        this.rules = rules;
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    public static RobotsRules parse(String content, String userAgent) {
        if (content == null || content.isBlank()) return ALLOW_ALL;

        String agent = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
        List<Rule> specific = new ArrayList<>();
        List<Rule> wildcard = new ArrayList<>();

        List<String> groupAgents = new ArrayList<>();
        List<Rule> groupRules = new ArrayList<>();
        boolean inRules = false;

        for (String rawLine : content.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            int colon = line.indexOf(':');
            if (colon <= 0) continue;

            String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (field) {
                case "user-agent" -> {
                    if (inRules) {
                        assign(groupAgents, groupRules, agent, specific, wildcard);
                        groupAgents = new ArrayList<>();
                        groupRules = new ArrayList<>();
                        inRules = false;
                    }
                    groupAgents.add(value.toLowerCase(Locale.ROOT));
                }
                case "allow", "disallow" -> {
                    inRules = true;
                    // An empty Disallow permits everything and adds no rule
                    if (!value.isEmpty()) {
                        groupRules.add(new Rule(value, field.equals("allow")));
                    }
                }
                default -> {
                    // Crawl-delay, Sitemap and unknown fields do not affect path rules
                }
            }
        }
        assign(groupAgents, groupRules, agent, specific, wildcard);

        List<Rule> applicable = !specific.isEmpty() ? specific : wildcard;
        return applicable.isEmpty() ? ALLOW_ALL : new RobotsRules(List.copyOf(applicable));
    }

    /**
     * Whether the given path (with optional query string) may be fetched
     */
    public boolean isAllowed(String path) {
        String target = path == null || path.isEmpty() ? "/" : path;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(target)) continue;
            if (best == null
                    || rule.length() > best.length()
                    || (rule.length() == best.length() && rule.allow() && !best.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    public int size() {
        return rules.size();
    }

    private static void assign(List<String> agents, List<Rule> rules, String ourAgent,
                               List<Rule> specific, List<Rule> wildcard) {
        if (agents.isEmpty()) return;
        boolean matchesUs = agents.stream()
                .anyMatch(a -> !a.equals("*") && !a.isEmpty() && ourAgent.contains(a));
        if (matchesUs) {
            specific.addAll(rules);
        } else if (agents.contains("*")) {
            wildcard.addAll(rules);
        }
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static final class Rule {
        private final String pattern;
        private final boolean allow;
        private final Pattern regex;

        Rule(String pattern, boolean allow) {
            this.pattern = pattern;
            this.allow = allow;
            this.regex = compile(pattern);
        }

        boolean matches(String path) {
            return regex.matcher(path).lookingAt();
        }

        boolean allow() {
            return allow;
        }

        int length() {
            return pattern.length();
        }

        private static Pattern compile(String pattern) {
            boolean anchored = pattern.endsWith("$");
            String body = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
            String[] parts = body.split("\\*", -1);
            StringBuilder regex = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) regex.append(".*");
                if (!parts[i].isEmpty()) regex.append(Pattern.quote(parts[i]));
            }
            if (anchored) regex.append("$");
            return Pattern.compile(regex.toString());
        }
    }
}
