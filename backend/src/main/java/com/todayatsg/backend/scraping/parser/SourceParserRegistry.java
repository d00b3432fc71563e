package com.todayatsg.backend.scraping.parser;

import com.todayatsg.backend.exception.UnknownSourceException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Source id to parser lookup, fixed when the application context starts.
 */
@Component
@Slf4j
public class SourceParserRegistry {

    private final Map<String, SourceParser> parsers;

    public SourceParserRegistry(List<SourceParser> parserBeans) {
        Map<String, SourceParser> byId = new TreeMap<>();
        for (SourceParser parser : parserBeans) {
            String id = parser.sourceId().toLowerCase();
            SourceParser previous = byId.putIfAbsent(id, parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate parser for source '" + id + "': "
                        + previous.getClass().getSimpleName() + " and " + parser.getClass().getSimpleName());
            }
        }
        this.parsers = Collections.unmodifiableMap(byId);
        log.info("Registered parsers for sources: {}", parsers.keySet());
    }

    public SourceParser getParser(String sourceId) {
        SourceParser parser = sourceId == null ? null : parsers.get(sourceId.toLowerCase());
        if (parser == null) {
            throw new UnknownSourceException(sourceId);
        }
        return parser;
    }

    public boolean hasParser(String sourceId) {
        return sourceId != null && parsers.containsKey(sourceId.toLowerCase());
    }

    public Set<String> sourceIds() {
        return parsers.keySet();
    }
}
