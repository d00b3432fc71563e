package com.todayatsg.backend.scraping;

import com.todayatsg.backend.config.SourceDefinition;
import com.todayatsg.backend.exception.UnknownSourceException;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Service to load and look up event source definitions from YAML
 */
@Service
@Slf4j
public class SourceConfigService {

    private final Map<String, SourceDefinition> sources = new LinkedHashMap<>();
    private final Resource configResource;

    public SourceConfigService(@Value("${ingestion.sources-file:classpath:sources.yml}") Resource configResource) {
        this.configResource = configResource;
    }

    @PostConstruct
    public void loadConfigurations() {
        try (InputStream inputStream = configResource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);

            @SuppressWarnings("unchecked")
            Map<String, Object> sourceEntries = data == null ? null : (Map<String, Object>) data.get("sources");
            if (sourceEntries == null) {
                throw new IllegalStateException("No 'sources' section in " + configResource.getDescription());
            }

            sources.clear();
            for (Map.Entry<String, Object> entry : sourceEntries.entrySet()) {
                @SuppressWarnings("unchecked")
                Map<String, Object> sourceData = (Map<String, Object>) entry.getValue();

                SourceDefinition definition = createDefinitionFromMap(entry.getKey(), sourceData);
                if (definition.getBaseUrl() == null || definition.getBaseUrl().isBlank()) {
                    throw new IllegalStateException("Source '" + entry.getKey() + "' has no baseUrl");
                }
                sources.put(definition.getId(), definition);
                log.info("Loaded source definition: {} ({})", definition.getId(), definition.getBaseUrl());
            }

            log.info("Successfully loaded {} event source definitions", sources.size());

        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error loading event source definitions", e);
            throw new IllegalStateException("Failed to load event source definitions", e);
        }
    }

    /**
     * Get a source by id, failing for ids that are not configured
     */
    public SourceDefinition getSource(String sourceId) {
        return findSource(sourceId).orElseThrow(() -> new UnknownSourceException(sourceId));
    }

    public Optional<SourceDefinition> findSource(String sourceId) {
        return Optional.ofNullable(sourceId == null ? null : sources.get(sourceId.toLowerCase()));
    }

    public Collection<SourceDefinition> getAllSources() {
        return List.copyOf(sources.values());
    }

    public List<SourceDefinition> getEnabledSources() {
        return sources.values().stream()
                .filter(SourceDefinition::isEnabled)
                .toList();
    }

    /**
     * Create SourceDefinition from YAML map data
     */
    private SourceDefinition createDefinitionFromMap(String id, Map<String, Object> sourceData) {
        SourceDefinition definition = new SourceDefinition();

        definition.setId(id.toLowerCase());
        definition.setName(stringValue(sourceData.get("name"), id));
        definition.setBaseUrl(stringValue(sourceData.get("baseUrl"), null));
        definition.setEnabled(booleanValue(sourceData.get("enabled"), true));
        definition.setListingPaths(stringList(sourceData.get("listingPaths")));

        definition.setRequestsPerMinute(integerValue(sourceData.get("requestsPerMinute")));
        definition.setTimeoutSeconds(integerValue(sourceData.get("timeoutSeconds")));
        Object robots = sourceData.get("respectRobotsTxt");
        definition.setRespectRobotsTxt(robots == null ? null : booleanValue(robots, true));
        definition.setJavascript(booleanValue(sourceData.get("javascript"), false));
        definition.setMaxEvents(integerValue(sourceData.get("maxEvents")));

        definition.setContainerSelectors(stringList(sourceData.get("containerSelectors")));
        definition.setTitleSelectors(stringList(sourceData.get("titleSelectors")));
        definition.setDescriptionSelectors(stringList(sourceData.get("descriptionSelectors")));
        definition.setDateSelectors(stringList(sourceData.get("dateSelectors")));
        definition.setTimeSelectors(stringList(sourceData.get("timeSelectors")));
        definition.setVenueSelectors(stringList(sourceData.get("venueSelectors")));
        definition.setAddressSelectors(stringList(sourceData.get("addressSelectors")));
        definition.setPriceSelectors(stringList(sourceData.get("priceSelectors")));
        definition.setCategorySelectors(stringList(sourceData.get("categorySelectors")));

        definition.setDefaultVenue(stringValue(sourceData.get("defaultVenue"), null));
        definition.setDefaultCategory(stringValue(sourceData.get("defaultCategory"), null));
        definition.setDefaultTags(stringList(sourceData.get("defaultTags")));

        return definition;
    }

    private static String stringValue(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }

    private static Integer integerValue(Object value) {
        if (value == null) return null;
        if (value instanceof Number number) return number.intValue();
        return Integer.valueOf(value.toString().trim());
    }

    private static boolean booleanValue(Object value, boolean fallback) {
        if (value == null) return fallback;
        if (value instanceof Boolean bool) return bool;
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) result.add(item.toString());
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }
}
