package com.wflint.availability;

import com.wflint.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link ContextAvailabilityTable} from YAML.
 * <p>
 * Expected layout:
 * <pre>
 * context-availability:
 *   "jobs.&lt;job_id&gt;.if":
 *     contexts: [github, inputs, needs, vars]
 *     special-functions: [always, cancelled, failure, success]
 * </pre>
 * The keys must be exactly {@link WorkflowKeys#ALL}.
 */
public class AvailabilityLoader {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityLoader.class);

    private static final String ROOT = "context-availability";
    private static final String CONTEXTS = "contexts";
    private static final String SPECIAL_FUNCTIONS = "special-functions";

    /**
     * Load availability data from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the YAML file
     * @return Loaded table
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static ContextAvailabilityTable load(String path) {
        log.info("Loading context availability from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load context availability from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static ContextAvailabilityTable parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Context availability file is empty");
        }

        // The table could be at root or under 'context-availability' key
        Map<String, Object> section = root.containsKey(ROOT)
                ? asMap(root.get(ROOT), ROOT)
                : root;

        Map<String, Availability> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Map<String, Object> values = asMap(entry.getValue(), key);
            entries.put(key, new Availability(
                    new HashSet<>(getNames(values, CONTEXTS, key)),
                    new HashSet<>(getNames(values, SPECIAL_FUNCTIONS, key))));
        }

        checkKeys(entries.keySet());
        ContextAvailabilityTable table = new ContextAvailabilityTable(entries);

        long functions = entries.values().stream()
                .flatMap(availability -> availability.specialFunctions().stream())
                .distinct()
                .count();
        log.info("Loaded context availability for {} locations with {} special functions",
                entries.size(), functions);

        return table;
    }

    private static void checkKeys(Set<String> keys) {
        Set<String> missing = new HashSet<>(WorkflowKeys.ALL);
        missing.removeAll(keys);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Context availability is missing locations: " + missing);
        }

        Set<String> unknown = new HashSet<>(keys);
        unknown.removeAll(WorkflowKeys.ALL);
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Context availability has unknown locations: " + unknown);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String where) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ConfigurationException("Expected a mapping at '" + where + "' but got: " + value);
    }

    private static List<String> getNames(Map<String, Object> map, String field, String key) {
        Object value = map.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Expected a list for '" + field + "' at '" + key + "' but got: " + value);
        }
        List<String> names = new ArrayList<>();
        for (Object item : list) {
            if (item == null) {
                throw new ConfigurationException("Null entry in '" + field + "' at '" + key + "'");
            }
            names.add(item.toString());
        }
        return names;
    }
}
