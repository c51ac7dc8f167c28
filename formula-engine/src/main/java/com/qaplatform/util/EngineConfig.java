package com.qaplatform.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * EngineConfig - limits, hint vocabulary and logging settings for the formula engine.
 * Defaults are set in code; a JSON file or classpath resource may override any of them.
 */
public class EngineConfig {

    public static final String DEFAULT_RESOURCE = "formula-engine.json";

    /**
     * Upper bound for {@code maxDepth}; evaluation recurses once per tree level.
     */
    public static final int MAX_DEPTH_LIMIT = 1000;

    // Complexity guard
    private int maxNodes = 500;
    private int maxDepth = 100;

    // Suggestions
    private int suggestionDistance = 2;
    private Set<String> knownConstants = new LinkedHashSet<>(List.of("pi", "e"));
    private Set<String> knownDimensionIds = new LinkedHashSet<>(List.of(
            "fluency", "adequacy", "style", "terminology", "overall"));
    private Set<String> knownErrorTypeIds = new LinkedHashSet<>(List.of(
            "minor", "major", "critical"));

    // Parsed tree cache, 0 disables it
    private int parseCacheSize = 256;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "formula-engine.log";

    public EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Load configuration from a JSON file. A missing file leaves the defaults in place.
     */
    public static EngineConfig load(String configFilePath) throws IOException {
        EngineConfig config = new EngineConfig();
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Engine config file not found: " + configFilePath);
            LoggingUtil.info("Using default engine configuration");
            return config;
        }

        ObjectMapper mapper = new ObjectMapper();
        config.apply(mapper.readTree(configFile));
        return config;
    }

    /**
     * Load configuration from a classpath resource, falling back to defaults when absent.
     */
    public static EngineConfig fromResource(String resourceName) throws IOException {
        EngineConfig config = new EngineConfig();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.debug("Engine config resource not found: " + resourceName);
                return config;
            }
            config.apply(new ObjectMapper().readTree(in));
        }
        return config;
    }

    public static EngineConfig fromJson(JsonNode root) {
        EngineConfig config = new EngineConfig();
        config.apply(root);
        return config;
    }

    private void apply(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Engine configuration must be a JSON object");
        }

        if (root.has("maxNodes")) {
            setMaxNodes(root.get("maxNodes").asInt());
        }
        if (root.has("maxDepth")) {
            setMaxDepth(root.get("maxDepth").asInt());
        }
        if (root.has("suggestionDistance")) {
            setSuggestionDistance(root.get("suggestionDistance").asInt());
        }
        if (root.has("parseCacheSize")) {
            setParseCacheSize(root.get("parseCacheSize").asInt());
        }
        if (root.has("knownConstants")) {
            knownConstants = readNames(root.get("knownConstants"));
        }
        if (root.has("knownDimensionIds")) {
            knownDimensionIds = readNames(root.get("knownDimensionIds"));
        }
        if (root.has("knownErrorTypeIds")) {
            knownErrorTypeIds = readNames(root.get("knownErrorTypeIds"));
        }

        if (root.has("logging")) {
            JsonNode loggingNode = root.get("logging");
            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }
            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }
            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }
            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }
    }

    private static Set<String> readNames(JsonNode node) {
        Set<String> names = new LinkedHashSet<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                names.add(item.asText());
            }
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.trim().isEmpty()) {
                    names.add(part.trim());
                }
            }
        }
        return names;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + MAX_DEPTH_LIMIT + ": " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getSuggestionDistance() {
        return suggestionDistance;
    }

    public void setSuggestionDistance(int suggestionDistance) {
        this.suggestionDistance = Math.max(0, suggestionDistance);
    }

    public int getParseCacheSize() {
        return parseCacheSize;
    }

    public void setParseCacheSize(int parseCacheSize) {
        this.parseCacheSize = Math.max(0, parseCacheSize);
    }

    public Set<String> getKnownConstants() {
        return Collections.unmodifiableSet(knownConstants);
    }

    public void setKnownConstants(Collection<String> names) {
        this.knownConstants = new LinkedHashSet<>(names);
    }

    public Set<String> getKnownDimensionIds() {
        return Collections.unmodifiableSet(knownDimensionIds);
    }

    public void setKnownDimensionIds(Collection<String> ids) {
        this.knownDimensionIds = new LinkedHashSet<>(ids);
    }

    public Set<String> getKnownErrorTypeIds() {
        return Collections.unmodifiableSet(knownErrorTypeIds);
    }

    public void setKnownErrorTypeIds(Collection<String> ids) {
        this.knownErrorTypeIds = new LinkedHashSet<>(ids);
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }
}
