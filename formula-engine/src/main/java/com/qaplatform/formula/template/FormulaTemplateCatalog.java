package com.qaplatform.formula.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qaplatform.formula.FormulaContext;
import com.qaplatform.formula.FormulaEngine;
import com.qaplatform.formula.ValidationResult;
import com.qaplatform.util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Library of reusable scoring formulas. Built-in templates come from the classpath
 * resource {@value #DEFAULT_RESOURCE}; custom templates are added at runtime.
 */
public class FormulaTemplateCatalog {

    public static final String DEFAULT_RESOURCE = "formula-templates.json";

    private final FormulaEngine engine;
    private final List<FormulaTemplate> templates = new CopyOnWriteArrayList<>();

    public FormulaTemplateCatalog(FormulaEngine engine) {
        this.engine = engine;
    }

    /**
     * Catalog holding the built-in templates.
     */
    public static FormulaTemplateCatalog load(FormulaEngine engine) throws IOException {
        return load(engine, DEFAULT_RESOURCE);
    }

    public static FormulaTemplateCatalog load(FormulaEngine engine, String resourceName) throws IOException {
        FormulaTemplateCatalog catalog = new FormulaTemplateCatalog(engine);
        try (InputStream in = FormulaTemplateCatalog.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Template resource not found: " + resourceName);
            }
            catalog.addAll(new ObjectMapper().readTree(in));
        }
        LoggingUtil.debug("Loaded %d formula templates from %s", catalog.templates.size(), resourceName);
        return catalog;
    }

    /**
     * Add every template of a JSON array, or a single template object.
     */
    public void addAll(JsonNode root) {
        if (root.isArray()) {
            for (JsonNode node : root) {
                add(fromJson(node));
            }
        } else {
            add(fromJson(root));
        }
    }

    /**
     * @throws IllegalArgumentException when a template with the same id is already present
     */
    public synchronized void add(FormulaTemplate template) {
        if (findById(template.getId()).isPresent()) {
            throw new IllegalArgumentException("Duplicate template id: " + template.getId());
        }
        templates.add(template);
    }

    FormulaTemplate fromJson(JsonNode root) {
        String id = required(root, "id");
        try {
            String expression = required(root, "expression");
            List<FormulaExample> examples = new ArrayList<>();
            for (JsonNode exampleNode : root.path("examples")) {
                examples.add(exampleFromJson(exampleNode));
            }
            return new FormulaTemplate(
                    id,
                    required(root, "name"),
                    root.path("description").asText(""),
                    expression,
                    TemplateCategory.fromName(root.path("category").asText("custom")),
                    readStrings(root.path("tags")),
                    engine.extractVariables(expression),
                    engine.extractFunctions(expression),
                    root.path("usageCount").asInt(0),
                    root.path("rating").asDouble(0),
                    examples);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to load template '" + id + "': " + e.getMessage(), e);
        }
    }

    private static FormulaExample exampleFromJson(JsonNode node) {
        JsonNode expected = node.path("expectedResult");
        Object expectedResult;
        if (expected.isNumber()) {
            expectedResult = expected.doubleValue();
        } else if (expected.isBoolean()) {
            expectedResult = expected.booleanValue();
        } else {
            throw new IllegalArgumentException("expectedResult must be a number or a boolean: " + expected);
        }
        return new FormulaExample(
                node.path("name").asText(""),
                node.path("description").asText(""),
                FormulaContext.fromJson(node.get("context")),
                expectedResult,
                node.path("explanation").asText(""));
    }

    private static String required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("Template field '" + field + "' is required");
        }
        return node.asText();
    }

    private static List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }

    public List<FormulaTemplate> getAll() {
        return List.copyOf(templates);
    }

    public Optional<FormulaTemplate> findById(String id) {
        return templates.stream().filter(t -> t.getId().equals(id)).findFirst();
    }

    public List<FormulaTemplate> byCategory(TemplateCategory category) {
        return templates.stream().filter(t -> t.getCategory() == category).collect(Collectors.toList());
    }

    public List<FormulaTemplate> byTag(String tag) {
        return templates.stream().filter(t -> t.getTags().contains(tag)).collect(Collectors.toList());
    }

    /**
     * Case-insensitive match against name, description and tags.
     */
    public List<FormulaTemplate> search(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return templates.stream()
                .filter(t -> t.getName().toLowerCase(Locale.ROOT).contains(needle)
                        || t.getDescription().toLowerCase(Locale.ROOT).contains(needle)
                        || t.getTags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(needle)))
                .collect(Collectors.toList());
    }

    /**
     * Most used first.
     */
    public List<FormulaTemplate> popular(int limit) {
        return templates.stream()
                .sorted(Comparator.comparingInt(FormulaTemplate::getUsageCount).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    /**
     * Templates rated at least {@code minRating}, best rated first.
     */
    public List<FormulaTemplate> highlyRated(double minRating, int limit) {
        return templates.stream()
                .filter(t -> t.getRating() >= minRating)
                .sorted(Comparator.comparingDouble(FormulaTemplate::getRating).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    /**
     * Register a user-defined template. The expression must pass validation.
     *
     * @throws IllegalArgumentException when the expression has validation errors
     */
    public FormulaTemplate createCustom(String name, String description, String expression,
                                        TemplateCategory category, List<String> tags) {
        ValidationResult validation = engine.validateFormula(expression);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid template expression: " + validation.getErrors());
        }
        FormulaTemplate template = new FormulaTemplate(
                "custom-" + UUID.randomUUID(),
                name,
                description,
                expression,
                category == null ? TemplateCategory.CUSTOM : category,
                tags == null ? List.of() : tags,
                engine.extractVariables(expression),
                engine.extractFunctions(expression),
                0,
                0,
                List.of());
        add(template);
        LoggingUtil.info("Created custom template " + template.getId() + " (" + name + ")");
        return template;
    }
}
