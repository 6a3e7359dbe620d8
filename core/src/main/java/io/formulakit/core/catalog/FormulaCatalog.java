package io.formulakit.core.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formulakit.core.engine.FormulaRegistry;
import io.formulakit.core.error.FormulaCatalogException;
import io.formulakit.core.model.FormulaDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports and exports formula definitions in the catalog document shape:
 *
 * <pre>
 * {
 *   "formulas": [
 *     { "id": "damage", "expression": "baseDamage * (1 + strength * 0.1)" }
 *   ]
 * }
 * </pre>
 *
 * Files ending in {@code .yaml} or {@code .yml} are read as YAML with the same structure. Only the
 * {@code (id, expression)} pairs cross this boundary; every expression is parsed by the registry.
 */
public final class FormulaCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaCatalog.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final FormulaRegistry registry;

    public FormulaCatalog(FormulaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Registers every formula in a JSON catalog document.
     *
     * @return the number of formulas registered; entries that fail to parse are skipped
     * @throws FormulaCatalogException if the document is not a valid catalog
     */
    public int load(String json) {
        Objects.requireNonNull(json, "json must not be null");
        return register(readDefinitions(JSON_MAPPER, json, "<inline>"), "<inline>");
    }

    /**
     * Registers every formula in a catalog file, JSON or YAML by extension.
     *
     * @throws FormulaCatalogException if the file cannot be read or is not a valid catalog
     */
    public int loadFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new FormulaCatalogException("Catalog file not found: " + path, source);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FormulaCatalogException("Failed to read catalog: " + e.getMessage(), e, source);
        }
        return register(readDefinitions(mapperFor(path), content, source), source);
    }

    /**
     * Registers every formula in a catalog read from a stream, typically a classpath resource.
     *
     * @param source name used in log messages and exceptions
     */
    public int loadStream(InputStream in, String source) {
        Objects.requireNonNull(in, "in must not be null");
        String content;
        try {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FormulaCatalogException("Failed to read catalog: " + e.getMessage(), e, source);
        }
        ObjectMapper mapper = isYaml(source) ? YAML_MAPPER : JSON_MAPPER;
        return register(readDefinitions(mapper, content, source), source);
    }

    /**
     * Parses a catalog document into definitions without registering them. Entries missing an id
     * or an expression are skipped with a warning.
     *
     * @throws FormulaCatalogException if the document is not a valid catalog
     */
    public static List<FormulaDefinition> parse(String json) {
        return readDefinitions(JSON_MAPPER, json, "<inline>");
    }

    /** Exports every registered formula as a pretty-printed JSON catalog. */
    public String export() {
        return export(registry.ids());
    }

    /**
     * Exports the given formulas as a pretty-printed JSON catalog. Unknown ids are skipped.
     */
    public String export(Collection<String> ids) {
        ObjectNode root = JSON_MAPPER.createObjectNode();
        ArrayNode formulas = root.putArray("formulas");
        for (String id : ids) {
            registry.expression(id).ifPresent(expression -> formulas.addObject()
                    .put("id", id)
                    .put("expression", expression));
        }
        try {
            return JSON_MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Writes every registered formula to {@code path}. */
    public void exportFile(Path path) {
        exportFile(path, registry.ids());
    }

    /**
     * Writes the given formulas to {@code path} as a JSON catalog, replacing any existing file.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void exportFile(Path path, Collection<String> ids) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            Files.writeString(path, export(ids), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write catalog " + path, e);
        }
    }

    private int register(List<FormulaDefinition> definitions, String source) {
        int count = registry.registerAll(definitions);
        LOG.info("catalog.loaded source={} formulas={} registered={}", source, definitions.size(), count);
        return count;
    }

    private static List<FormulaDefinition> readDefinitions(ObjectMapper mapper, String content, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new FormulaCatalogException("Failed to parse catalog: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new FormulaCatalogException("Catalog must be an object with a 'formulas' array", source);
        }
        JsonNode formulas = root.get("formulas");
        if (formulas == null || !formulas.isArray()) {
            throw new FormulaCatalogException("Missing or invalid 'formulas' array", source);
        }

        List<FormulaDefinition> definitions = new ArrayList<>(formulas.size());
        for (int i = 0; i < formulas.size(); i++) {
            JsonNode entry = formulas.get(i);
            String id = text(entry, "id");
            String expression = text(entry, "expression");
            if (id == null || id.isBlank() || expression == null) {
                LOG.warn("Skipping catalog entry without id or expression: source={} index={}", source, i);
                continue;
            }
            definitions.add(new FormulaDefinition(id, expression));
        }
        return definitions;
    }

    private static String text(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }

    private static ObjectMapper mapperFor(Path path) {
        return isYaml(path.getFileName().toString()) ? YAML_MAPPER : JSON_MAPPER;
    }

    private static boolean isYaml(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
