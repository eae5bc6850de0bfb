package com.finfact.pipeline.taxonomy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finfact.pipeline.config.PipelineProperties;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

@Component
public class MetricDictionaryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricDictionaryLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public MetricDictionaryLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper, PipelineProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public MetricDictionary load() {
        String location = properties.getDictionaryLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DictionaryLoadException("Taxonomy dictionary not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            MetricDictionary dictionary = load(in.readAllBytes(), location);
            LOGGER.info("Loaded taxonomy dictionary {} ({} metrics) from {}",
                dictionary.version(), dictionary.metrics().size(), location);
            return dictionary;
        } catch (IOException e) {
            throw new DictionaryLoadException("Failed to read taxonomy dictionary " + location, e);
        }
    }

    public MetricDictionary load(byte[] payload, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new DictionaryLoadException("Taxonomy dictionary " + source + " is not valid JSON", e);
        }
        JsonNode items = root.isArray() ? root : root.path("metrics");
        if (!items.isArray() || items.isEmpty()) {
            throw new DictionaryLoadException("Taxonomy dictionary " + source + " holds no metrics");
        }

        List<MetricDefinition> metrics = new ArrayList<>();
        for (JsonNode item : items) {
            String code = text(item.get("metric_code"));
            String nameCn = text(item.get("metric_name_cn"));
            var statementType = StatementType.fromCode(text(item.get("statement_type")));
            ValueNature nature = valueNature(text(item.get("value_nature")));
            if (code.isBlank() || nameCn.isBlank() || statementType.isEmpty() || nature == null) {
                LOGGER.debug("Skipping incomplete taxonomy entry {}", code);
                continue;
            }
            List<String> patterns = strings(item, "patterns", "patterns_cn");
            patterns.addAll(strings(item, "patterns_en"));
            List<String> exact = strings(item, "patterns_exact", "patterns_cn_exact");
            exact.addAll(strings(item, "patterns_en_exact"));
            metrics.add(new MetricDefinition(
                code,
                nameCn,
                blankToNull(text(item.get("metric_name_en"))),
                statementType.get(),
                nature,
                "negate".equalsIgnoreCase(text(item.get("sign_convention"))) ? SignConvention.NEGATE : SignConvention.AS_REPORTED,
                blankToNull(text(item.get("parent_metric_code"))),
                patterns,
                exact
            ));
        }
        if (metrics.isEmpty()) {
            throw new DictionaryLoadException("Taxonomy dictionary " + source + " holds no usable metric");
        }

        Map<String, StatementType> rules = new LinkedHashMap<>();
        root.path("backgroundRules").fields().forEachRemaining(entry ->
            StatementType.fromCode(entry.getValue().asText("")).ifPresent(type -> rules.put(entry.getKey(), type)));

        String hash = sha256(payload);
        String version = text(root.get("version"));
        return MetricDictionary.build(
            version.isBlank() ? hash.substring(0, 12) : version,
            hash,
            properties.getMatching().getShortLabelMaxLength(),
            metrics,
            strings(root, "stopLabels"),
            strings(root, "shortLabelDenylist"),
            rules
        );
    }

    private static ValueNature valueNature(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "stock" -> ValueNature.STOCK;
            case "flow" -> ValueNature.FLOW;
            case "ratio" -> ValueNature.RATIO;
            default -> null;
        };
    }

    private static List<String> strings(JsonNode node, String... fields) {
        List<String> values = new ArrayList<>();
        for (String field : fields) {
            JsonNode array = node.path(field);
            if (array.isArray()) {
                array.forEach(element -> {
                    String value = text(element);
                    if (!value.isBlank()) {
                        values.add(value);
                    }
                });
                if (!values.isEmpty()) {
                    break;
                }
            }
        }
        return values;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String sha256(byte[] payload) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
