package com.finfact.pipeline.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class ContentListArtifactReader implements EngineArtifactReader {

    private final ObjectMapper objectMapper;
    private final HtmlTableExtractor htmlTableExtractor;

    public ContentListArtifactReader(ObjectMapper objectMapper, HtmlTableExtractor htmlTableExtractor) {
        this.objectMapper = objectMapper;
        this.htmlTableExtractor = htmlTableExtractor;
    }

    @Override
    public boolean supports(Path artifact) {
        return artifact.getFileName().toString().toLowerCase(Locale.ROOT).endsWith("_content_list.json");
    }

    @Override
    public List<RawTableCandidate> read(String engine, Path artifact) {
        JsonNode items;
        try {
            items = objectMapper.readTree(artifact.toFile());
        } catch (IOException e) {
            throw new ArtifactReadException("Failed to read content list " + artifact, e);
        }
        if (items == null || !items.isArray()) {
            return List.of();
        }

        Map<Integer, List<String>> pages = new TreeMap<>();
        for (JsonNode item : items) {
            JsonNode pageIdx = item.get("page_idx");
            if (pageIdx == null || !pageIdx.canConvertToInt()) {
                continue;
            }
            List<String> parts = pages.computeIfAbsent(pageIdx.asInt() + 1, ignored -> new ArrayList<>());
            String type = text(item.get("type")).toLowerCase(Locale.ROOT);
            if (type.equals("text")) {
                String text = text(item.get("text"));
                if (text.isEmpty()) {
                    continue;
                }
                int level = item.path("text_level").asInt(0);
                parts.add(level > 0 ? "#".repeat(Math.min(level, 6)) + " " + text : text);
            } else if (type.equals("table")) {
                captions(item.get("table_caption")).forEach(caption -> parts.add("### " + caption));
                String body = text(item.get("table_body"));
                if (!body.isEmpty()) {
                    parts.add(body);
                }
                parts.addAll(captions(item.get("table_footnote")));
            }
        }

        List<RawTableCandidate> tables = new ArrayList<>();
        pages.forEach((page, parts) -> tables.addAll(htmlTableExtractor.extract(engine, page, String.join("\n\n", parts))));
        return tables;
    }

    private List<String> captions(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(element -> {
                String value = text(element);
                if (!value.isEmpty()) {
                    values.add(value);
                }
            });
        } else if (!text(node).isEmpty()) {
            values.add(text(node));
        }
        return values;
    }

    private String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }
}
