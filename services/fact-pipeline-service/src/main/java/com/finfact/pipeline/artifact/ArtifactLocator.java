package com.finfact.pipeline.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Discovers the artifacts an engine left in its output directory.
 *
 * <p>An explicit {@code manifest.json} ({@code {"artifacts": ["a.md", ...]}}) wins. Otherwise
 * the richest available format is used: content lists, then markdown/HTML pages, then
 * positional text dumps. The fallback directory is searched only when the primary one yields
 * nothing.</p>
 */
@Component
public class ArtifactLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactLocator.class);
    static final String MANIFEST = "manifest.json";

    private static final List<Predicate<String>> FORMAT_PREFERENCE = List.of(
        name -> name.endsWith("_content_list.json"),
        name -> name.endsWith(".md") || name.endsWith(".html") || name.endsWith(".htm"),
        name -> name.endsWith(".txt")
    );

    private final ObjectMapper objectMapper;

    public ArtifactLocator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Path> locate(Path outputDir, Path fallbackDir) {
        List<Path> found = locate(outputDir);
        if (found.isEmpty() && fallbackDir != null && !fallbackDir.equals(outputDir)) {
            found = locate(fallbackDir);
            if (!found.isEmpty()) {
                LOGGER.info("Using {} artifacts from fallback directory {}", found.size(), fallbackDir);
            }
        }
        return found;
    }

    public List<Path> locate(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        Path manifest = directory.resolve(MANIFEST);
        if (Files.isRegularFile(manifest)) {
            return fromManifest(directory, manifest);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new ArtifactReadException("Failed to scan artifact directory " + directory, e);
        }
        for (Predicate<String> format : FORMAT_PREFERENCE) {
            List<Path> matching = files.stream()
                .filter(path -> format.test(path.getFileName().toString().toLowerCase(Locale.ROOT)))
                .toList();
            if (!matching.isEmpty()) {
                return matching;
            }
        }
        return List.of();
    }

    private List<Path> fromManifest(Path directory, Path manifest) {
        JsonNode root;
        try {
            root = objectMapper.readTree(manifest.toFile());
        } catch (IOException e) {
            throw new ArtifactReadException("Failed to read artifact manifest " + manifest, e);
        }
        List<Path> paths = new ArrayList<>();
        for (JsonNode entry : root.path("artifacts")) {
            String value = entry.asText("").trim();
            if (value.isEmpty()) {
                continue;
            }
            Path path = directory.resolve(value).normalize();
            if (Files.isRegularFile(path)) {
                paths.add(path);
            } else {
                LOGGER.warn("Manifest {} lists missing artifact {}", manifest, value);
            }
        }
        return paths;
    }
}
