package com.finfact.pipeline.artifact;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class HtmlPageArtifactReader implements EngineArtifactReader {

    private static final Pattern PAGE_IN_NAME = Pattern.compile("(?:page|p)[_-]?(\\d{1,4})(?!.*\\d)", Pattern.CASE_INSENSITIVE);

    private final HtmlTableExtractor htmlTableExtractor;

    public HtmlPageArtifactReader(HtmlTableExtractor htmlTableExtractor) {
        this.htmlTableExtractor = htmlTableExtractor;
    }

    @Override
    public boolean supports(Path artifact) {
        String name = artifact.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".html") || name.endsWith(".htm");
    }

    @Override
    public List<RawTableCandidate> read(String engine, Path artifact) {
        String content;
        try {
            content = Files.readString(artifact, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactReadException("Failed to read page artifact " + artifact, e);
        }

        List<RawTableCandidate> tables = new ArrayList<>();
        String[] pages = content.split("\f");
        if (pages.length > 1) {
            for (int i = 0; i < pages.length; i++) {
                tables.addAll(htmlTableExtractor.extract(engine, i + 1, pages[i]));
            }
            return tables;
        }
        tables.addAll(htmlTableExtractor.extract(engine, pageFromName(artifact), content));
        return tables;
    }

    static int pageFromName(Path artifact) {
        Matcher matcher = PAGE_IN_NAME.matcher(artifact.getFileName().toString());
        return matcher.find() ? Math.max(1, Integer.parseInt(matcher.group(1))) : 1;
    }
}
