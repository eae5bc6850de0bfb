package com.finfact.pipeline.artifact;

import com.finfact.pipeline.grid.GridNormalizer;
import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.grid.TextFragment;
import com.finfact.pipeline.support.NumericValueParser;
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
public class PositionalTextArtifactReader implements EngineArtifactReader {

    static final int MAX_HEADER_LINES = 3;
    private static final int MIN_BLOCK_ROWS = 2;
    private static final int MAX_LABEL_LENGTH = 60;
    private static final Pattern UNIT_LINE = Pattern.compile("(编制单位|单位|币种)\\s*[:：]");
    private static final Pattern FRAGMENT = Pattern.compile("\\S+(?: \\S+)*");
    private static final Pattern TRAILING_NUMBER = Pattern.compile(
        "(?:^|\\s)([(（]?[-−－]?(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d+)?[)）]?%?|[-—–])$"
    );

    private final GridNormalizer gridNormalizer;

    public PositionalTextArtifactReader(GridNormalizer gridNormalizer) {
        this.gridNormalizer = gridNormalizer;
    }

    @Override
    public boolean supports(Path artifact) {
        return artifact.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt");
    }

    @Override
    public List<RawTableCandidate> read(String engine, Path artifact) {
        String content;
        try {
            content = Files.readString(artifact, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactReadException("Failed to read text artifact " + artifact, e);
        }
        List<RawTableCandidate> tables = new ArrayList<>();
        String[] pages = content.split("\f");
        for (int i = 0; i < pages.length; i++) {
            tables.addAll(readPage(engine, i + 1, pages[i]));
        }
        return tables;
    }

    List<RawTableCandidate> readPage(String engine, int pageNumber, String pageText) {
        List<String> lines = pageText.replace("\t", "        ").lines().toList();
        List<RawTableCandidate> tables = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            List<TextFragment> first = fragments(0, lines.get(i));
            if (numericCount(first) < 2 || !hasLabel(first)) {
                i++;
                continue;
            }
            int start = i;
            int end = i + 1;
            while (end < lines.size() && isBodyLine(fragments(0, lines.get(end)))) {
                end++;
            }
            if (end - start >= MIN_BLOCK_ROWS) {
                tables.add(toTable(engine, pageNumber, lines, start, end));
            }
            i = end;
        }
        return tables;
    }

    private RawTableCandidate toTable(String engine, int pageNumber, List<String> lines, int start, int end) {
        List<String> headerLines = new ArrayList<>();
        for (int h = start - 1; h >= 0 && headerLines.size() < MAX_HEADER_LINES; h--) {
            String line = lines.get(h);
            List<TextFragment> candidate = fragments(0, line);
            if (line.isBlank() || candidate.size() < 2 || isBodyLine(candidate)) {
                break;
            }
            headerLines.add(0, line);
        }

        List<TextFragment> fragments = new ArrayList<>();
        int lineIndex = 0;
        for (String header : headerLines) {
            fragments.addAll(fragments(lineIndex++, header));
        }
        for (int r = start; r < end; r++) {
            fragments.addAll(fragments(lineIndex++, lines.get(r)));
        }
        LogicalGrid grid = gridNormalizer.normalize(fragments);

        int headerStart = start - headerLines.size();
        String before = String.join("\n", lines.subList(Math.max(0, headerStart - 20), headerStart));
        String after = String.join("\n", lines.subList(end, Math.min(lines.size(), end + 10)));
        String context = before + "\n" + String.join("\n", headerLines) + "\n" + after;
        String title = lastShortLine(before);
        return new RawTableCandidate(engine, pageNumber, title, context, grid);
    }

    /**
     * Splits one line into fragments on runs of two or more spaces, then peels trailing numbers
     * that are separated from the label by a single space.
     */
    static List<TextFragment> fragments(int lineIndex, String line) {
        List<TextFragment> result = new ArrayList<>();
        Matcher matcher = FRAGMENT.matcher(line);
        while (matcher.find()) {
            String text = matcher.group();
            int offset = matcher.start();
            List<TextFragment> peeled = new ArrayList<>();
            Matcher tail = TRAILING_NUMBER.matcher(text);
            while (tail.find() && tail.start(1) > 0) {
                peeled.add(0, new TextFragment(lineIndex, offset + tail.start(1), tail.group(1)));
                text = text.substring(0, tail.start(1)).stripTrailing();
                tail = TRAILING_NUMBER.matcher(text);
            }
            if (!text.isEmpty()) {
                result.add(new TextFragment(lineIndex, offset, text));
            }
            result.addAll(peeled);
        }
        return result;
    }

    private static boolean isBodyLine(List<TextFragment> fragments) {
        return hasLabel(fragments) && numericCount(fragments) >= 1;
    }

    private static boolean hasLabel(List<TextFragment> fragments) {
        if (fragments.isEmpty()) {
            return false;
        }
        String label = fragments.get(0).text();
        return NumericValueParser.parse(label).isEmpty()
            && label.length() <= MAX_LABEL_LENGTH
            && !label.contains("。");
    }

    private static int numericCount(List<TextFragment> fragments) {
        int count = 0;
        for (int f = 1; f < fragments.size(); f++) {
            String text = fragments.get(f).text();
            if (NumericValueParser.parse(text).isPresent() && !NumericValueParser.isYearToken(text)) {
                count++;
            }
        }
        return count;
    }

    private static String lastShortLine(String text) {
        String result = "";
        for (String line : text.split("\\R")) {
            if (!line.isBlank() && line.trim().length() <= MAX_LABEL_LENGTH && !UNIT_LINE.matcher(line.trim()).lookingAt()) {
                result = line.trim();
            }
        }
        return result;
    }
}
