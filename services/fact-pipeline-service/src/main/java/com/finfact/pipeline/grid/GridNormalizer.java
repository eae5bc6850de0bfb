package com.finfact.pipeline.grid;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.support.NumericValueParser;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Turns one engine's raw table output into a {@link LogicalGrid}.
 *
 * <p>Merged cells are copied into every position they span. Leading header rows are merged
 * top-down into one label per column; columns without any header text fall back to
 * {@code col_<n>}. Irregular input degrades to positional labels instead of failing.</p>
 */
@Component
public class GridNormalizer {

    static final String LABEL_SEPARATOR = "/";
    private static final int MAX_SPAN = 500;
    private static final List<String> HEADER_KEYWORDS = List.of(
        "项目", "期末", "期初", "本期", "上期", "本年", "上年", "年末", "年初", "附注", "金额",
        "current", "prior", "note"
    );

    private final int columnOffsetTolerance;
    private final int maxHeaderRows;

    public GridNormalizer(PipelineProperties properties) {
        this.columnOffsetTolerance = Math.max(0, properties.getGrid().getColumnOffsetTolerance());
        this.maxHeaderRows = Math.max(0, properties.getGrid().getMaxHeaderRows());
    }

    public LogicalGrid normalize(CellMatrix matrix) {
        List<List<String>> expanded = new ArrayList<>();
        int width = 0;
        for (int r = 0; r < matrix.rows().size(); r++) {
            ensureRow(expanded, r);
            int c = 0;
            for (SpanCell cell : matrix.rows().get(r)) {
                while (c < expanded.get(r).size() && expanded.get(r).get(c) != null) {
                    c++;
                }
                String text = clean(cell.text());
                int rowSpan = Math.min(cell.rowSpan(), MAX_SPAN);
                int colSpan = Math.min(cell.colSpan(), MAX_SPAN);
                for (int dr = 0; dr < rowSpan; dr++) {
                    ensureRow(expanded, r + dr);
                    List<String> target = expanded.get(r + dr);
                    for (int dc = 0; dc < colSpan; dc++) {
                        while (target.size() <= c + dc) {
                            target.add(null);
                        }
                        target.set(c + dc, text);
                    }
                }
                c += colSpan;
                width = Math.max(width, c);
            }
        }
        for (List<String> row : expanded) {
            width = Math.max(width, row.size());
        }

        List<List<String>> rectangular = pad(expanded, width);
        int headerRows = matrix.declaredHeaderRows() >= 0
            ? Math.min(matrix.declaredHeaderRows(), rectangular.size())
            : inferHeaderRows(rectangular);
        return assemble(rectangular, headerRows, width);
    }

    public LogicalGrid normalize(List<TextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return new LogicalGrid(List.of(), List.of(), 0);
        }
        List<Integer> anchors = columnAnchors(fragments);
        int width = anchors.size();

        Map<Integer, List<String>> byLine = new TreeMap<>();
        fragments.stream()
            .sorted(Comparator.comparingInt(TextFragment::line).thenComparingInt(TextFragment::offset))
            .forEach(fragment -> {
                List<String> row = byLine.computeIfAbsent(fragment.line(), ignored -> blankRow(width));
                int column = nearestAnchor(anchors, fragment.offset());
                String existing = row.get(column);
                String text = clean(fragment.text());
                row.set(column, existing.isEmpty() ? text : existing + " " + text);
            });

        List<List<String>> rows = new ArrayList<>(byLine.values());
        return assemble(rows, inferHeaderRows(rows), width);
    }

    private LogicalGrid assemble(List<List<String>> rows, int headerRows, int width) {
        List<List<String>> kept = new ArrayList<>();
        int keptHeaderRows = 0;
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.stream().allMatch(String::isBlank)) {
                continue;
            }
            kept.add(row);
            if (r < headerRows) {
                keptHeaderRows++;
            }
        }

        List<String> labels = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<String> parts = new ArrayList<>();
            for (int r = 0; r < keptHeaderRows; r++) {
                String text = kept.get(r).get(c);
                if (!text.isBlank() && (parts.isEmpty() || !parts.get(parts.size() - 1).equals(text))) {
                    parts.add(text);
                }
            }
            labels.add(parts.isEmpty() ? "col_" + c : String.join(LABEL_SEPARATOR, parts));
        }
        return new LogicalGrid(labels, kept, keptHeaderRows);
    }

    int inferHeaderRows(List<List<String>> rows) {
        int headers = 0;
        for (List<String> row : rows) {
            if (headers >= maxHeaderRows || !looksLikeHeader(row)) {
                break;
            }
            headers++;
        }
        return headers;
    }

    private boolean looksLikeHeader(List<String> row) {
        if (row.size() < 2) {
            return false;
        }
        List<String> values = row.subList(1, row.size());
        String joined = String.join(" ", row).toLowerCase(Locale.ROOT);
        if (values.stream().allMatch(String::isBlank)) {
            return !row.get(0).isBlank() && HEADER_KEYWORDS.stream().anyMatch(joined::contains);
        }
        boolean anyValue = false;
        for (String value : values) {
            if (value.isBlank()) {
                continue;
            }
            if (NumericValueParser.parse(value).isPresent() && !NumericValueParser.isYearToken(value)) {
                anyValue = true;
            }
        }
        return !anyValue;
    }

    private List<Integer> columnAnchors(List<TextFragment> fragments) {
        List<Integer> offsets = fragments.stream().map(TextFragment::offset).distinct().sorted().toList();
        List<Integer> anchors = new ArrayList<>();
        int clusterEnd = Integer.MIN_VALUE;
        for (int offset : offsets) {
            if (anchors.isEmpty() || offset - clusterEnd > columnOffsetTolerance) {
                anchors.add(offset);
            }
            clusterEnd = offset;
        }
        return anchors;
    }

    private int nearestAnchor(List<Integer> anchors, int offset) {
        int best = 0;
        for (int i = 0; i < anchors.size(); i++) {
            if (anchors.get(i) <= offset) {
                best = i;
            }
        }
        return best;
    }

    private static void ensureRow(List<List<String>> rows, int index) {
        while (rows.size() <= index) {
            rows.add(new ArrayList<>());
        }
    }

    private static List<List<String>> pad(List<List<String>> rows, int width) {
        List<List<String>> result = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> padded = blankRow(width);
            for (int c = 0; c < row.size(); c++) {
                if (row.get(c) != null) {
                    padded.set(c, row.get(c));
                }
            }
            result.add(padded);
        }
        return result;
    }

    private static List<String> blankRow(int width) {
        List<String> row = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            row.add("");
        }
        return row;
    }

    private static String clean(String text) {
        return text == null ? "" : text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }
}
