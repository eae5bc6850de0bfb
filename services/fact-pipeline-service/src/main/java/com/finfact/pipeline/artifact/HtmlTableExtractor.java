package com.finfact.pipeline.artifact;

import com.finfact.pipeline.grid.CellMatrix;
import com.finfact.pipeline.grid.GridNormalizer;
import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.grid.SpanCell;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

@Component
public class HtmlTableExtractor {

    static final int CONTEXT_BEFORE = 1200;
    static final int CONTEXT_AFTER = 800;

    private static final Pattern TABLE = Pattern.compile("<table\\b.*?</table>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final int MAX_TITLE_LENGTH = 60;

    private final GridNormalizer gridNormalizer;

    public HtmlTableExtractor(GridNormalizer gridNormalizer) {
        this.gridNormalizer = gridNormalizer;
    }

    public List<RawTableCandidate> extract(String engine, int pageNumber, String pageText) {
        List<RawTableCandidate> tables = new ArrayList<>();
        if (pageText == null || !pageText.toLowerCase(Locale.ROOT).contains("<table")) {
            return tables;
        }
        Matcher matcher = TABLE.matcher(pageText);
        while (matcher.find()) {
            String before = pageText.substring(Math.max(0, matcher.start() - CONTEXT_BEFORE), matcher.start());
            String after = pageText.substring(matcher.end(), Math.min(pageText.length(), matcher.end() + CONTEXT_AFTER));
            CellMatrix matrix = toMatrix(matcher.group());
            if (matrix.rows().isEmpty()) {
                continue;
            }
            LogicalGrid grid = gridNormalizer.normalize(matrix);
            if (grid.rowCount() == 0) {
                continue;
            }
            tables.add(new RawTableCandidate(
                engine,
                pageNumber,
                lastHeading(before),
                stripTags(before) + "\n" + stripTags(after),
                grid
            ));
        }
        return tables;
    }

    CellMatrix toMatrix(String tableHtml) {
        Element table = Jsoup.parseBodyFragment(tableHtml).selectFirst("table");
        if (table == null) {
            return CellMatrix.of(List.of());
        }
        List<List<SpanCell>> rows = new ArrayList<>();
        int headerRows = 0;
        boolean inHeader = true;
        for (Element tr : table.select("tr")) {
            if (owningTable(tr) != table) {
                continue;
            }
            List<SpanCell> cells = new ArrayList<>();
            boolean allTh = true;
            for (Element cell : tr.children()) {
                String tag = cell.normalName();
                if (!tag.equals("td") && !tag.equals("th")) {
                    continue;
                }
                boolean th = tag.equals("th");
                allTh &= th;
                cells.add(new SpanCell(cell.text(), span(cell.attr("rowspan")), span(cell.attr("colspan")), th));
            }
            if (cells.isEmpty()) {
                continue;
            }
            boolean headerRow = allTh || (tr.parent() != null && tr.parent().normalName().equals("thead"));
            if (inHeader && headerRow) {
                headerRows++;
            } else {
                inHeader = false;
            }
            rows.add(cells);
        }
        return new CellMatrix(rows, headerRows > 0 ? headerRows : -1);
    }

    private static int span(String value) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        String digits = value.replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 4) {
            return 1;
        }
        return Math.max(1, Integer.parseInt(digits));
    }

    static String lastHeading(String before) {
        String heading = "";
        String shortLine = "";
        for (String rawLine : before.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("<") || line.contains("</")) {
                continue;
            }
            if (line.startsWith("#")) {
                heading = line.replaceFirst("^#+\\s*", "").trim();
            } else if (line.length() <= MAX_TITLE_LENGTH) {
                shortLine = line;
            }
        }
        return heading.isEmpty() ? shortLine : heading;
    }

    private static Element owningTable(Element row) {
        Element parent = row.parent();
        while (parent != null && !parent.normalName().equals("table")) {
            parent = parent.parent();
        }
        return parent;
    }

    private static String stripTags(String text) {
        return TAG.matcher(text).replaceAll(" ").replaceAll("[ \\t]{2,}", " ").trim();
    }
}
