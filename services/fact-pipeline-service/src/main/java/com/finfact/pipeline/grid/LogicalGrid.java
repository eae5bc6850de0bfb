package com.finfact.pipeline.grid;

import java.util.List;

public record LogicalGrid(List<String> columnLabels, List<List<String>> rows, int headerRowCount) {

    public LogicalGrid {
        columnLabels = List.copyOf(columnLabels);
        rows = List.copyOf(rows.stream().map(List::copyOf).toList());
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnLabels.size();
    }

    public String cell(int row, int column) {
        return rows.get(row).get(column);
    }

    public List<List<String>> dataRows() {
        return rows.subList(Math.min(headerRowCount, rows.size()), rows.size());
    }

    public String columnLabel(int column) {
        return columnLabels.get(column);
    }

    public static boolean isPositionalLabel(String label) {
        return label != null && label.matches("col_\\d+");
    }
}
