package com.finfact.pipeline.grid;

import java.util.List;

public record CellMatrix(List<List<SpanCell>> rows, int declaredHeaderRows) {

    public CellMatrix {
        rows = rows == null ? List.of() : List.copyOf(rows.stream().map(List::copyOf).toList());
    }

    public static CellMatrix of(List<List<SpanCell>> rows) {
        return new CellMatrix(rows, -1);
    }
}
