package com.finfact.pipeline.grid;

public record SpanCell(String text, int rowSpan, int colSpan, boolean header) {

    public SpanCell {
        text = text == null ? "" : text;
        rowSpan = Math.max(1, rowSpan);
        colSpan = Math.max(1, colSpan);
    }

    public static SpanCell of(String text) {
        return new SpanCell(text, 1, 1, false);
    }

    public static SpanCell spanning(String text, int rowSpan, int colSpan) {
        return new SpanCell(text, rowSpan, colSpan, false);
    }
}
