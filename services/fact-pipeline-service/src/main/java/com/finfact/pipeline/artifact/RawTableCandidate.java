package com.finfact.pipeline.artifact;

import com.finfact.pipeline.grid.LogicalGrid;

public record RawTableCandidate(String engine, int pageNumber, String title, String context, LogicalGrid grid) {

    public RawTableCandidate {
        title = title == null ? "" : title;
        context = context == null ? "" : context;
    }
}
