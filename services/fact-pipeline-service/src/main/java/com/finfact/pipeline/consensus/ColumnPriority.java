package com.finfact.pipeline.consensus;

import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.support.TextDates;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders column labels by how likely they hold the current period: an explicit current-period
 * label first, then years (latest first), then positional columns (leftmost first), then
 * anything unrecognised, and explicit prior-period labels last.
 */
public class ColumnPriority {

    private static final int CURRENT = 4;
    private static final int YEAR = 3;
    private static final int POSITIONAL = 2;
    private static final int UNKNOWN = 1;
    private static final int PRIOR = 0;

    private final Set<String> currentLabels;
    private final Set<String> priorLabels;

    public ColumnPriority(List<String> currentLabels, List<String> priorLabels) {
        this.currentLabels = normalize(currentLabels);
        this.priorLabels = normalize(priorLabels);
    }

    public Rank rank(String columnLabel) {
        if (columnLabel == null || columnLabel.isBlank()) {
            return new Rank(UNKNOWN, 0);
        }
        String[] segments = columnLabel.split("/");
        for (String segment : segments) {
            if (currentLabels.contains(segment.trim().toLowerCase(Locale.ROOT))) {
                return new Rank(CURRENT, 0);
            }
        }
        for (String segment : segments) {
            if (priorLabels.contains(segment.trim().toLowerCase(Locale.ROOT))) {
                return new Rank(PRIOR, 0);
            }
        }
        Optional<Integer> year = TextDates.firstYear(columnLabel);
        if (year.isPresent()) {
            return new Rank(YEAR, year.get());
        }
        if (LogicalGrid.isPositionalLabel(columnLabel)) {
            return new Rank(POSITIONAL, -Integer.parseInt(columnLabel.substring("col_".length())));
        }
        return new Rank(UNKNOWN, 0);
    }

    /**
     * Highest priority first.
     */
    public Comparator<String> preferred() {
        return Comparator.comparing(this::rank).reversed();
    }

    private static Set<String> normalize(List<String> labels) {
        return labels == null ? Set.of() : labels.stream()
            .map(label -> label.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public record Rank(int tier, int order) implements Comparable<Rank> {

        @Override
        public int compareTo(Rank other) {
            int byTier = Integer.compare(tier, other.tier);
            return byTier != 0 ? byTier : Integer.compare(order, other.order);
        }
    }
}
