package com.finfact.pipeline.taxonomy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time snapshot of the metric taxonomy.
 *
 * <p>Built once per pipeline run and passed explicitly to every stage that needs it, so
 * concurrent runs may hold different dictionary versions. Load-time rules are applied here:
 * stop-list patterns are removed, patterns at or below the short-label threshold are moved to
 * the exact-only bucket, and short patterns on the deny list are dropped entirely.</p>
 */
public final class MetricDictionary {

    private final String version;
    private final String contentHash;
    private final int shortLabelMaxLength;
    private final List<MetricDefinition> metrics;
    private final Map<String, MetricDefinition> byCode;
    private final Map<String, List<MetricDefinition>> exactIndex;
    private final List<AffixPattern> affixPatterns;
    private final Set<String> stopLabels;
    private final Map<String, StatementType> backgroundRules;

    private MetricDictionary(
        String version,
        String contentHash,
        int shortLabelMaxLength,
        List<MetricDefinition> metrics,
        Map<String, List<MetricDefinition>> exactIndex,
        List<AffixPattern> affixPatterns,
        Set<String> stopLabels,
        Map<String, StatementType> backgroundRules
    ) {
        this.version = version;
        this.contentHash = contentHash;
        this.shortLabelMaxLength = shortLabelMaxLength;
        this.metrics = List.copyOf(metrics);
        Map<String, MetricDefinition> codes = new LinkedHashMap<>();
        metrics.forEach(metric -> codes.put(metric.code(), metric));
        this.byCode = Map.copyOf(codes);
        Map<String, List<MetricDefinition>> exact = new LinkedHashMap<>();
        exactIndex.forEach((key, value) -> exact.put(key, List.copyOf(value)));
        this.exactIndex = Map.copyOf(exact);
        this.affixPatterns = List.copyOf(affixPatterns);
        this.stopLabels = Set.copyOf(stopLabels);
        this.backgroundRules = Map.copyOf(backgroundRules);
    }

    public static MetricDictionary build(
        String version,
        String contentHash,
        int shortLabelMaxLength,
        List<MetricDefinition> metrics,
        Collection<String> stopLabels,
        Collection<String> shortLabelDenylist,
        Map<String, StatementType> backgroundRules
    ) {
        Set<String> stop = normalizedSet(stopLabels);
        Set<String> deny = normalizedSet(shortLabelDenylist);

        Map<String, List<MetricDefinition>> exact = new LinkedHashMap<>();
        List<AffixPattern> affix = new ArrayList<>();
        for (MetricDefinition metric : metrics) {
            Set<String> exactForms = new LinkedHashSet<>();
            Set<String> affixForms = new LinkedHashSet<>();

            List<String> names = new ArrayList<>(metric.patterns());
            if (metric.nameCn() != null) {
                names.add(metric.nameCn());
            }
            if (metric.nameEn() != null) {
                names.add(metric.nameEn());
            }
            for (String pattern : names) {
                String norm = LabelNormalizer.normalize(pattern);
                if (norm.isEmpty() || stop.contains(norm)) {
                    continue;
                }
                if (norm.length() <= shortLabelMaxLength) {
                    if (!deny.contains(norm)) {
                        exactForms.add(norm);
                    }
                    continue;
                }
                exactForms.add(norm);
                affixForms.add(norm);
            }
            for (String pattern : metric.exactPatterns()) {
                String norm = LabelNormalizer.normalize(pattern);
                if (!norm.isEmpty() && !stop.contains(norm) && !deny.contains(norm)) {
                    exactForms.add(norm);
                }
            }

            exactForms.forEach(form -> exact.computeIfAbsent(form, ignored -> new ArrayList<>()).add(metric));
            affixForms.forEach(form -> affix.add(new AffixPattern(form, metric)));
        }
        affix.sort(Comparator.comparingInt((AffixPattern p) -> p.pattern().length()).reversed());

        Map<String, StatementType> rules = new LinkedHashMap<>();
        backgroundRules.forEach((code, type) -> rules.put(code.trim().toLowerCase(Locale.ROOT), type));
        return new MetricDictionary(version, contentHash, shortLabelMaxLength, metrics, exact, affix, stop, rules);
    }

    private static Set<String> normalizedSet(Collection<String> labels) {
        Set<String> result = new HashSet<>();
        if (labels != null) {
            labels.stream().map(LabelNormalizer::normalize).filter(s -> !s.isEmpty()).forEach(result::add);
        }
        return result;
    }

    public String version() {
        return version;
    }

    public String contentHash() {
        return contentHash;
    }

    public int shortLabelMaxLength() {
        return shortLabelMaxLength;
    }

    public List<MetricDefinition> metrics() {
        return metrics;
    }

    public Optional<MetricDefinition> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public List<MetricDefinition> exactMatches(String normalizedLabel) {
        return exactIndex.getOrDefault(normalizedLabel, List.of());
    }

    public List<AffixPattern> affixPatterns() {
        return affixPatterns;
    }

    public boolean isStopLabel(String normalizedLabel) {
        return stopLabels.contains(normalizedLabel);
    }

    public Optional<StatementType> backgroundRule(String ruleCode) {
        if (ruleCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(backgroundRules.get(ruleCode.trim().toLowerCase(Locale.ROOT)));
    }

    public record AffixPattern(String pattern, MetricDefinition metric) {
    }
}
