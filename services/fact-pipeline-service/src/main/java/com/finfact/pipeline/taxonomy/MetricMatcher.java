package com.finfact.pipeline.taxonomy;

import com.finfact.pipeline.config.PipelineProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps a row label onto a canonical metric of a {@link MetricDictionary} snapshot.
 *
 * <p>Order of attempts: exact match on the cleaned label; then, only for labels longer than the
 * dictionary's short-label threshold, a prefix/suffix match whose leftover text stays within
 * {@code maxAffixResidue} characters. There is no free substring matching: {@code 营业收入} must
 * not absorb {@code 其他业务收入占营业收入比重}.</p>
 */
@Component
public class MetricMatcher {

    private static final String RAW_PREFIX = "raw_";

    private final int maxAffixResidue;

    public MetricMatcher(PipelineProperties properties) {
        this.maxAffixResidue = Math.max(0, properties.getMatching().getMaxAffixResidue());
    }

    public MatchResult match(MetricDictionary dictionary, MatchRequest request) {
        String normalized = LabelNormalizer.clean(request.label());
        Optional<StatementType> routed = dictionary.backgroundRule(request.backgroundRuleCode());
        StatementType fallbackType = routed.orElse(request.tableStatementType());

        if (normalized.isEmpty() || dictionary.isStopLabel(normalized)) {
            return unmatched(normalized, fallbackType);
        }

        boolean ratioLabel = request.label().contains("率") || request.label().contains("%");
        List<StatementType> order = typeOrder(routed.orElse(null), request.tableStatementType());

        List<MetricDefinition> exact = dictionary.exactMatches(normalized);
        for (StatementType type : order) {
            for (MetricDefinition metric : exact) {
                if (metric.statementType() == type && ratioCompatible(metric, ratioLabel)) {
                    return new MatchResult(metric.code(), metric, type, MatchMethod.EXACT, normalized);
                }
            }
        }

        if (normalized.length() <= dictionary.shortLabelMaxLength()) {
            return unmatched(normalized, fallbackType);
        }

        for (StatementType type : order) {
            for (MetricDictionary.AffixPattern pattern : dictionary.affixPatterns()) {
                MetricDefinition metric = pattern.metric();
                if (metric.statementType() != type || !ratioCompatible(metric, ratioLabel)) {
                    continue;
                }
                if (affixMatches(normalized, pattern.pattern())) {
                    return new MatchResult(metric.code(), metric, type, MatchMethod.AFFIX, normalized);
                }
            }
        }
        return unmatched(normalized, fallbackType);
    }

    private boolean affixMatches(String label, String pattern) {
        if (label.length() - pattern.length() > maxAffixResidue) {
            return false;
        }
        return label.startsWith(pattern) || label.endsWith(pattern);
    }

    private static boolean ratioCompatible(MetricDefinition metric, boolean ratioLabel) {
        return !ratioLabel || metric.valueNature() == ValueNature.RATIO;
    }

    private static List<StatementType> typeOrder(StatementType routed, StatementType tableType) {
        if (routed != null) {
            return List.of(routed);
        }
        List<StatementType> order = new ArrayList<>();
        if (tableType != null) {
            order.add(tableType);
        }
        Arrays.stream(StatementType.values()).filter(type -> type != tableType).forEach(order::add);
        return order;
    }

    private static MatchResult unmatched(String normalized, StatementType statementType) {
        return new MatchResult(rawCode(normalized, statementType), null, statementType, MatchMethod.NONE, normalized);
    }

    /**
     * Stable surrogate code for a label the taxonomy does not cover.
     */
    public static String rawCode(String normalizedLabel, StatementType statementType) {
        String typeCode = statementType == null ? "unknown" : statementType.code();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest((typeCode + ":" + normalizedLabel).getBytes(StandardCharsets.UTF_8));
            return RAW_PREFIX + HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public static boolean isRawCode(String metricCode) {
        return metricCode != null && metricCode.startsWith(RAW_PREFIX);
    }
}
