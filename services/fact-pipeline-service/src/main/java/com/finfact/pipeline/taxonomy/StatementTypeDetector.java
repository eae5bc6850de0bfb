package com.finfact.pipeline.taxonomy;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class StatementTypeDetector {

    private static final Pattern RULE_CODE = Pattern.compile("[\\[【]\\s*([0-9]{6}[a-z]?)\\s*[\\]】]", Pattern.CASE_INSENSITIVE);
    private static final Map<StatementType, List<String>> KEYWORDS = Map.of(
        StatementType.BALANCE, List.of("资产负债表", "balance sheet", "statement of financial position"),
        StatementType.INCOME, List.of("利润表", "损益表", "income statement", "statement of profit", "statement of operations"),
        StatementType.CASH_FLOW, List.of("现金流量表", "cash flow"),
        StatementType.EQUITY_CHANGES, List.of("所有者权益变动表", "股东权益变动表", "changes in equity")
    );
    private static final List<StatementType> KEYWORD_ORDER = List.of(
        StatementType.EQUITY_CHANGES, StatementType.CASH_FLOW, StatementType.BALANCE, StatementType.INCOME
    );

    private final MetricMatcher metricMatcher;

    public StatementTypeDetector(MetricMatcher metricMatcher) {
        this.metricMatcher = metricMatcher;
    }

    public Optional<StatementType> fromText(MetricDictionary dictionary, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (StatementType type : KEYWORD_ORDER) {
            if (KEYWORDS.get(type).stream().anyMatch(lowered::contains)) {
                return Optional.of(type);
            }
        }
        return ruleCode(text).flatMap(dictionary::backgroundRule);
    }

    public Optional<String> ruleCode(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = RULE_CODE.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1).toLowerCase(Locale.ROOT);
        }
        return Optional.ofNullable(last);
    }

    public Optional<StatementType> dominantType(MetricDictionary dictionary, List<String> rowLabels) {
        Map<StatementType, Integer> scores = new EnumMap<>(StatementType.class);
        for (String label : rowLabels) {
            MatchResult result = metricMatcher.match(dictionary, MatchRequest.of(label, null));
            if (result.isMatched()) {
                scores.merge(result.statementType(), 1, Integer::sum);
            }
        }
        return scores.entrySet().stream()
            .max(Map.Entry.<StatementType, Integer>comparingByValue()
                .thenComparing(entry -> -entry.getKey().ordinal()))
            .map(Map.Entry::getKey);
    }
}
