package com.finfact.pipeline.candidate;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record UnitContext(String currency, String unit) {

    private static final Pattern DECLARATION = Pattern.compile("单位\\s*[:：]\\s*([^\\n，,。;；]{1,12})");
    private static final List<Map.Entry<Pattern, String>> UNIT_PATTERNS = List.of(
        Map.entry(Pattern.compile("亿元"), "100m"),
        Map.entry(Pattern.compile("百万元|in millions|millions of"), "1m"),
        Map.entry(Pattern.compile("万元"), "10k"),
        Map.entry(Pattern.compile("千元|in thousands|thousands of"), "1k"),
        Map.entry(Pattern.compile("单位\\s*[:：]?\\s*(人民币)?\\s*元|人民币元|(?<![万千亿百美港日欧])元(?!素)"), "1")
    );
    private static final List<Map.Entry<Pattern, String>> CURRENCY_PATTERNS = List.of(
        Map.entry(Pattern.compile("美元|\\busd\\b|us\\$"), "USD"),
        Map.entry(Pattern.compile("港元|港币|\\bhkd\\b"), "HKD"),
        Map.entry(Pattern.compile("欧元|\\beur\\b"), "EUR"),
        Map.entry(Pattern.compile("人民币|\\brmb\\b|\\bcny\\b"), "CNY")
    );

    public static UnitContext detect(String text, String defaultCurrency, String defaultUnit) {
        return new UnitContext(
            detectCurrency(text).orElse(defaultCurrency),
            detectUnit(text).orElse(defaultUnit)
        );
    }

    public static Optional<String> detectUnit(String text) {
        return declared(text).flatMap(declaration -> firstMatch(UNIT_PATTERNS, declaration))
            .or(() -> firstMatch(UNIT_PATTERNS, text));
    }

    public static Optional<String> detectCurrency(String text) {
        return declared(text).flatMap(declaration -> firstMatch(CURRENCY_PATTERNS, declaration))
            .or(() -> firstMatch(CURRENCY_PATTERNS, text));
    }

    // an explicit "单位：..." declaration beats unit words elsewhere in the context
    private static Optional<String> declared(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = DECLARATION.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<String> firstMatch(List<Map.Entry<Pattern, String>> patterns, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> entry : patterns) {
            if (entry.getKey().matcher(lowered).find()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
