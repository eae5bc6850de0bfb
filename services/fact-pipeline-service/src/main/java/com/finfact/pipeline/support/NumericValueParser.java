package com.finfact.pipeline.support;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses numeric cell text as printed in financial statements.
 *
 * <p>Accepts thousands separators, parenthesis-as-negative ({@code (1,234)} or full-width
 * {@code （1,234）}), explicit negative signs (ASCII, full-width and the unicode minus), a
 * leading currency symbol and a trailing percent sign. Anything else, including a lone dash
 * placeholder, is a parse failure.</p>
 */
public final class NumericValueParser {

    private static final Pattern GROUPED = Pattern.compile("\\d{1,3}(,\\d{3})+(\\.\\d+)?");
    private static final Pattern PLAIN = Pattern.compile("\\d+(\\.\\d+)?|\\.\\d+");
    private static final Pattern YEAR_TOKEN = Pattern.compile("^(19|20)\\d{2}\\s*(年度?|年末|年初)?$");
    private static final String NEGATIVE_SIGNS = "-−－–";

    private NumericValueParser() {
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.replace('\u00A0', ' ').replaceAll("\\s+", "");
        if (text.isEmpty()) {
            return Optional.empty();
        }

        boolean negative = false;
        if ((text.startsWith("(") && text.endsWith(")")) || (text.startsWith("（") && text.endsWith("）"))) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1);
        }
        if (!text.isEmpty() && (text.charAt(0) == '¥' || text.charAt(0) == '$' || text.charAt(0) == '￥')) {
            text = text.substring(1);
        }
        if (!text.isEmpty() && NEGATIVE_SIGNS.indexOf(text.charAt(0)) >= 0) {
            negative = !negative;
            text = text.substring(1);
        } else if (!text.isEmpty() && text.charAt(0) == '+') {
            text = text.substring(1);
        }

        if (GROUPED.matcher(text).matches()) {
            text = text.replace(",", "");
        } else if (!PLAIN.matcher(text).matches()) {
            return Optional.empty();
        }

        BigDecimal value = new BigDecimal(text);
        return Optional.of(negative ? value.negate() : value);
    }

    public static boolean isPercent(String raw) {
        return raw != null && raw.trim().endsWith("%");
    }

    public static boolean isYearToken(String text) {
        return text != null && YEAR_TOKEN.matcher(text.trim()).matches();
    }
}
