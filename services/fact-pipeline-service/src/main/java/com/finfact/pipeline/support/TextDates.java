package com.finfact.pipeline.support;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextDates {

    private static final Pattern DATE = Pattern.compile("((?:19|20)\\d{2})\\s*[年\\-/.]\\s*(\\d{1,2})\\s*[月\\-/.]\\s*(\\d{1,2})");
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

    private TextDates() {
    }

    public static Optional<LocalDate> firstDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = DATE.matcher(text);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int day = Integer.parseInt(matcher.group(3));
            if (month >= 1 && month <= 12 && YearMonth.of(year, month).isValidDay(day)) {
                return Optional.of(LocalDate.of(year, month, day));
            }
        }
        return Optional.empty();
    }

    public static Optional<Integer> firstYear(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = YEAR.matcher(text);
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(1))) : Optional.empty();
    }
}
