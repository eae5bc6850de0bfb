package com.finfact.pipeline.taxonomy;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class LabelNormalizer {

    private static final List<Pattern> PREFIX_NOISE = List.of(
        Pattern.compile("^[一二三四五六七八九十]+\\s*[、.．]\\s*"),
        Pattern.compile("^[(（]\\s*[一二三四五六七八九十0-9]+\\s*[)）]\\s*[、.．]?\\s*"),
        Pattern.compile("^\\d+(\\.\\d+)*\\s*[、.．)）]\\s*"),
        Pattern.compile("^[①②③④⑤⑥⑦⑧⑨⑩⑪⑫⑬⑭⑮⑯⑰⑱⑲⑳]\\s*"),
        Pattern.compile("^(其中|加|减|注)\\s*[:：]\\s*"),
        Pattern.compile("^[a-zA-Z]\\s*[.)]\\s+")
    );
    private static final Pattern FOOTNOTE_PARENTHETICAL = Pattern.compile(
        "[(（][^()（）]*(填列|附注|注释|注\\s*\\d|note|亏损|损失)[^()（）]*[)）]",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TRAILING_NOTE_REF = Pattern.compile("\\s*(附注)?\\s*[一二三四五六七八九十]+\\s*[、.]\\s*\\d+\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u3000]+");
    private static final Pattern PUNCTUATION = Pattern.compile("[：:（）()，,．.。;；、\\-—_\"“”'‘’*#]+");

    private LabelNormalizer() {
    }

    /**
     * Removes numbering markers, enumeration prefixes and parenthetical footnote instructions.
     */
    public static String stripNoise(String rawLabel) {
        if (rawLabel == null) {
            return "";
        }
        String label = rawLabel.replace('\u00A0', ' ').trim();
        label = FOOTNOTE_PARENTHETICAL.matcher(label).replaceAll("");
        label = TRAILING_NOTE_REF.matcher(label).replaceAll("");
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Pattern pattern : PREFIX_NOISE) {
                String stripped = pattern.matcher(label).replaceFirst("");
                if (!stripped.equals(label)) {
                    label = stripped.trim();
                    changed = true;
                }
            }
        }
        return label.trim();
    }

    /**
     * Canonical comparison form: no whitespace, no punctuation, lower case.
     */
    public static String normalize(String label) {
        if (label == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(label).replaceAll("");
        cleaned = PUNCTUATION.matcher(cleaned).replaceAll("");
        return cleaned.toLowerCase(Locale.ROOT);
    }

    public static String clean(String rawLabel) {
        return normalize(stripNoise(rawLabel));
    }
}
