package com.example.conservation.etl.reader;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches labels case-insensitively, ignoring runs of whitespace, and takes the value nearest
 * to the label on the same page: the last number after the label on its own line (the current-year
 * column), otherwise the last number on the following non-blank line.
 */
public class LabelProximityStrategy implements FilingLabelStrategy {

    private static final Pattern NUMBER = Pattern.compile(
            "(?<!\\S)(\\((?:\\$\\s?)?\\d[\\d,]*(?:\\.\\d*)?\\)|-?(?:\\$\\s?)?\\d[\\d,]*(?:\\.\\d*)?)(?!\\S)");

    /** A continuation line holding only amounts, as when a value wraps below its label. */
    private static final Pattern VALUES_ONLY = Pattern.compile("[\\s\\d,.$()\\-]+");

    @Override
    public Optional<String> findNumber(FilingDocument document, List<String> labels) {
        for (String label : labels) {
            Pattern labelPattern = labelPattern(label);
            for (String page : document.getPages()) {
                String[] lines = page.split("\\R");
                for (int i = 0; i < lines.length; i++) {
                    Matcher m = labelPattern.matcher(lines[i]);
                    if (!m.find()) {
                        continue;
                    }
                    Optional<String> value = lastNumber(lines[i].substring(m.end()));
                    if (value.isEmpty()) {
                        value = nextNonBlank(lines, i)
                                .filter(next -> VALUES_ONLY.matcher(next).matches())
                                .flatMap(LabelProximityStrategy::lastNumber);
                    }
                    if (value.isPresent()) {
                        return value;
                    }
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> findText(FilingDocument document, List<String> labels) {
        for (String label : labels) {
            Pattern labelPattern = labelPattern(label);
            for (String page : document.getPages()) {
                String[] lines = page.split("\\R");
                for (int i = 0; i < lines.length; i++) {
                    Matcher m = labelPattern.matcher(lines[i]);
                    if (!m.find()) {
                        continue;
                    }
                    String rest = lines[i].substring(m.end()).replaceFirst("^[\\s:.\\-]+", "").trim();
                    if (!rest.isEmpty()) {
                        return Optional.of(rest);
                    }
                    Optional<String> next = nextNonBlank(lines, i).map(String::trim);
                    if (next.isPresent()) {
                        return next;
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static Pattern labelPattern(String label) {
        String[] words = label.trim().toLowerCase(Locale.ROOT).split("\\s+");
        StringBuilder regex = new StringBuilder();
        for (String word : words) {
            if (regex.length() > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(word));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static Optional<String> lastNumber(String text) {
        Matcher m = NUMBER.matcher(text);
        String last = null;
        while (m.find()) {
            last = m.group(1);
        }
        return Optional.ofNullable(last);
    }

    private static Optional<String> nextNonBlank(String[] lines, int from) {
        for (int j = from + 1; j < lines.length; j++) {
            if (!lines[j].isBlank()) {
                return Optional.of(lines[j]);
            }
        }
        return Optional.empty();
    }
}
