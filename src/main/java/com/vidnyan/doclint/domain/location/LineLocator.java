package com.vidnyan.doclint.domain.location;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Best-effort mapping from a failing judgment's suggested fixes back to a 1-based source line.
 *
 * <p>Resolution order, first hit wins:
 * <ol>
 *   <li>the first fix carrying an explicit positive {@code line}</li>
 *   <li>for each quotation field in {@link #QUOTE_FIELDS} order, each fix's quotation searched by
 *       exact substring, then per-line contains, then per-line case-insensitive contains, then a
 *       whitespace-collapsed case-insensitive search mapped back to an approximate line</li>
 *   <li>line 1</li>
 * </ol>
 * Stateless and deterministic. Explicit lines are trusted as given; searched lines always fall
 * within {@code [1, lineCount]}.
 */
public class LineLocator {

    public static final List<String> QUOTE_FIELDS = List.of("before", "quote", "original", "current_text", "match");

    private static final String LINE_FIELD = "line";
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    public int locate(String source, List<JsonNode> suggestedFixes) {
        if (source == null || suggestedFixes == null || suggestedFixes.isEmpty()) {
            return 1;
        }
        String[] lines = LINE_BREAK.split(source, -1);

        OptionalInt explicit = explicitLine(suggestedFixes);
        if (explicit.isPresent()) {
            return explicit.getAsInt();
        }

        for (String field : QUOTE_FIELDS) {
            for (JsonNode fix : suggestedFixes) {
                Optional<String> quote = quotation(fix, field);
                if (quote.isEmpty()) continue;

                OptionalInt found = search(source, lines, quote.get());
                if (found.isPresent()) {
                    return clamp(found.getAsInt(), lines.length);
                }
            }
        }
        return 1;
    }

    private OptionalInt explicitLine(List<JsonNode> fixes) {
        for (JsonNode fix : fixes) {
            if (fix == null || !fix.isObject()) continue;
            JsonNode line = fix.get(LINE_FIELD);
            if (line == null) continue;

            if (line.isIntegralNumber() && line.canConvertToLong() && line.asLong() >= 1
                    && line.asLong() <= Integer.MAX_VALUE) {
                return OptionalInt.of(line.asInt());
            }
            if (line.isTextual() && DIGITS.matcher(line.asText().trim()).matches()) {
                int parsed = Integer.parseInt(line.asText().trim());
                if (parsed >= 1) return OptionalInt.of(parsed);
            }
        }
        return OptionalInt.empty();
    }

    private Optional<String> quotation(JsonNode fix, String field) {
        if (fix == null || !fix.isObject()) return Optional.empty();
        JsonNode value = fix.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) return Optional.empty();
        return Optional.of(value.asText());
    }

    private OptionalInt search(String source, String[] lines, String quote) {
        int exact = source.indexOf(quote);
        if (exact >= 0) {
            return OptionalInt.of(1 + countNewlines(source, exact));
        }

        String needle = firstNonBlankLine(quote).trim();
        if (!needle.isEmpty()) {
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].contains(needle)) return OptionalInt.of(i + 1);
            }
            String lowerNeedle = needle.toLowerCase(Locale.ROOT);
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].toLowerCase(Locale.ROOT).contains(lowerNeedle)) return OptionalInt.of(i + 1);
            }
        }

        return collapsedSearch(source, lines, quote);
    }

    /**
     * Whitespace-insensitive search. The match offset in the collapsed text is mapped back by
     * accumulating collapsed line lengths, so the line is approximate for heavily re-wrapped text.
     */
    private OptionalInt collapsedSearch(String source, String[] lines, String quote) {
        String needle = collapse(quote);
        if (needle.isEmpty()) return OptionalInt.empty();

        int offset = collapse(source).indexOf(needle);
        if (offset < 0) return OptionalInt.empty();

        int cumulative = 0;
        for (int i = 0; i < lines.length; i++) {
            String collapsedLine = collapse(lines[i]);
            if (collapsedLine.isEmpty()) continue;
            cumulative += collapsedLine.length() + 1;
            if (cumulative > offset) return OptionalInt.of(i + 1);
        }
        return OptionalInt.of(lines.length);
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    private static String firstNonBlankLine(String text) {
        for (String line : LINE_BREAK.split(text)) {
            if (!line.isBlank()) return line;
        }
        return "";
    }

    private static int countNewlines(String text, int end) {
        int count = 0;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }

    private static int clamp(int line, int lineCount) {
        return Math.max(1, Math.min(line, Math.max(lineCount, 1)));
    }
}
