package com.mainframe.contract.layout.pli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.mainframe.contract.layout.model.SourceStatement;

/**
 * Splits PL/I source into declaration items: text separated by commas or semicolons at parenthesis depth 0.
 * <p>
 * Trailing sequence numbers and a carriage-control digit in column 1 are removed first. Comments are
 * stripped; the first comment fragment on a line becomes the description of the first item starting there.
 */
public class PliSourceNormalizer {

    private static final Pattern TRAILING_SEQUENCE = Pattern.compile("\\s+\\d{5,}\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<SourceStatement> normalize(String source) {
        List<PendingItem> items = new ArrayList<>();
        Map<Integer, String> firstCommentByLine = new HashMap<>();
        if (source == null || source.isEmpty()) {
            return new ArrayList<>();
        }

        StringBuilder text = new StringBuilder();
        StringBuilder comment = new StringBuilder();
        int itemLine = 0;
        int commentLine = 0;
        int depth = 0;
        boolean inQuote = false;
        boolean inComment = false;

        String[] lines = source.split("\\R", -1);
        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = normalizeLine(lines[index]);
            if (text.length() > 0) {
                text.append(' ');
            }
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inComment) {
                    if (c == '*' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                        inComment = false;
                        i++;
                        String fragment = WHITESPACE.matcher(comment).replaceAll(" ").trim();
                        if (!fragment.isEmpty()) {
                            firstCommentByLine.putIfAbsent(commentLine, fragment);
                        }
                    } else {
                        comment.append(c);
                    }
                    continue;
                }
                if (!inQuote && c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '*') {
                    inComment = true;
                    commentLine = lineNumber;
                    comment.setLength(0);
                    i++;
                    continue;
                }
                if (c == '\'') {
                    inQuote = !inQuote;
                } else if (!inQuote && c == '(') {
                    depth++;
                } else if (!inQuote && c == ')') {
                    depth = Math.max(0, depth - 1);
                } else if (!inQuote && depth == 0 && (c == ',' || c == ';')) {
                    addItem(items, text, itemLine, c == ';');
                    continue;
                }
                if (text.toString().isBlank()) {
                    if (Character.isWhitespace(c)) {
                        continue;
                    }
                    text.setLength(0);
                    itemLine = lineNumber;
                }
                text.append(c);
            }
            if (inComment) {
                comment.append(' ');
            }
        }
        addItem(items, text, itemLine, false);

        List<SourceStatement> statements = new ArrayList<>();
        Set<Integer> claimedLines = new HashSet<>();
        for (PendingItem item : items) {
            String description = claimedLines.add(item.lineNumber) ? firstCommentByLine.get(item.lineNumber) : null;
            statements.add(new SourceStatement(item.text, item.lineNumber, description, item.terminated));
        }
        return statements;
    }

    static String normalizeLine(String raw) {
        String line = TRAILING_SEQUENCE.matcher(raw).replaceAll("");
        if (!line.isEmpty() && Character.isDigit(line.charAt(0))) {
            line = line.substring(1);
        }
        return line.stripTrailing();
    }

    private static void addItem(List<PendingItem> items, StringBuilder text, int lineNumber, boolean terminated) {
        String item = WHITESPACE.matcher(text).replaceAll(" ").trim();
        text.setLength(0);
        if (!item.isEmpty()) {
            items.add(new PendingItem(item, lineNumber, terminated));
        } else if (terminated && !items.isEmpty()) {
            PendingItem last = items.get(items.size() - 1);
            items.set(items.size() - 1, new PendingItem(last.text, last.lineNumber, true));
        }
    }

    private static final class PendingItem {
        private final String text;
        private final int lineNumber;
        private final boolean terminated;

        private PendingItem(String text, int lineNumber, boolean terminated) {
            this.text = text;
            this.lineNumber = lineNumber;
            this.terminated = terminated;
        }
    }
}
