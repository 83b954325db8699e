package com.mainframe.contract.layout.cobol;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.contract.layout.model.SourceStatement;

/**
 * Turns copybook text into logical declarations, one per period-terminated sentence.
 * <p>
 * Fixed-format lines (columns 1-6 blank or numeric) keep columns 8-72 and honour the column 7
 * indicator: {@code *} and {@code /} comment lines and {@code D} debug lines are dropped, {@code -}
 * continues the previous line. Any other line is taken whole. Inline {@code *>} comments are removed
 * and kept as the description of the declaration they belong to.
 */
public class CobolSourceNormalizer {

    private static final int INDICATOR_COLUMN = 6;
    private static final int AREA_START = 7;
    private static final int AREA_END = 72;
    private static final String FIXED_INDICATORS = " *-/Dd";
    private static final String INLINE_COMMENT = "*>";

    public List<SourceStatement> normalize(String source) {
        List<SourceStatement> statements = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return statements;
        }
        StatementBuffer buffer = new StatementBuffer();
        String[] lines = source.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String raw = lines[i];
            if (raw.isBlank()) {
                continue;
            }
            String area;
            boolean continuation = false;
            if (isFixedFormat(raw)) {
                char indicator = raw.charAt(INDICATOR_COLUMN);
                if (indicator == '*' || indicator == '/' || indicator == 'D' || indicator == 'd') {
                    continue;
                }
                continuation = indicator == '-';
                area = raw.length() > AREA_START ? raw.substring(AREA_START, Math.min(AREA_END, raw.length())) : "";
            } else {
                if (raw.stripLeading().startsWith("*")) {
                    continue;
                }
                area = raw;
            }

            String comment = null;
            int commentAt = area.indexOf(INLINE_COMMENT);
            if (commentAt >= 0) {
                comment = area.substring(commentAt + INLINE_COMMENT.length()).trim();
                area = area.substring(0, commentAt);
                if (comment.isEmpty()) {
                    comment = null;
                }
            }
            buffer.consume(area, i + 1, comment, continuation, statements);
        }
        buffer.flush(statements);
        return statements;
    }

    static boolean isFixedFormat(String line) {
        if (line.length() <= INDICATOR_COLUMN) {
            return false;
        }
        String sequence = line.substring(0, INDICATOR_COLUMN);
        boolean sequenceArea = sequence.isBlank() || sequence.chars().allMatch(Character::isDigit);
        return sequenceArea && FIXED_INDICATORS.indexOf(line.charAt(INDICATOR_COLUMN)) >= 0;
    }

    /**
     * Accumulates characters until a period followed by whitespace or end of line, outside quotes.
     */
    private static final class StatementBuffer {
        private final StringBuilder text = new StringBuilder();
        private int startLine;
        private String description;
        private char quote;

        void consume(String area, int lineNumber, String comment, boolean continuation, List<SourceStatement> out) {
            String pendingComment = comment;
            if (text.length() > 0 && pendingComment != null) {
                if (description == null) {
                    description = pendingComment;
                }
                pendingComment = null;
            }

            String segment = area;
            if (continuation) {
                segment = segment.stripLeading();
                if (quote != 0 && !segment.isEmpty() && segment.charAt(0) == quote) {
                    segment = segment.substring(1);
                } else if (quote == 0) {
                    trimTrailingWhitespace();
                }
            } else if (text.length() > 0) {
                text.append(' ');
            }

            for (int i = 0; i < segment.length(); i++) {
                char c = segment.charAt(i);
                if (text.length() == 0) {
                    if (Character.isWhitespace(c)) {
                        continue;
                    }
                    startLine = lineNumber;
                    if (pendingComment != null) {
                        description = pendingComment;
                        pendingComment = null;
                    }
                }
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '.' && (i + 1 >= segment.length() || Character.isWhitespace(segment.charAt(i + 1)))) {
                    emit(out, true);
                    continue;
                }
                text.append(c);
            }
        }

        void flush(List<SourceStatement> out) {
            if (!text.toString().isBlank()) {
                emit(out, false);
            }
        }

        private void emit(List<SourceStatement> out, boolean terminated) {
            String statement = text.toString().trim();
            if (!statement.isEmpty()) {
                out.add(new SourceStatement(statement, startLine, description, terminated));
            }
            text.setLength(0);
            description = null;
            quote = 0;
        }

        private void trimTrailingWhitespace() {
            int end = text.length();
            while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            text.setLength(end);
        }
    }
}
