package com.prqlc.exception;

import com.prqlc.pl.Span;

/**
 * Line and column coordinates of a span. Lines and columns are 0-based.
 */
public record SourceLocation(int startLine, int startColumn, int endLine, int endColumn) {

    /**
     * Converts a character span into line/column coordinates within {@code source}.
     */
    public static SourceLocation of(Span span, String source) {
        int[] start = position(source, span.start());
        int[] end = position(source, span.end());
        return new SourceLocation(start[0], start[1], end[0], end[1]);
    }

    private static int[] position(String source, int offset) {
        int line = 0;
        int column = 0;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        return new int[] {line, column};
    }
}
