package com.prqlc.pl;

/**
 * A half-open range of character offsets into the compiled source text.
 *
 * <p>Spans travel from the parser through resolution and lowering so that every
 * diagnostic can point at the text that caused it.
 *
 * @param start offset of the first character
 * @param end offset one past the last character
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                String.format("Invalid span: %d..%d", start, end));
        }
    }

    /**
     * Returns the smallest span covering both spans. Either side may be null.
     */
    public static Span merge(Span a, Span b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return new Span(Math.min(a.start, b.start), Math.max(a.end, b.end));
    }

    /**
     * Returns this span moved right by {@code offset} characters.
     */
    public Span shift(int offset) {
        return new Span(start + offset, end + offset);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
