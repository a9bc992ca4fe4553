package com.challenges.lsparse.ast;

import java.util.Objects;

/**
 * Region of the original configuration text a node was parsed from.
 * The text is sliced on first request and cached; concurrent callers may
 * both compute it, which is harmless since the slice is deterministic.
 */
public final class SourceSpan {
    private final String source;
    private final int start;
    private final int end;
    private String text;

    public SourceSpan(String source, int start, int end) {
        Objects.requireNonNull(source, "source");
        if (start < 0 || end < start || end > source.length()) {
            throw new IndexOutOfBoundsException(
                "Invalid span [" + start + ", " + end + ") for source of length " + source.length());
        }
        this.source = source;
        this.start = start;
        this.end = end;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public String text() {
        String result = text;
        if (result == null) {
            result = source.substring(start, end);
            text = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceSpan)) {
            return false;
        }
        SourceSpan other = (SourceSpan) o;
        return start == other.start && end == other.end && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * start + end) + source.hashCode();
    }

    @Override
    public String toString() {
        return "SourceSpan[" + start + ", " + end + ")";
    }
}
