package com.challenges.lsparse.parser;

/**
 * Raised when configuration text does not match the grammar. Carries the position of the
 * farthest point the parser reached.
 */
public class ConfigSyntaxException extends RuntimeException {
    private final int offset;
    private final int line;
    private final int column;

    /** A failure with its own message, positioned at {@code offset} in {@code source}. */
    public ConfigSyntaxException(String message, String source, int offset) {
        super(message);
        this.offset = offset;
        this.line = lineOf(source, offset);
        this.column = columnOf(source, offset);
    }

    public ConfigSyntaxException(String source, int offset, String expected) {
        super(format(source, offset, expected));
        this.offset = offset;
        this.line = lineOf(source, offset);
        this.column = columnOf(source, offset);
    }

    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static String format(String source, int offset, String expected) {
        String found = offset >= source.length() ? "end of input" : "'" + snippet(source, offset) + "'";
        return String.format("Syntax error at line %d, column %d: expected %s, but found %s",
            lineOf(source, offset), columnOf(source, offset), expected, found);
    }

    private static String snippet(String source, int offset) {
        int end = offset;
        while (end < source.length() && end - offset < 20 && source.charAt(end) != '\n') {
            end++;
        }
        return source.substring(offset, end);
    }

    static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    static int columnOf(String source, int offset) {
        int lineStart = offset == 0 ? 0 : source.lastIndexOf('\n', Math.min(offset, source.length()) - 1) + 1;
        return offset - lineStart + 1;
    }
}
