package com.challenges.lsparse.ast;

import java.math.BigInteger;

/**
 * Decoding of literal lexemes into their values, and the reverse for numbers.
 */
public final class Lexemes {
    private Lexemes() {
    }

    /**
     * Strips the quotes from a string lexeme and decodes its escape sequences.
     * Unknown escapes keep their backslash.
     */
    public static String unquote(String lexeme) {
        if (lexeme.length() < 2) {
            throw new StructuralInvariantException("Invalid string literal: " + lexeme);
        }
        char quote = lexeme.charAt(0);
        if ((quote != '"' && quote != '\'') || lexeme.charAt(lexeme.length() - 1) != quote) {
            throw new StructuralInvariantException("Invalid string literal: " + lexeme);
        }

        String body = lexeme.substring(1, lexeme.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }

        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\\' -> sb.append('\\');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'a' -> sb.append('\u0007');
                case 'v' -> sb.append('\u000B');
                case '\n' -> {
                    // line continuation
                }
                case 'x' -> i = appendHex(body, i, 2, sb, "\\x");
                case 'u' -> i = appendHex(body, i, 4, sb, "\\u");
                default -> {
                    if (isOctal(next)) {
                        int start = i - 1;
                        int end = start;
                        while (end < body.length() && end < start + 3 && isOctal(body.charAt(end))) {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(start, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendHex(String body, int start, int digits, StringBuilder sb, String prefix) {
        int end = start + digits;
        if (end > body.length()) {
            throw new StructuralInvariantException("Truncated " + prefix + " escape in string literal");
        }
        String hex = body.substring(start, end);
        try {
            sb.append((char) Integer.parseInt(hex, 16));
        } catch (NumberFormatException e) {
            throw new StructuralInvariantException("Invalid " + prefix + " escape in string literal: " + prefix + hex);
        }
        return end;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }

    /**
     * Returns the pattern between the slashes of a regex lexeme, with escaped slashes restored.
     */
    public static String regexPattern(String lexeme) {
        if (lexeme.length() < 2 || lexeme.charAt(0) != '/' || lexeme.charAt(lexeme.length() - 1) != '/') {
            throw new StructuralInvariantException("Invalid regex literal: " + lexeme);
        }
        return lexeme.substring(1, lexeme.length() - 1).replace("\\/", "/");
    }

    public static Number parseNumber(String lexeme) {
        try {
            if (lexeme.indexOf('.') >= 0 || lexeme.indexOf('e') >= 0 || lexeme.indexOf('E') >= 0) {
                return Double.parseDouble(lexeme);
            }
            try {
                return Long.parseLong(lexeme);
            } catch (NumberFormatException e) {
                return new BigInteger(lexeme);
            }
        } catch (NumberFormatException e) {
            throw new StructuralInvariantException("Invalid number literal: " + lexeme);
        }
    }

    public static String formatNumber(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new StructuralInvariantException("Number literal must be finite: " + value);
            }
            return Double.toString(d);
        }
        return value.toString();
    }
}
