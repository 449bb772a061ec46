package com.vidnyan.vetree.domain.text;

/**
 * Blanks comments, string literals and attribute annotations.
 * The result has the same length as the input and keeps every line break at its offset,
 * so offsets computed on it address the original file.
 */
public final class SourceSanitizer {

    private enum Mode {
        CODE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        ATTRIBUTE,
        STRING
    }

    private SourceSanitizer() {
    }

    /**
     * Sanitize a whole buffer. Unterminated comments, strings and attributes run to the end
     * of the text.
     */
    public static String sanitize(String text) {
        char[] out = text.toCharArray();
        int length = out.length;
        Mode mode = Mode.CODE;

        int i = 0;
        while (i < length) {
            char c = text.charAt(i);
            char next = i + 1 < length ? text.charAt(i + 1) : '\0';

            switch (mode) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        mode = Mode.LINE_COMMENT;
                        blank(out, i, 2);
                        i += 2;
                    } else if (c == '/' && next == '*') {
                        mode = Mode.BLOCK_COMMENT;
                        blank(out, i, 2);
                        i += 2;
                    } else if (c == '(' && next == '*' && !isEventWildcard(text, i)) {
                        mode = Mode.ATTRIBUTE;
                        blank(out, i, 2);
                        i += 2;
                    } else if (c == '"') {
                        mode = Mode.STRING;
                        blank(out, i, 1);
                        i++;
                    } else {
                        i++;
                    }
                }
                case LINE_COMMENT -> {
                    if (c == '\n') {
                        mode = Mode.CODE;
                    } else {
                        blank(out, i, 1);
                    }
                    i++;
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        mode = Mode.CODE;
                        blank(out, i, 2);
                        i += 2;
                    } else {
                        blank(out, i, 1);
                        i++;
                    }
                }
                case ATTRIBUTE -> {
                    if (c == '*' && next == ')') {
                        mode = Mode.CODE;
                        blank(out, i, 2);
                        i += 2;
                    } else {
                        blank(out, i, 1);
                        i++;
                    }
                }
                case STRING -> {
                    if (c == '\\') {
                        // escape pair, the escaped character never closes the literal
                        blank(out, i, 2);
                        i += 2;
                    } else {
                        if (c == '"') {
                            mode = Mode.CODE;
                        }
                        blank(out, i, 1);
                        i++;
                    }
                }
            }
        }
        return new String(out);
    }

    /**
     * {@code @(*)} and {@code (*)} are sensitivity wildcards, not attributes.
     */
    private static boolean isEventWildcard(String text, int openParen) {
        int close = openParen + 2;
        while (close < text.length() && (text.charAt(close) == ' ' || text.charAt(close) == '\t')) {
            close++;
        }
        return close < text.length() && text.charAt(close) == ')';
    }

    private static void blank(char[] out, int from, int count) {
        int end = Math.min(out.length, from + count);
        for (int k = from; k < end; k++) {
            if (out[k] != '\n' && out[k] != '\r') {
                out[k] = ' ';
            }
        }
    }
}
