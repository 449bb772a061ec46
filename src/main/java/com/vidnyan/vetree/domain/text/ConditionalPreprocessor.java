package com.vidnyan.vetree.domain.text;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented resolution of {@code `define / `undef / `ifdef / `ifndef / `elsif / `else / `endif}.
 * <p>
 * Inactive lines and every directive line are blanked in place, so the output has the
 * same length and line structure as the input. Conditions test a single symbol name.
 * The {@code defines} set is mutated by active {@code `define} and {@code `undef} lines.
 * Malformed nesting never fails: a stray {@code `endif}, {@code `else} or {@code `elsif}
 * is ignored.
 */
public final class ConditionalPreprocessor {

    private static final Pattern DIRECTIVE = Pattern.compile("^[ \\t]*`([A-Za-z_]\\w*)(.*)$");
    private static final Pattern SYMBOL = Pattern.compile("^\\s*([A-Za-z_]\\w*)");

    private ConditionalPreprocessor() {
    }

    /**
     * One {@code `ifdef}/{@code `ifndef} level.
     */
    private static final class Frame {
        final boolean parentActive;
        boolean active;
        boolean branchTaken;

        Frame(boolean parentActive, boolean active) {
            this.parentActive = parentActive;
            this.active = active;
            this.branchTaken = active;
        }
    }

    public static String preprocess(String text, Set<String> defines) {
        StringBuilder out = new StringBuilder(text.length());
        Deque<Frame> frames = new ArrayDeque<>();
        boolean continuingDefine = false;

        int lineStart = 0;
        while (lineStart <= text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline;
            String line = text.substring(lineStart, lineEnd);

            if (continuingDefine) {
                continuingDefine = endsWithContinuation(line);
                out.append(blankLine(line));
            } else {
                Matcher directive = DIRECTIVE.matcher(stripCarriageReturn(line));
                if (directive.matches()) {
                    String keyword = directive.group(1);
                    String rest = directive.group(2);
                    continuingDefine = "define".equals(keyword) && endsWithContinuation(line);
                    apply(keyword, rest, frames, defines);
                    out.append(blankLine(line));
                } else if (isActive(frames)) {
                    out.append(line);
                } else {
                    out.append(blankLine(line));
                }
            }

            if (newline < 0) {
                break;
            }
            out.append('\n');
            lineStart = newline + 1;
        }
        return out.toString();
    }

    private static void apply(String keyword, String rest, Deque<Frame> frames, Set<String> defines) {
        boolean active = isActive(frames);
        String symbol = symbol(rest);

        switch (keyword) {
            case "define" -> {
                if (active && symbol != null) {
                    defines.add(symbol);
                }
            }
            case "undef" -> {
                if (active && symbol != null) {
                    defines.remove(symbol);
                }
            }
            case "ifdef" -> frames.push(new Frame(active, active && isDefined(symbol, defines)));
            case "ifndef" -> frames.push(new Frame(active, active && !isDefined(symbol, defines)));
            case "elsif" -> {
                Frame frame = frames.peek();
                if (frame == null) {
                    return;
                }
                if (!frame.parentActive || frame.branchTaken) {
                    frame.active = false;
                } else {
                    frame.active = isDefined(symbol, defines);
                    frame.branchTaken = frame.active;
                }
            }
            case "else" -> {
                Frame frame = frames.peek();
                if (frame == null) {
                    return;
                }
                if (!frame.parentActive || frame.branchTaken) {
                    frame.active = false;
                } else {
                    frame.active = true;
                    frame.branchTaken = true;
                }
            }
            case "endif" -> {
                if (!frames.isEmpty()) {
                    frames.pop();
                }
            }
            default -> {
                // other compiler directives (`timescale, `include, macro uses) carry no structure
            }
        }
    }

    private static boolean isActive(Deque<Frame> frames) {
        Frame top = frames.peek();
        return top == null || top.active;
    }

    private static boolean isDefined(String symbol, Set<String> defines) {
        return symbol != null && defines.contains(symbol);
    }

    private static String symbol(String rest) {
        Matcher m = SYMBOL.matcher(rest);
        return m.find() ? m.group(1) : null;
    }

    private static boolean endsWithContinuation(String line) {
        return stripCarriageReturn(line).stripTrailing().endsWith("\\");
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static String blankLine(String line) {
        StringBuilder blank = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            blank.append(line.charAt(i) == '\r' ? '\r' : ' ');
        }
        return blank.toString();
    }
}
