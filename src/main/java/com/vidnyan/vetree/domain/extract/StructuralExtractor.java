package com.vidnyan.vetree.domain.extract;

import com.vidnyan.vetree.domain.model.InstanceReference;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.PortBinding;
import com.vidnyan.vetree.domain.model.PortDeclaration;
import com.vidnyan.vetree.domain.model.PortDirection;
import com.vidnyan.vetree.domain.text.LineMap;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds modules, header ports and named-port instantiations in sanitized, preprocessed text.
 * <p>
 * Uses bounded pattern matching instead of a grammar. A module body ends at the first
 * {@code endmodule} or at the next module header, whichever comes first. Fragments that
 * cannot be understood are skipped without affecting their siblings.
 */
public class StructuralExtractor {

    private static final String IDENT = "[A-Za-z_]\\w*";

    private static final Pattern MODULE_HEADER = Pattern.compile(
            "^[ \\t]*(module)\\s+(?:(?:static|automatic)\\s+)?(" + IDENT + ")",
            Pattern.MULTILINE);

    private static final Pattern END_MODULE = Pattern.compile("\\bendmodule\\b");

    // statement start: beginning of a line or right after a semicolon
    private static final Pattern INSTANCE = Pattern.compile(
            "(?:^|(?<=;))[ \\t]*(?:" + IDENT + "[ \\t]*:[ \\t]*)?"
                    + "(" + IDENT + ")"
                    + "(?:\\s*#\\s*\\([^;]*?\\))?"
                    + "\\s+(" + IDENT + ")"
                    + "\\s*(?:#\\s*\\([^;]*\\))?"
                    + "\\s*\\(",
            Pattern.MULTILINE);

    private static final Pattern DIRECTION = Pattern.compile(
            "^\\s*(input|output|inout|ref)\\b", Pattern.CASE_INSENSITIVE);

    // last identifier, ignoring trailing unpacked dimensions
    private static final Pattern PORT_NAME = Pattern.compile(
            "(" + IDENT + ")\\s*(?:\\[[^\\]]*\\]\\s*)*$");

    private static final Pattern BARE_NAME = Pattern.compile("^\\s*" + IDENT + "\\s*$");

    private static final Pattern RANGE = Pattern.compile("\\[[^\\]]+\\]");

    private static final Pattern BINDING = Pattern.compile("\\.\\s*(" + IDENT + ")(\\s*\\()?");

    private final KeywordDenylist denylist;

    public StructuralExtractor() {
        this(KeywordDenylist.defaults());
    }

    public StructuralExtractor(KeywordDenylist denylist) {
        this.denylist = denylist;
    }

    private record ModuleSpan(String name, int start, int nameEnd, int bodyStart) {}

    /**
     * Extract every module of one file, in textual order.
     */
    public List<ModuleDefinition> extract(String filePath, String text) {
        LineMap lines = LineMap.of(filePath, text);
        List<ModuleSpan> spans = findModuleSpans(text);
        List<ModuleDefinition> modules = new ArrayList<>();

        for (int i = 0; i < spans.size(); i++) {
            ModuleSpan span = spans.get(i);
            int nextStart = i + 1 < spans.size() ? spans.get(i + 1).start() : text.length();
            int bodyEnd = findBodyEnd(text, span.bodyStart(), nextStart);

            int headerEnd = text.indexOf(';', span.bodyStart());
            if (headerEnd >= bodyEnd) {
                headerEnd = -1;
            }

            List<PortDeclaration> ports = headerEnd < 0
                    ? List.of()
                    : parseHeaderPorts(text, lines, span.bodyStart(), headerEnd);

            int instanceFrom = headerEnd < 0 ? span.bodyStart() : headerEnd + 1;
            List<InstanceReference> instances = parseInstances(text, lines, instanceFrom, bodyEnd);

            modules.add(new ModuleDefinition(
                    span.name(),
                    filePath,
                    lines.location(span.start(), span.nameEnd()),
                    ports,
                    instances));
        }
        return modules;
    }

    private List<ModuleSpan> findModuleSpans(String text) {
        List<ModuleSpan> spans = new ArrayList<>();
        Matcher m = MODULE_HEADER.matcher(text);
        while (m.find()) {
            spans.add(new ModuleSpan(m.group(2), m.start(1), m.end(2), m.end()));
        }
        return spans;
    }

    private int findBodyEnd(String text, int bodyStart, int nextModuleStart) {
        Matcher end = END_MODULE.matcher(text);
        int bodyEnd = end.find(bodyStart) ? end.start() : text.length();
        return Math.min(bodyEnd, nextModuleStart);
    }

    // ------------------------------------------------------------------ ports

    private List<PortDeclaration> parseHeaderPorts(String text, LineMap lines, int from, int headerEnd) {
        List<PortDeclaration> ports = new ArrayList<>();

        int scan = skipWhitespace(text, from, headerEnd);
        if (scan < headerEnd && text.charAt(scan) == '#') {
            int paramOpen = text.indexOf('(', scan);
            if (paramOpen < 0 || paramOpen >= headerEnd) {
                return ports;
            }
            int paramClose = findMatchingParen(text, paramOpen, headerEnd);
            if (paramClose < 0) {
                return ports;
            }
            scan = paramClose + 1;
        }

        int open = text.indexOf('(', scan);
        if (open < 0 || open >= headerEnd) {
            return ports;
        }
        int close = findMatchingParen(text, open, headerEnd);
        if (close < 0) {
            return ports;
        }

        PortDeclaration previous = null;
        for (int[] fragment : splitTopLevel(text, open + 1, close)) {
            PortDeclaration port = parsePortFragment(text, lines, fragment[0], fragment[1], previous);
            if (port != null) {
                ports.add(port);
                previous = port;
            }
        }
        return ports;
    }

    private PortDeclaration parsePortFragment(String text, LineMap lines, int start, int end,
                                              PortDeclaration previous) {
        String fragment = text.substring(start, end);
        if (fragment.isBlank()) {
            return null;
        }

        PortDirection direction = PortDirection.UNKNOWN;
        int declStart = 0;
        Matcher dir = DIRECTION.matcher(fragment);
        if (dir.lookingAt()) {
            direction = PortDirection.fromKeyword(dir.group(1));
            declStart = dir.end();
        }

        int assign = fragment.indexOf('=', declStart);
        int declEnd = assign < 0 ? fragment.length() : assign;
        String decl = fragment.substring(declStart, declEnd);

        Matcher name = PORT_NAME.matcher(decl);
        if (!name.find()) {
            return null;
        }

        Matcher range = RANGE.matcher(decl);
        String rangeText = range.find() ? range.group() : null;

        if (direction == PortDirection.UNKNOWN
                && previous != null
                && previous.direction() != PortDirection.UNKNOWN
                && BARE_NAME.matcher(decl).matches()) {
            direction = previous.direction();
            rangeText = previous.rangeText();
        }

        int nameStart = start + declStart + name.start(1);
        int nameEnd = start + declStart + name.end(1);
        return new PortDeclaration(direction, name.group(1), rangeText, lines.location(nameStart, nameEnd));
    }

    /**
     * Split {@code [from, to)} on commas outside any bracket pair.
     */
    private List<int[]> splitTopLevel(String text, int from, int to) {
        List<int[]> parts = new ArrayList<>();
        int depth = 0;
        int partStart = from;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(new int[]{partStart, i});
                partStart = i + 1;
            }
        }
        parts.add(new int[]{partStart, to});
        return parts;
    }

    // -------------------------------------------------------------- instances

    private List<InstanceReference> parseInstances(String text, LineMap lines, int from, int bodyEnd) {
        List<InstanceReference> instances = new ArrayList<>();
        if (from >= bodyEnd) {
            return instances;
        }

        Matcher m = INSTANCE.matcher(text);
        m.useAnchoringBounds(false);
        m.useTransparentBounds(true);
        m.region(from, bodyEnd);

        while (m.find()) {
            String moduleName = m.group(1);
            String instanceName = m.group(2);
            if (denylist.contains(moduleName) || denylist.contains(instanceName)) {
                continue;
            }

            int open = m.end() - 1;
            int close = findMatchingParen(text, open, bodyEnd - 1);
            List<PortBinding> bindings = close < 0
                    ? List.of()
                    : parseBindings(text, lines, open, close);

            instances.add(new InstanceReference(
                    moduleName,
                    instanceName,
                    lines.location(m.start(1), m.end(2)),
                    bindings));

            if (close >= 0 && close + 1 < bodyEnd) {
                m.region(close + 1, bodyEnd);
            }
        }
        return instances;
    }

    /**
     * Named connections at the top level of the argument list {@code (open, close)}.
     * {@code .name} without parentheses binds the net of the same name; {@code .*} is ignored.
     */
    private List<PortBinding> parseBindings(String text, LineMap lines, int open, int close) {
        List<PortBinding> bindings = new ArrayList<>();
        Matcher binding = BINDING.matcher(text);
        binding.useTransparentBounds(true);

        int depth = 0;
        int i = open + 1;
        while (i < close) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '.' && depth == 0 && startsArgument(text, open, i)) {
                binding.region(i, close);
                if (binding.lookingAt()) {
                    String portName = binding.group(1);
                    if (binding.group(2) == null) {
                        bindings.add(new PortBinding(portName, portName, lines.location(i, binding.end(1))));
                        i = binding.end();
                        continue;
                    }
                    int exprOpen = binding.end() - 1;
                    int exprClose = findMatchingParen(text, exprOpen, close - 1);
                    if (exprClose < 0) {
                        break;
                    }
                    String expression = text.substring(exprOpen + 1, exprClose).trim();
                    bindings.add(new PortBinding(portName, expression, lines.location(i, exprClose + 1)));
                    i = exprClose + 1;
                    continue;
                }
            }
            i++;
        }
        return bindings;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * True when only whitespace separates {@code index} from the opening parenthesis or the
     * preceding comma, so {@code bus.clk} in a positional argument is not a binding.
     */
    private static boolean startsArgument(String text, int open, int index) {
        int j = index - 1;
        while (j > open && Character.isWhitespace(text.charAt(j))) {
            j--;
        }
        return j == open || text.charAt(j) == ',';
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, searching no further
     * than {@code maxIndex}; -1 when unbalanced.
     */
    static int findMatchingParen(String text, int openIndex, int maxIndex) {
        int depth = 0;
        for (int i = openIndex; i <= maxIndex && i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int skipWhitespace(String text, int from, int to) {
        int i = from;
        while (i < to && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
