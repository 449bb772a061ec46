package com.vidnyan.vetree.domain.extract;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Language keywords that can never be a module type or an instance name.
 * A candidate instantiation whose type or instance identifier is listed here is dropped.
 */
public final class KeywordDenylist {

    private static final Set<String> DEFAULT_KEYWORDS = Set.of(
            "if", "else", "begin", "end", "case", "casex", "casez", "endcase", "default",
            "for", "foreach", "while", "do", "repeat", "forever", "return", "break", "continue",
            "always", "always_ff", "always_comb", "always_latch",
            "assign", "deassign", "force", "release", "disable", "wait", "fork", "join",
            "wire", "reg", "logic", "bit", "byte", "int", "integer", "real", "time", "genvar",
            "tri", "tri0", "tri1", "supply0", "supply1", "signed", "unsigned",
            "input", "output", "inout", "ref",
            "module", "endmodule",
            "function", "endfunction",
            "task", "endtask",
            "generate", "endgenerate",
            "initial", "final",
            "parameter", "localparam", "defparam", "typedef",
            "specify", "endspecify",
            "primitive", "endprimitive",
            "assert", "assume", "cover", "property", "sequence",
            "unique", "priority", "import", "export");

    private final Set<String> keywords;

    private KeywordDenylist(Set<String> keywords) {
        this.keywords = Set.copyOf(keywords);
    }

    public static KeywordDenylist defaults() {
        return new KeywordDenylist(DEFAULT_KEYWORDS);
    }

    public static KeywordDenylist of(Collection<String> keywords) {
        return new KeywordDenylist(lowerCase(keywords));
    }

    /**
     * Copy of this list extended with more keywords.
     */
    public KeywordDenylist with(Collection<String> extra) {
        Set<String> merged = new TreeSet<>(keywords);
        merged.addAll(lowerCase(extra));
        return new KeywordDenylist(merged);
    }

    /**
     * Case-insensitive membership.
     */
    public boolean contains(String identifier) {
        return identifier != null && keywords.contains(identifier.toLowerCase(Locale.ROOT));
    }

    public Set<String> keywords() {
        return keywords;
    }

    private static Set<String> lowerCase(Collection<String> words) {
        Set<String> result = new TreeSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                result.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
