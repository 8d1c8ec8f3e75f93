package com.shardindex.core.indexer;

import com.shardindex.core.model.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented symbol extraction with regular expressions.
 * <p>
 * Finds type declarations (classes, interfaces, enums, records, annotation types), methods,
 * constructors with an access modifier, and fields declared with at least one modifier. Comments, string
 * literals and character literals are blanked out first so their contents never produce symbols.
 * Each name is reported once per file.
 * </p>
 */
public class RegexJavaSymbolIndexer implements JavaSymbolIndexer {
    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Pattern TYPE_DECL = Pattern.compile(
            "(?:\\b(?:class|interface|enum|record)|@interface)\\s+(" + IDENT + ")");

    private static final Pattern METHOD_DECL = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:public|protected|private|static|final|abstract|synchronized|native|default"
                    + "|strictfp)\\s+)*(?:<[^>;{}()]*>\\s*)?(?!(?:return|new|throw|else|case|yield)\\b)"
                    + "[\\w$.]+(?:<[^;{}()]*>)?(?:\\[\\])*\\s+("
                    + IDENT + ")\\s*\\([^;{}]*\\)\\s*(?:throws\\s+[\\w$.,\\s]+)?[{;]");

    private static final Pattern FIELD_DECL = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:public|protected|private|static|final|transient|volatile)\\s+)+"
                    + "[\\w$.]+(?:<[^;{}()]*>)?(?:\\[\\])*\\s+(" + IDENT + ")\\s*[=;,]");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "return", "throw", "new", "catch",
            "try", "finally", "synchronized", "assert", "yield", "super", "this");

    @Override
    public List<Symbol> index(String path, String text) {
        String code = blankCommentsAndLiterals(text);
        Set<String> names = new LinkedHashSet<>();
        collect(TYPE_DECL, code, names);
        collect(METHOD_DECL, code, names);
        collect(FIELD_DECL, code, names);
        List<Symbol> symbols = new ArrayList<>(names.size());
        for (String name : names) {
            symbols.add(new Symbol(name, path));
        }
        return symbols;
    }

    private static void collect(Pattern pattern, String code, Set<String> names) {
        Matcher m = pattern.matcher(code);
        while (m.find()) {
            String name = m.group(1);
            if (!KEYWORDS.contains(name)) {
                names.add(name);
            }
        }
    }

    /**
     * Replaces the contents of comments and literals with spaces, keeping line breaks.
     */
    static String blankCommentsAndLiterals(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < n && text.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                blank(text, i, end, out);
                i = end;
            } else if (text.startsWith("\"\"\"", i)) {
                int end = text.indexOf("\"\"\"", i + 3);
                end = end < 0 ? n : end + 3;
                blank(text, i, end, out);
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = i + 1;
                while (end < n && text.charAt(end) != c && text.charAt(end) != '\n') {
                    end += text.charAt(end) == '\\' ? 2 : 1;
                }
                end = Math.min(n, end + 1);
                blank(text, i, end, out);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static void blank(String text, int from, int to, StringBuilder out) {
        for (int k = from; k < to; k++) {
            out.append(text.charAt(k) == '\n' ? '\n' : ' ');
        }
    }
}
