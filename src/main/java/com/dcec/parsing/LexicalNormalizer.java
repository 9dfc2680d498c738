package com.dcec.parsing;

import java.util.regex.Pattern;

/**
 * Character-level clean-up of DCEC text. Every run of whitespace or commas
 * becomes the canonical separator {@code ,}, so {@code "a and b"} normalizes
 * to {@code "a,and,b"} and {@code "f(a, b)"} to {@code "f(a,b)"}.
 */
public final class LexicalNormalizer {

    public static final char SEPARATOR = ',';
    public static final char COMMENT = ';';

    private static final Pattern QUANTIFIER_DOT = Pattern.compile("([∀∃])\\s*([A-Za-z_]\\w*)\\s*\\.");
    private static final Pattern OPERATOR_SYMBOLS = Pattern.compile("(<->|->|&&|\\|\\||[¬∧∨→↔⇒⇔∀∃□◊◇~!&|+*])");
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[\\s,]+");

    private LexicalNormalizer() {
    }

    /**
     * Drop everything from the first comment character on.
     */
    public static String stripComments(String text) {
        int index = text.indexOf(COMMENT);
        return index < 0 ? text : text.substring(0, index);
    }

    public static String stripWhitespace(String text) {
        String s = QUANTIFIER_DOT.matcher(text).replaceAll("$1 $2 ");
        s = OPERATOR_SYMBOLS.matcher(s).replaceAll(" $1 ");
        s = SEPARATOR_RUNS.matcher(s.trim()).replaceAll(String.valueOf(SEPARATOR));
        return collapseSeparators(s);
    }

    /**
     * Remove redundant separators until nothing changes: doubled separators,
     * separators just inside a parenthesis, and leading or trailing ones.
     * Adjacent groups {@code )(} get a separator between them.
     */
    public static String collapseSeparators(String text) {
        String s = text;
        String previous;
        do {
            previous = s;
            s = s.replace(",,", ",")
                    .replace("(,", "(")
                    .replace(",)", ")")
                    .replace(")(", "),(");
            if (s.startsWith(",")) {
                s = s.substring(1);
            }
            if (s.endsWith(",")) {
                s = s.substring(0, s.length() - 1);
            }
        } while (!s.equals(previous));
        return s;
    }

    /**
     * Opening and closing parenthesis counts match. Order is not checked.
     */
    public static boolean checkParens(String text) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                close++;
            }
        }
        return open == close;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1.
     */
    public static int getMatchingCloseParen(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '(') {
            return -1;
        }
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
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

    /**
     * Remove parenthesis pairs that wrap nothing but another pair, then make
     * sure one pair wraps the whole text. Applying it twice changes nothing.
     */
    public static String consolidateParens(String text) {
        String s = text;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i + 1 < s.length(); i++) {
                if (s.charAt(i) == '(' && s.charAt(i + 1) == '(') {
                    int outer = getMatchingCloseParen(s, i);
                    int inner = getMatchingCloseParen(s, i + 1);
                    if (outer >= 0 && outer == inner + 1) {
                        s = s.substring(0, i) + s.substring(i + 1, outer) + s.substring(outer + 1);
                        changed = true;
                        break;
                    }
                }
            }
        }
        if (s.isEmpty() || s.charAt(0) != '(' || getMatchingCloseParen(s, 0) != s.length() - 1) {
            s = "(" + s + ")";
        }
        return s;
    }
}
