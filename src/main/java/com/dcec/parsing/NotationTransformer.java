package com.dcec.parsing;

import com.dcec.namespace.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites function-call and infix notation into the prefix form the token
 * tree is built from. String-level passes work on normalized text
 * (see {@link LexicalNormalizer}); list-level passes work on the elements of
 * one parenthesized group.
 */
public final class NotationTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotationTransformer.class);

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String IMPLIES = "implies";
    public static final String IFF = "iff";
    public static final String FORALL = "forall";
    public static final String EXISTS = "exists";
    public static final String ALWAYS = "always";
    public static final String EVENTUALLY = "eventually";
    public static final String NEXT = "next";

    private static final Map<String, String> SYNONYMS = createSynonyms();

    private static final Set<String> NEGATIONS = new HashSet<>(Arrays.asList(NOT, "negate"));
    private static final Set<String> QUANTIFIERS = new HashSet<>(Arrays.asList(FORALL, EXISTS));
    private static final Set<String> UNARY_OPERATORS = new HashSet<>(Arrays.asList(NOT, ALWAYS, EVENTUALLY, NEXT));

    // Lower binds looser.
    private static final Map<String, Integer> BINARY_PRECEDENCE = new HashMap<>();
    static {
        BINARY_PRECEDENCE.put(IFF, 1);
        BINARY_PRECEDENCE.put(IMPLIES, 2);
        BINARY_PRECEDENCE.put(OR, 3);
        BINARY_PRECEDENCE.put(AND, 4);
    }

    private static final Map<String, String> MULTIPLICATIVE = new HashMap<>();
    private static final Map<String, String> ADDITIVE = new HashMap<>();
    static {
        MULTIPLICATIVE.put("*", "multiply");
        MULTIPLICATIVE.put("/", "divide");
        ADDITIVE.put("+", "add");
        ADDITIVE.put("-", "sub");
    }

    private NotationTransformer() {
    }

    private static Map<String, String> createSynonyms() {
        Map<String, String> synonyms = new HashMap<>();
        for (String alias : new String[]{"∧", "&", "&&", "AND", "And"}) {
            synonyms.put(alias, AND);
        }
        for (String alias : new String[]{"∨", "|", "||", "OR", "Or"}) {
            synonyms.put(alias, OR);
        }
        for (String alias : new String[]{"¬", "~", "!", "negate", "NOT", "Not"}) {
            synonyms.put(alias, NOT);
        }
        for (String alias : new String[]{"->", "→", "⇒", "IMPLIES"}) {
            synonyms.put(alias, IMPLIES);
        }
        for (String alias : new String[]{"<->", "↔", "⇔", "IFF", "biconditional"}) {
            synonyms.put(alias, IFF);
        }
        synonyms.put("∀", FORALL);
        synonyms.put("forAll", FORALL);
        synonyms.put("∃", EXISTS);
        synonyms.put("□", ALWAYS);
        synonyms.put("◊", EVENTUALLY);
        synonyms.put("◇", EVENTUALLY);
        return Collections.unmodifiableMap(synonyms);
    }

    /**
     * Canonical operator name for an alias, or the name itself.
     */
    public static String canonicalName(String name) {
        return SYNONYMS.getOrDefault(name, name);
    }

    public static boolean isQuantifier(String name) {
        return QUANTIFIERS.contains(name);
    }

    public static boolean isBinaryOperator(String name) {
        return BINARY_PRECEDENCE.containsKey(name);
    }

    public static boolean isUnaryOperator(String name) {
        return UNARY_OPERATORS.contains(name);
    }

    // ---------------------------------------------------------- text passes

    /**
     * Move each function name inside its parentheses: {@code f(a,b)} becomes
     * {@code (f,a,b)}. Negations get an extra pair around their operand so the
     * operand stays one group: {@code not(X)} becomes {@code (not,(X))}.
     */
    public static String tuckFunctions(String text) {
        String s = text;
        int open = findTuckPoint(s, 1);
        while (open >= 0) {
            int start = Math.max(Math.max(s.lastIndexOf('(', open - 1), s.lastIndexOf(')', open - 1)),
                    s.lastIndexOf(LexicalNormalizer.SEPARATOR, open - 1)) + 1;
            String name = s.substring(start, open);
            int close = LexicalNormalizer.getMatchingCloseParen(s, open);
            if (close < 0) {
                throw new DcecParseException("Unclosed argument list for " + name, text);
            }
            if (NEGATIONS.contains(name)) {
                s = s.substring(0, start) + "(" + name + ",(" + s.substring(open + 1, close) + "))" + s.substring(close + 1);
            } else {
                s = s.substring(0, start) + "(" + name + "," + s.substring(open + 1);
            }
            open = findTuckPoint(s, start + 1);
        }
        return LexicalNormalizer.collapseSeparators(s);
    }

    private static int findTuckPoint(String s, int from) {
        for (int i = Math.max(from, 1); i < s.length(); i++) {
            if (s.charAt(i) == '(') {
                char before = s.charAt(i - 1);
                if (before != '(' && before != LexicalNormalizer.SEPARATOR) {
                    return i;
                }
            }
        }
        return -1;
    }

    // ---------------------------------------------------------- list passes

    public static List<ParseToken> replaceSynonyms(List<ParseToken> elements) {
        List<ParseToken> replaced = new ArrayList<>(elements.size());
        for (ParseToken element : elements) {
            if (element.isLeaf() && SYNONYMS.containsKey(element.getName())) {
                replaced.add(ParseToken.leaf(SYNONYMS.get(element.getName())));
            } else {
                replaced.add(element);
            }
        }
        return replaced;
    }

    /**
     * Rewrite infix arithmetic into prefix sub-trees. {@code *} and {@code /}
     * bind before {@code +} and {@code -}; each operator takes the single
     * adjacent element on either side and groups left to right. Leaf operands
     * are recorded as {@code Numeric} atomics.
     */
    public static List<ParseToken> prefixEmdas(List<ParseToken> elements, Map<String, String> atomics) {
        List<ParseToken> list = new ArrayList<>(elements);
        rewriteArithmetic(list, MULTIPLICATIVE, atomics);
        rewriteArithmetic(list, ADDITIVE, atomics);
        return list;
    }

    private static void rewriteArithmetic(List<ParseToken> list, Map<String, String> operators, Map<String, String> atomics) {
        int i = 1;
        while (i < list.size() - 1) {
            ParseToken candidate = list.get(i);
            if (candidate.isLeaf() && operators.containsKey(candidate.getName())) {
                ParseToken left = list.get(i - 1);
                ParseToken right = list.get(i + 1);
                recordAtomic(left, Namespace.NUMERIC, atomics);
                recordAtomic(right, Namespace.NUMERIC, atomics);
                ParseToken rewritten = ParseToken.of(operators.get(candidate.getName()), Arrays.asList(left, right));
                list.subList(i - 1, i + 2).clear();
                list.add(i - 1, rewritten);
            } else {
                i++;
            }
        }
    }

    /**
     * Rewrite logical operators written as plain elements into prefix
     * sub-trees. A quantifier at the head takes the next element as its
     * variable and everything after it as its body. Unary operators bind to
     * the element that follows them. Binary operators split the list by
     * precedence; {@code and}/{@code or} collect every same-level operand,
     * {@code implies}/{@code iff} group to the right. When the first operator
     * sits past position 1, the elements before its left operand stay
     * separate arguments: {@code [f, a, and, b]} becomes {@code [f, (and a b)]}.
     */
    public static List<ParseToken> prefixLogicalFunctions(List<ParseToken> elements, Map<String, String> atomics) {
        if (elements.size() >= 3 && elements.get(0).isLeaf() && isQuantifier(elements.get(0).getName())) {
            ParseToken body = assemble(prefixLogicalFunctions(elements.subList(2, elements.size()), atomics), false);
            recordAtomic(body, Namespace.BOOLEAN, atomics);
            return new ArrayList<>(Arrays.asList(elements.get(0), elements.get(1), body));
        }
        List<ParseToken> list = collapseUnary(elements, atomics);

        int firstOperator = -1;
        for (int i = 0; i < list.size(); i++) {
            ParseToken element = list.get(i);
            if (!element.isLeaf() || !isBinaryOperator(element.getName())) {
                continue;
            }
            if (i == list.size() - 1 && list.size() > 1) {
                throw new DcecParseException("Dangling operator '" + element.getName() + "'", render(list));
            }
            if (i >= 1) {
                firstOperator = i;
                break;
            }
        }
        if (firstOperator < 0) {
            return list;
        }
        List<ParseToken> result = new ArrayList<>(list.subList(0, firstOperator - 1));
        result.add(infix(list.subList(firstOperator - 1, list.size()), atomics));
        return result;
    }

    private static List<ParseToken> collapseUnary(List<ParseToken> elements, Map<String, String> atomics) {
        List<ParseToken> list = new ArrayList<>(elements);
        for (int i = list.size() - 2; i >= 0; i--) {
            ParseToken element = list.get(i);
            if (!element.isLeaf() || !isUnaryOperator(element.getName())) {
                continue;
            }
            ParseToken next = list.get(i + 1);
            if (next.isLeaf() && isQuantifier(next.getName())) {
                ParseToken quantified = assemble(prefixLogicalFunctions(list.subList(i + 1, list.size()), atomics), false);
                list.subList(i, list.size()).clear();
                list.add(ParseToken.of(element.getName(), Collections.singletonList(quantified)));
                continue;
            }
            if (next.isLeaf() && (isBinaryOperator(next.getName()) || isUnaryOperator(next.getName()))) {
                continue;
            }
            recordAtomic(next, Namespace.BOOLEAN, atomics);
            list.set(i, ParseToken.of(element.getName(), Collections.singletonList(next)));
            list.remove(i + 1);
        }
        return list;
    }

    private static ParseToken infix(List<ParseToken> expression, Map<String, String> atomics) {
        String weakest = null;
        int weakestPrecedence = Integer.MAX_VALUE;
        for (int i = 1; i < expression.size() - 1; i++) {
            ParseToken element = expression.get(i);
            if (element.isLeaf() && isBinaryOperator(element.getName())) {
                int precedence = BINARY_PRECEDENCE.get(element.getName());
                if (precedence < weakestPrecedence) {
                    weakest = element.getName();
                    weakestPrecedence = precedence;
                }
            }
        }
        if (weakest == null) {
            return assemble(expression, false);
        }

        List<List<ParseToken>> segments = new ArrayList<>();
        List<ParseToken> current = new ArrayList<>();
        boolean splitAll = AND.equals(weakest) || OR.equals(weakest);
        boolean split = false;
        for (ParseToken element : expression) {
            boolean isSplitPoint = element.isLeaf() && weakest.equals(element.getName()) && (splitAll || !split);
            if (isSplitPoint) {
                segments.add(current);
                current = new ArrayList<>();
                split = true;
            } else {
                current.add(element);
            }
        }
        segments.add(current);

        List<ParseToken> operands = new ArrayList<>(segments.size());
        for (List<ParseToken> segment : segments) {
            if (segment.isEmpty()) {
                throw new DcecParseException("Missing operand for '" + weakest + "'", render(expression));
            }
            ParseToken operand = segment.size() == 1
                    ? segment.get(0)
                    : assemble(prefixLogicalFunctions(segment, atomics), false);
            recordAtomic(operand, Namespace.BOOLEAN, atomics);
            operands.add(operand);
        }
        return ParseToken.of(weakest, operands);
    }

    /**
     * Turn a fully rewritten element list into one token. A single element is
     * returned as is, except that a lone leaf inside parentheses becomes a
     * token without children. A leading leaf is the operator of the rest.
     * Several compound elements with nothing joining them are conjoined.
     */
    public static ParseToken assemble(List<ParseToken> elements, boolean parenthesized) {
        if (elements.isEmpty()) {
            throw new DcecParseException("Empty expression", null);
        }
        ParseToken first = elements.get(0);
        if (elements.size() == 1) {
            return parenthesized && first.isLeaf() ? ParseToken.of(first.getName(), Collections.emptyList()) : first;
        }
        if (first.isLeaf()) {
            return ParseToken.of(first.getName(), elements.subList(1, elements.size()));
        }
        LOGGER.warn("No operator joins {} top-level arguments, reading them as a conjunction: {}",
                elements.size(), render(elements));
        return ParseToken.of(AND, elements);
    }

    private static void recordAtomic(ParseToken operand, String sort, Map<String, String> atomics) {
        if (operand.isAtomic() && !isBinaryOperator(operand.getName())) {
            String existing = atomics.putIfAbsent(operand.getName(), sort);
            if (existing != null && !existing.equals(sort)) {
                LOGGER.debug("Atomic {} recorded as {}, also used as {}", operand.getName(), existing, sort);
            }
        }
    }

    private static String render(List<ParseToken> elements) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }
}
