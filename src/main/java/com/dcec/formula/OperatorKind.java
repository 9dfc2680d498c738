package com.dcec.formula;

import com.dcec.parsing.ParseToken;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Closed dispatch table from token operator names to formula constructors.
 * A token's kind is resolved once, then the builder switches on it.
 *
 * <p>Keywords always denote their operator. Single letters ({@code O},
 * {@code F}, {@code X}, {@code B}, {@code K}, {@code I}) only do so when the
 * token has the operator's arity, and {@code P} only when its one argument is
 * compound; otherwise the name is an ordinary predicate.
 */
public enum OperatorKind {
    AND(Category.CONNECTIVE, LogicalConnective.AND),
    OR(Category.CONNECTIVE, LogicalConnective.OR),
    NOT(Category.CONNECTIVE, LogicalConnective.NOT),
    IMPLIES(Category.CONNECTIVE, LogicalConnective.IMPLIES),
    IFF(Category.CONNECTIVE, LogicalConnective.IFF),
    FORALL(Category.QUANTIFIER, Quantifier.FORALL),
    EXISTS(Category.QUANTIFIER, Quantifier.EXISTS),
    OBLIGATORY(Category.DEONTIC, DeonticOperator.OBLIGATORY),
    PERMISSIBLE(Category.DEONTIC, DeonticOperator.PERMISSIBLE),
    FORBIDDEN(Category.DEONTIC, DeonticOperator.FORBIDDEN),
    BELIEF(Category.COGNITIVE, CognitiveOperator.BELIEF),
    KNOWLEDGE(Category.COGNITIVE, CognitiveOperator.KNOWLEDGE),
    INTENTION(Category.COGNITIVE, CognitiveOperator.INTENTION),
    DESIRE(Category.COGNITIVE, CognitiveOperator.DESIRE),
    PERCEPTION(Category.COGNITIVE, CognitiveOperator.PERCEPTION),
    ALWAYS(Category.TEMPORAL, TemporalOperator.ALWAYS),
    EVENTUALLY(Category.TEMPORAL, TemporalOperator.EVENTUALLY),
    NEXT(Category.TEMPORAL, TemporalOperator.NEXT),
    PREDICATE(Category.PREDICATE, null);

    public enum Category {
        CONNECTIVE(-1),
        QUANTIFIER(2),
        DEONTIC(1),
        COGNITIVE(2),
        TEMPORAL(1),
        PREDICATE(-1);

        private final int arity;

        Category(int arity) {
            this.arity = arity;
        }

        /**
         * Fixed operand count, or -1 when it varies.
         */
        public int getArity() {
            return arity;
        }
    }

    private static final Map<String, OperatorKind> KEYWORDS;
    private static final Map<String, OperatorKind> LETTERS;

    static {
        Map<String, OperatorKind> keywords = new HashMap<>();
        Map<String, OperatorKind> letters = new HashMap<>();
        for (OperatorKind kind : values()) {
            if (kind.operator instanceof LogicalConnective) {
                keywords.put(((LogicalConnective) kind.operator).getKeyword(), kind);
            } else if (kind.operator instanceof Quantifier) {
                keywords.put(((Quantifier) kind.operator).getKeyword(), kind);
            } else if (kind.operator instanceof DeonticOperator) {
                DeonticOperator deontic = (DeonticOperator) kind.operator;
                keywords.put(deontic.getKeyword(), kind);
                letters.put(deontic.getLetter(), kind);
            } else if (kind.operator instanceof CognitiveOperator) {
                CognitiveOperator cognitive = (CognitiveOperator) kind.operator;
                keywords.put(cognitive.getKeyword(), kind);
                if (cognitive.getLetter() != null) {
                    letters.put(cognitive.getLetter(), kind);
                }
            } else if (kind.operator instanceof TemporalOperator) {
                keywords.put(((TemporalOperator) kind.operator).getKeyword(), kind);
            }
        }
        keywords.put("ought", OBLIGATORY);
        keywords.put("permitted", PERMISSIBLE);
        letters.put("X", NEXT);
        KEYWORDS = Collections.unmodifiableMap(keywords);
        LETTERS = Collections.unmodifiableMap(letters);
    }

    private final Category category;
    private final Object operator;

    OperatorKind(Category category, Object operator) {
        this.category = category;
        this.operator = operator;
    }

    public Category getCategory() { return category; }

    public LogicalConnective getConnective() { return (LogicalConnective) operator; }
    public Quantifier getQuantifier() { return (Quantifier) operator; }
    public DeonticOperator getDeonticOperator() { return (DeonticOperator) operator; }
    public CognitiveOperator getCognitiveOperator() { return (CognitiveOperator) operator; }
    public TemporalOperator getTemporalOperator() { return (TemporalOperator) operator; }

    public static OperatorKind resolve(ParseToken token) {
        OperatorKind keyword = KEYWORDS.get(token.getName());
        if (keyword != null) {
            return keyword;
        }
        OperatorKind letter = LETTERS.get(token.getName());
        if (letter == null || token.getArity() != letter.category.getArity()) {
            return PREDICATE;
        }
        if (letter == PERMISSIBLE && token.getArg(0).isLeaf()) {
            return PREDICATE;
        }
        return letter;
    }

    /**
     * Whether the name is an operator keyword, which cannot stand alone as a proposition.
     */
    public static boolean isKeyword(String name) {
        return KEYWORDS.containsKey(name);
    }
}
