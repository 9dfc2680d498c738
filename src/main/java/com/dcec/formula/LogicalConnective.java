package com.dcec.formula;

/**
 * Propositional connectives with their operand-count constraints.
 */
public enum LogicalConnective {
    AND("and", "and", 2, Integer.MAX_VALUE),
    OR("or", "or", 2, Integer.MAX_VALUE),
    NOT("not", "not", 1, 1),
    IMPLIES("implies", "->", 2, 2),
    IFF("iff", "<->", 2, 2);

    private final String keyword;
    private final String symbol;
    private final int minOperands;
    private final int maxOperands;

    LogicalConnective(String keyword, String symbol, int minOperands, int maxOperands) {
        this.keyword = keyword;
        this.symbol = symbol;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public String getKeyword() { return keyword; }

    /**
     * Infix symbol used when rendering.
     */
    public String getSymbol() { return symbol; }

    public int getMinOperands() { return minOperands; }
    public int getMaxOperands() { return maxOperands; }

    public boolean acceptsOperandCount(int count) {
        return count >= minOperands && count <= maxOperands;
    }
}
