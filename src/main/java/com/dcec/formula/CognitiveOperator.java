package com.dcec.formula;

/**
 * Agent-indexed mental-state modalities.
 */
public enum CognitiveOperator {
    BELIEF("believes", "B"),
    KNOWLEDGE("knows", "K"),
    INTENTION("intends", "I"),
    DESIRE("desires", null),
    PERCEPTION("perceives", null);

    private final String keyword;
    private final String letter;

    CognitiveOperator(String keyword, String letter) {
        this.keyword = keyword;
        this.letter = letter;
    }

    public String getKeyword() { return keyword; }

    /**
     * Single-letter alias, or null when the operator has none.
     */
    public String getLetter() { return letter; }
}
