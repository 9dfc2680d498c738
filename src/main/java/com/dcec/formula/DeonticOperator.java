package com.dcec.formula;

/**
 * Deontic modalities: what an agent ought, may, or must not bring about.
 */
public enum DeonticOperator {
    OBLIGATORY("obligatory", "O"),
    PERMISSIBLE("permissible", "P"),
    FORBIDDEN("forbidden", "F");

    private final String keyword;
    private final String letter;

    DeonticOperator(String keyword, String letter) {
        this.keyword = keyword;
        this.letter = letter;
    }

    public String getKeyword() { return keyword; }
    public String getLetter() { return letter; }
}
