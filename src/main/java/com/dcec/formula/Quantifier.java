package com.dcec.formula;

public enum Quantifier {
    FORALL("forall"),
    EXISTS("exists");

    private final String keyword;

    Quantifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() { return keyword; }
}
