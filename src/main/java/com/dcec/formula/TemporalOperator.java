package com.dcec.formula;

public enum TemporalOperator {
    ALWAYS("always"),
    EVENTUALLY("eventually"),
    NEXT("next");

    private final String keyword;

    TemporalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() { return keyword; }
}
