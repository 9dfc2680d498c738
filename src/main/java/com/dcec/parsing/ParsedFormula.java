package com.dcec.parsing;

import com.dcec.formula.Formula;

import java.util.Objects;

/**
 * Source text with the token tree and formula it produced.
 */
public class ParsedFormula {
    private final String text;
    private final ParseToken token;
    private final Formula formula;

    public ParsedFormula(String text, ParseToken token, Formula formula) {
        this.text = text;
        this.token = token;
        this.formula = Objects.requireNonNull(formula, "formula");
    }

    public String getText() { return text; }
    public ParseToken getToken() { return token; }
    public Formula getFormula() { return formula; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParsedFormula that = (ParsedFormula) o;
        return Objects.equals(text, that.text) && Objects.equals(token, that.token) && formula.equals(that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, token, formula);
    }

    @Override
    public String toString() {
        return "ParsedFormula{text='" + text + "', formula=" + formula.render() + '}';
    }
}
