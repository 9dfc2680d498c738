package com.dcec.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of the token tree: an operator name with ordered children. A leaf is
 * a bare name with no children; a compound token with no children comes from
 * a parenthesized single name such as {@code (P)}.
 */
public class ParseToken {
    private final String name;
    private final List<ParseToken> args;
    private final boolean leaf;

    private ParseToken(String name, List<ParseToken> args, boolean leaf) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = args;
        this.leaf = leaf;
    }

    public static ParseToken leaf(String name) {
        return new ParseToken(name, Collections.emptyList(), true);
    }

    public static ParseToken of(String name, List<ParseToken> args) {
        return new ParseToken(name, Collections.unmodifiableList(new ArrayList<>(args)), false);
    }

    public String getName() { return name; }
    public List<ParseToken> getArgs() { return args; }
    public boolean isLeaf() { return leaf; }
    public int getArity() { return args.size(); }

    public ParseToken getArg(int index) {
        return args.get(index);
    }

    /**
     * True for leaves and for compound tokens without children.
     */
    public boolean isAtomic() {
        return args.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseToken that = (ParseToken) o;
        return leaf == that.leaf && name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, leaf);
    }

    /**
     * S-expression form, e.g. {@code (implies P Q)}.
     */
    @Override
    public String toString() {
        if (leaf) {
            return name;
        }
        StringBuilder sb = new StringBuilder("(").append(name);
        for (ParseToken arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.append(')').toString();
    }
}
