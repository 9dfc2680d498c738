package com.dcec.formula;

import java.util.Objects;

/**
 * A sorted variable symbol.
 */
public class Variable {
    private final String name;
    private final String sort;

    public Variable(String name, String sort) {
        this.name = Objects.requireNonNull(name, "name");
        this.sort = Objects.requireNonNull(sort, "sort");
    }

    public String getName() { return name; }
    public String getSort() { return sort; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable that = (Variable) o;
        return name.equals(that.name) && sort.equals(that.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sort);
    }

    @Override
    public String toString() {
        return name + ":" + sort;
    }
}
