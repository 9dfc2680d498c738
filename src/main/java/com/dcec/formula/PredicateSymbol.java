package com.dcec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A predicate signature. Predicates are Boolean-valued functions.
 */
public class PredicateSymbol {
    private final String name;
    private final List<String> argumentSorts;

    public PredicateSymbol(String name) {
        this(name, Collections.emptyList());
    }

    public PredicateSymbol(String name, List<String> argumentSorts) {
        this.name = Objects.requireNonNull(name, "name");
        this.argumentSorts = Collections.unmodifiableList(new ArrayList<>(argumentSorts));
    }

    public String getName() { return name; }
    public List<String> getArgumentSorts() { return argumentSorts; }
    public int getArity() { return argumentSorts.size(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PredicateSymbol that = (PredicateSymbol) o;
        return name.equals(that.name) && argumentSorts.equals(that.argumentSorts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, argumentSorts);
    }

    @Override
    public String toString() {
        return name + argumentSorts;
    }
}
