package com.dcec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function signature: name, return sort and ordered argument sorts.
 * A zero-argument function is a constant.
 */
public class FunctionSymbol {
    private final String name;
    private final String returnSort;
    private final List<String> argumentSorts;

    public FunctionSymbol(String name, String returnSort, List<String> argumentSorts) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnSort = Objects.requireNonNull(returnSort, "returnSort");
        this.argumentSorts = Collections.unmodifiableList(new ArrayList<>(argumentSorts));
    }

    public String getName() { return name; }
    public String getReturnSort() { return returnSort; }
    public List<String> getArgumentSorts() { return argumentSorts; }
    public int getArity() { return argumentSorts.size(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionSymbol that = (FunctionSymbol) o;
        return name.equals(that.name)
                && returnSort.equals(that.returnSort)
                && argumentSorts.equals(that.argumentSorts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, returnSort, argumentSorts);
    }

    @Override
    public String toString() {
        return name + argumentSorts + " -> " + returnSort;
    }
}
