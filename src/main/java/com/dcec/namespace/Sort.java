package com.dcec.namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named sort with its direct parents.
 */
public class Sort {
    private final String name;
    private final List<String> parents;

    public Sort(String name, List<String> parents) {
        this.name = name;
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
    }

    public String getName() { return name; }
    public List<String> getParents() { return parents; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sort sort = (Sort) o;
        return name.equals(sort.name) && parents.equals(sort.parents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parents);
    }

    @Override
    public String toString() {
        return parents.isEmpty() ? name : name + " <: " + parents;
    }
}
