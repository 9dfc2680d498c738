package com.dcec.namespace;

import com.dcec.formula.FunctionSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sort hierarchy, overloaded function signatures and atomic bindings for one
 * parsing/proving session. Every namespace starts with the root sort
 * {@code Object}, the sort {@code Boolean} and the wildcard {@code ?}; the
 * rest of the DCEC vocabulary is added through the {@code addBasic*} seeders.
 *
 * <p>Reads are safe from any thread. Mutators are serialized on the instance.
 */
public class Namespace {

    private static final Logger LOGGER = LoggerFactory.getLogger(Namespace.class);

    public static final String WILDCARD = "?";
    public static final String OBJECT = "Object";
    public static final String BOOLEAN = "Boolean";
    public static final String NUMERIC = "Numeric";

    /** Version of the vocabulary installed by the {@code addBasic*} seeders. */
    public static final String BASELINE_VERSION = "1.0";

    private final Map<String, List<String>> sorts = new ConcurrentHashMap<>();
    private final Map<String, List<FunctionSymbol>> functions = new ConcurrentHashMap<>();
    private final Map<String, String> atomics = new ConcurrentHashMap<>();

    public Namespace() {
        sorts.put(OBJECT, Collections.emptyList());
        sorts.put(BOOLEAN, Collections.singletonList(OBJECT));
    }

    // ---------------------------------------------------------------- sorts

    /**
     * Define a sort. Fails when a parent is undefined or when the name is
     * already defined with different parents; re-adding an identical
     * definition succeeds without change.
     */
    public synchronized boolean addSort(String name, String... parents) {
        if (name == null || name.isBlank() || WILDCARD.equals(name)) {
            LOGGER.warn("Rejected sort with invalid name: '{}'", name);
            return false;
        }
        List<String> parentList = Arrays.asList(parents);
        List<String> existing = sorts.get(name);
        if (existing != null) {
            if (existing.equals(parentList)) {
                return true;
            }
            LOGGER.warn("Sort {} already defined with parents {}, rejected redefinition with {}",
                    name, existing, parentList);
            return false;
        }
        for (String parent : parentList) {
            if (!sorts.containsKey(parent)) {
                LOGGER.warn("Cannot add sort {}: parent sort {} is undefined", name, parent);
                return false;
            }
        }
        sorts.put(name, Collections.unmodifiableList(new ArrayList<>(parentList)));
        LOGGER.debug("Added sort {} with parents {}", name, parentList);
        return true;
    }

    public boolean hasSort(String name) {
        return WILDCARD.equals(name) || sorts.containsKey(name);
    }

    public Optional<Sort> getSort(String name) {
        List<String> parents = sorts.get(name);
        return parents == null ? Optional.empty() : Optional.of(new Sort(name, parents));
    }

    public List<String> getParents(String name) {
        return sorts.getOrDefault(name, Collections.emptyList());
    }

    /**
     * Compatibility of {@code sort} with {@code target}: equal sorts are at
     * distance 0, the wildcard fits anything at distance 0, otherwise the
     * result is the fewest parent edges leading from {@code sort} up to
     * {@code target}. Distances add up along a chain of sorts.
     */
    public SortDistance noConflict(String sort, String target) {
        if (sort.equals(target) || WILDCARD.equals(sort) || WILDCARD.equals(target)) {
            return SortDistance.compatible(0);
        }
        if (!sorts.containsKey(sort)) {
            return SortDistance.incompatible();
        }
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(sort, 0);
        queue.add(sort);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int level = depth.get(current);
            for (String parent : getParents(current)) {
                if (depth.containsKey(parent)) {
                    continue;
                }
                if (parent.equals(target)) {
                    return SortDistance.compatible(level + 1);
                }
                depth.put(parent, level + 1);
                queue.add(parent);
            }
        }
        return SortDistance.incompatible();
    }

    // ------------------------------------------------------------ functions

    public boolean addFunction(String name, String returnSort, String... argumentSorts) {
        return addFunction(name, returnSort, Arrays.asList(argumentSorts));
    }

    /**
     * Register a signature. Identical signatures are deduplicated, distinct
     * ones accumulate as overloads. Fails when a sort is undefined.
     */
    public synchronized boolean addFunction(String name, String returnSort, List<String> argumentSorts) {
        if (!hasSort(returnSort)) {
            LOGGER.warn("Cannot add function {}: return sort {} is undefined", name, returnSort);
            return false;
        }
        for (String argumentSort : argumentSorts) {
            if (!hasSort(argumentSort)) {
                LOGGER.warn("Cannot add function {}: argument sort {} is undefined", name, argumentSort);
                return false;
            }
        }
        FunctionSymbol signature = new FunctionSymbol(name, returnSort, argumentSorts);
        List<FunctionSymbol> overloads = functions.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>());
        if (!overloads.contains(signature)) {
            overloads.add(signature);
            LOGGER.debug("Added function signature {}", signature);
        }
        return true;
    }

    public List<FunctionSymbol> getFunctions(String name) {
        List<FunctionSymbol> overloads = functions.get(name);
        return overloads == null ? Collections.emptyList() : new ArrayList<>(overloads);
    }

    public boolean hasFunction(String name, int arity) {
        for (FunctionSymbol signature : getFunctions(name)) {
            if (signature.getArity() == arity) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pick the overload of {@code name} whose parameters accept the given
     * argument sorts with the smallest total distance. Ties go to the
     * earliest registered signature.
     *
     * @param predicatesOnly restrict candidates to Boolean-valued signatures
     */
    public Optional<FunctionSymbol> resolveOverload(String name, List<String> argumentSorts, boolean predicatesOnly) {
        FunctionSymbol best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (FunctionSymbol candidate : getFunctions(name)) {
            if (candidate.getArity() != argumentSorts.size()) {
                continue;
            }
            if (predicatesOnly && !BOOLEAN.equals(candidate.getReturnSort())) {
                continue;
            }
            int total = 0;
            boolean fits = true;
            for (int i = 0; i < argumentSorts.size() && fits; i++) {
                SortDistance distance = noConflict(argumentSorts.get(i), candidate.getArgumentSorts().get(i));
                fits = distance.isCompatible();
                total += Math.max(distance.getDistance(), 0);
            }
            if (fits && total < bestDistance) {
                best = candidate;
                bestDistance = total;
            }
        }
        return Optional.ofNullable(best);
    }

    // -------------------------------------------------------------- atomics

    /**
     * Bind an atomic name to a sort. The first binding wins: rebinding to a
     * different sort fails, rebinding to the same sort is a no-op.
     */
    public synchronized boolean addAtomic(String name, String sort) {
        if (!hasSort(sort)) {
            LOGGER.warn("Cannot bind atomic {}: sort {} is undefined", name, sort);
            return false;
        }
        String existing = atomics.putIfAbsent(name, sort);
        if (existing != null && !existing.equals(sort)) {
            LOGGER.warn("Atomic {} is already bound to sort {}, rejected rebinding to {}", name, existing, sort);
            return false;
        }
        return true;
    }

    public Optional<String> getAtomicSort(String name) {
        return Optional.ofNullable(atomics.get(name));
    }

    public Map<String, String> getAtomics() {
        return Collections.unmodifiableMap(new HashMap<>(atomics));
    }

    // -------------------------------------------------------------- seeders

    /**
     * Event-calculus sorts and the standard DCEC functions over them.
     */
    public synchronized void addBasicDcec() {
        addSort(OBJECT);
        addSort(BOOLEAN, OBJECT);
        addSort("Agent", OBJECT);
        addSort("ActionType", OBJECT);
        addSort("Event", OBJECT);
        addSort("Action", "Event");
        addSort("Moment", OBJECT);
        addSort("Fluent", OBJECT);

        addFunction("action", "Action", "Agent", "ActionType");
        addFunction("initially", BOOLEAN, "Fluent");
        addFunction("holds", BOOLEAN, "Fluent", "Moment");
        addFunction("happens", BOOLEAN, "Event", "Moment");
        addFunction("clipped", BOOLEAN, "Moment", "Fluent", "Moment");
        addFunction("initiates", BOOLEAN, "Event", "Fluent", "Moment");
        addFunction("terminates", BOOLEAN, "Event", "Fluent", "Moment");
        addFunction("prior", BOOLEAN, "Moment", "Moment");
        LOGGER.debug("Seeded basic DCEC vocabulary (baseline {})", BASELINE_VERSION);
    }

    public synchronized void addBasicLogic() {
        addSort(OBJECT);
        addSort(BOOLEAN, OBJECT);
        addFunction("and", BOOLEAN, BOOLEAN, BOOLEAN);
        addFunction("or", BOOLEAN, BOOLEAN, BOOLEAN);
        addFunction("implies", BOOLEAN, BOOLEAN, BOOLEAN);
        addFunction("iff", BOOLEAN, BOOLEAN, BOOLEAN);
        addFunction("not", BOOLEAN, BOOLEAN);
    }

    public synchronized void addBasicNumerics() {
        addSort(OBJECT);
        addSort(NUMERIC, OBJECT);
        for (String op : new String[]{"add", "sub", "multiply", "divide", "exponent"}) {
            addFunction(op, NUMERIC, NUMERIC, NUMERIC);
        }
        for (String comparison : new String[]{"greater", "less", "greaterOrEqual", "lessOrEqual"}) {
            addFunction(comparison, BOOLEAN, NUMERIC, NUMERIC);
        }
    }

    /**
     * A namespace with all three baseline vocabularies installed.
     */
    public static Namespace seeded() {
        Namespace namespace = new Namespace();
        namespace.addBasicDcec();
        namespace.addBasicLogic();
        namespace.addBasicNumerics();
        return namespace;
    }

    public NamespaceStats getStats() {
        int signatures = 0;
        for (List<FunctionSymbol> overloads : functions.values()) {
            signatures += overloads.size();
        }
        return new NamespaceStats(sorts.size(), functions.size(), signatures, atomics.size());
    }

    @Override
    public String toString() {
        return "Namespace{" + getStats() + '}';
    }
}
