package com.dcec.formula;

import com.dcec.namespace.Namespace;
import com.dcec.parsing.ParseToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts token trees into typed formulas against a {@link Namespace}.
 *
 * <p>Leaves in formula position become propositions. Leaves in term position
 * become variables when they start with a lowercase letter (the bindings map
 * hands out one {@link Variable} per name) and constants otherwise. A
 * constant keeps the sort it was first bound to in the namespace; one first
 * seen only as a term is bound to the wildcard sort and may still be used as a
 * proposition. Unknown
 * predicates and functions are registered with wildcard argument sorts; known
 * ones are resolved by overload. A token whose shape fits no rule yields an
 * empty result and a log line, never an exception.
 */
public class FormulaBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaBuilder.class);

    public Optional<Formula> tokenToFormula(ParseToken token, Namespace namespace, Map<String, Variable> bindings) {
        return tokenToFormula(token, namespace, bindings, Collections.emptyMap());
    }

    /**
     * @param atomics sorts recorded for atomic names while the token tree was
     *                built; used for constants the namespace does not know
     */
    public Optional<Formula> tokenToFormula(ParseToken token, Namespace namespace, Map<String, Variable> bindings,
                                            Map<String, String> atomics) {
        return formula(token, new Scope(namespace, bindings, atomics));
    }

    private Optional<Formula> formula(ParseToken token, Scope scope) {
        if (token.isAtomic()) {
            return proposition(token, scope);
        }
        OperatorKind kind = OperatorKind.resolve(token);
        switch (kind.getCategory()) {
            case CONNECTIVE:
                return connective(token, kind.getConnective(), scope);
            case QUANTIFIER:
                return quantified(token, kind.getQuantifier(), scope);
            case DEONTIC:
                if (token.getArity() != 1) {
                    return reject(token, kind + " takes exactly one formula");
                }
                return formula(token.getArg(0), scope)
                        .map(inner -> new DeonticFormula(kind.getDeonticOperator(), inner));
            case COGNITIVE:
                return cognitive(token, kind.getCognitiveOperator(), scope);
            case TEMPORAL:
                if (token.getArity() != 1) {
                    return reject(token, kind + " takes exactly one formula");
                }
                return formula(token.getArg(0), scope)
                        .map(inner -> new TemporalFormula(kind.getTemporalOperator(), inner));
            default:
                return atomic(token, scope);
        }
    }

    private Optional<Formula> proposition(ParseToken token, Scope scope) {
        String name = token.getName();
        if (OperatorKind.isKeyword(name)) {
            return reject(token, "operator '" + name + "' has no operands");
        }
        if (!scope.isWildcardConstant(name) && !scope.namespace.addAtomic(name, Namespace.BOOLEAN)) {
            return reject(token, "'" + name + "' is bound to sort "
                    + scope.namespace.getAtomicSort(name).orElse("?") + ", not Boolean");
        }
        return resolvePredicate(token, Collections.emptyList(), scope)
                .map(predicate -> new AtomicFormula(predicate, Collections.emptyList()));
    }

    private Optional<Formula> connective(ParseToken token, LogicalConnective connective, Scope scope) {
        if (!connective.acceptsOperandCount(token.getArity())) {
            return reject(token, connective + " cannot take " + token.getArity() + " operand(s)");
        }
        List<Formula> operands = new ArrayList<>(token.getArity());
        for (ParseToken arg : token.getArgs()) {
            Optional<Formula> operand = formula(arg, scope);
            if (operand.isEmpty()) {
                return Optional.empty();
            }
            operands.add(operand.get());
        }
        return Optional.of(new ConnectiveFormula(connective, operands));
    }

    private Optional<Formula> quantified(ParseToken token, Quantifier quantifier, Scope scope) {
        if (token.getArity() != 2 || !token.getArg(0).isAtomic()) {
            return reject(token, quantifier + " needs a variable and a body");
        }
        String name = token.getArg(0).getName();
        Variable variable = new Variable(name, scope.sortOf(name));
        Map<String, Variable> inner = new HashMap<>(scope.bindings);
        inner.put(name, variable);
        return formula(token.getArg(1), scope.with(inner))
                .map(body -> new QuantifiedFormula(quantifier, variable, body));
    }

    private Optional<Formula> cognitive(ParseToken token, CognitiveOperator operator, Scope scope) {
        if (token.getArity() != 2) {
            return reject(token, operator + " takes an agent and a formula");
        }
        Optional<Term> agent = term(token.getArg(0), scope);
        if (agent.isEmpty()) {
            return Optional.empty();
        }
        return formula(token.getArg(1), scope)
                .map(inner -> new CognitiveFormula(operator, agent.get(), inner));
    }

    private Optional<Formula> atomic(ParseToken token, Scope scope) {
        List<Term> arguments = new ArrayList<>(token.getArity());
        for (ParseToken arg : token.getArgs()) {
            Optional<Term> term = term(arg, scope);
            if (term.isEmpty()) {
                return Optional.empty();
            }
            arguments.add(term.get());
        }
        return resolvePredicate(token, arguments, scope)
                .map(predicate -> new AtomicFormula(predicate, arguments));
    }

    private Optional<Term> term(ParseToken token, Scope scope) {
        String name = token.getName();
        if (token.isLeaf() && isVariableName(name)) {
            Variable variable = scope.bindings.computeIfAbsent(name, n -> new Variable(n, scope.sortOf(n)));
            return Optional.of(new VariableTerm(variable));
        }
        if (token.isAtomic()) {
            return Optional.of(FunctionTerm.constant(name, scope.bindConstant(name)));
        }

        List<Term> arguments = new ArrayList<>(token.getArity());
        List<String> sorts = new ArrayList<>(token.getArity());
        for (ParseToken arg : token.getArgs()) {
            Optional<Term> argument = term(arg, scope);
            if (argument.isEmpty()) {
                return Optional.empty();
            }
            arguments.add(argument.get());
            sorts.add(argument.get().getSort());
        }
        Optional<FunctionSymbol> signature = scope.namespace.resolveOverload(name, sorts, false);
        if (signature.isPresent()) {
            return Optional.of(new FunctionTerm(signature.get(), arguments));
        }
        List<String> wildcards = Collections.nCopies(arguments.size(), Namespace.WILDCARD);
        if (scope.namespace.resolveOverload(name, wildcards, false).isPresent()) {
            LOGGER.warn("No overload of function {} accepts argument sorts {}", name, sorts);
            return Optional.empty();
        }
        scope.namespace.addFunction(name, Namespace.WILDCARD, wildcards);
        return Optional.of(new FunctionTerm(new FunctionSymbol(name, Namespace.WILDCARD, wildcards), arguments));
    }

    private Optional<PredicateSymbol> resolvePredicate(ParseToken token, List<Term> arguments, Scope scope) {
        String name = token.getName();
        List<String> sorts = new ArrayList<>(arguments.size());
        for (Term argument : arguments) {
            sorts.add(argument.getSort());
        }
        Optional<FunctionSymbol> signature = scope.namespace.resolveOverload(name, sorts, true);
        if (signature.isPresent()) {
            return Optional.of(new PredicateSymbol(name, signature.get().getArgumentSorts()));
        }
        List<String> wildcards = Collections.nCopies(arguments.size(), Namespace.WILDCARD);
        if (scope.namespace.resolveOverload(name, wildcards, true).isPresent()) {
            LOGGER.warn("Cannot build formula from {}: no overload of predicate {} accepts argument sorts {}",
                    token, name, sorts);
            return Optional.empty();
        }
        scope.namespace.addFunction(name, Namespace.BOOLEAN, wildcards);
        LOGGER.debug("Registered predicate {}/{} with wildcard arguments", name, arguments.size());
        return Optional.of(new PredicateSymbol(name, wildcards));
    }

    private static boolean isVariableName(String name) {
        return Character.isLowerCase(name.charAt(0));
    }

    private static <T> Optional<T> reject(ParseToken token, String reason) {
        LOGGER.warn("Cannot build formula from {}: {}", token, reason);
        return Optional.empty();
    }

    private static final class Scope {
        private final Namespace namespace;
        private final Map<String, Variable> bindings;
        private final Map<String, String> atomics;

        private Scope(Namespace namespace, Map<String, Variable> bindings, Map<String, String> atomics) {
            this.namespace = namespace;
            this.bindings = bindings;
            this.atomics = atomics;
        }

        private Scope with(Map<String, Variable> innerBindings) {
            return new Scope(namespace, innerBindings, atomics);
        }

        private String sortOf(String name) {
            return namespace.getAtomicSort(name).orElse(atomics.getOrDefault(name, Namespace.WILDCARD));
        }

        /**
         * The sort of a constant is fixed by its first use in the namespace,
         * so the same name builds the same term in every later parse.
         */
        private String bindConstant(String name) {
            String sort = sortOf(name);
            namespace.addAtomic(name, sort);
            return namespace.getAtomicSort(name).orElse(sort);
        }

        private boolean isWildcardConstant(String name) {
            return Namespace.WILDCARD.equals(namespace.getAtomicSort(name).orElse(null));
        }
    }
}
