package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A relation symbol applied to terms, e.g. {@code x < y} or {@code P(x)}.
 */
public record Predicate(PSymbol symbol, List<Term> args) implements Formula {
    private static final Set<String> INFIX_SYMBOLS = Set.of("=", "∈", "<", "≤", ">");

    public Predicate {
        args = List.copyOf(args);
        if (symbol.arity() != args.size()) {
            throw new IllegalArgumentException(
                    "Predicate " + symbol + " applied to " + args.size() + " arguments");
        }
    }

    public Predicate(String symbolStr, List<Term> args) {
        this(new PSymbol(symbolStr, args.size()), args);
    }

    public String name() {
        return symbol.name();
    }

    @Override
    public Formula applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public Formula replace(Term pattern, Term replacement) {
        List<Term> newArgs = args.stream().map(t -> t.replace(pattern, replacement)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return symbol.name();
        }
        if (args.size() == 2 && INFIX_SYMBOLS.contains(symbol.name())) {
            return "(" + args.get(0) + " " + symbol.name() + " " + args.get(1) + ")";
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> vars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public Set<Variable> freeVars() {
        return vars();
    }

    @Override
    public boolean isFree(Variable var) {
        return args.stream().anyMatch(t -> t.contains(var));
    }

    @Override
    public boolean isSubstitutable(Variable var, Term term) {
        return true;
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        if (symbol.equals(Language.Predicates.memberPSym)) {
            // membership is logical; its domain is opaque like a quantifier's
            return args.get(0).checkWellFormed(language);
        }
        if (!language.isPredicate(symbol)) {
            return Optional.of(new Language.Violation("bad relation/arity", this));
        }
        for (Term arg : args) {
            var violation = arg.checkWellFormed(language);
            if (violation.isPresent()) return violation;
        }
        return Optional.empty();
    }
}
