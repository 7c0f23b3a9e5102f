package fol.term;

import fol.Language;
import fol.Substitution;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record Function(FSymbol symbol, List<Term> args) implements Term {
    private static final Set<String> INFIX_SYMBOLS = Set.of("+", "*", "∈");

    public Function {
        args = List.copyOf(args);
        if (symbol.arity() != args.size()) {
            throw new IllegalArgumentException(
                    "Function " + symbol + " applied to " + args.size() + " arguments");
        }
    }

    public Function(String name, List<Term> args) {
        this(new FSymbol(name, args.size()), args);
    }

    public String name() {
        return symbol.name();
    }

    @Override
    public Term applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Function(symbol, newArgs);
    }

    @Override
    public Term replace(Term pattern, Term replacement) {
        if (equals(pattern)) return replacement;
        List<Term> newArgs = args.stream().map(t -> t.replace(pattern, replacement)).toList();
        return new Function(symbol, newArgs);
    }

    @Override
    public String toString() {
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
    public boolean contains(Variable var) {
        return args.stream().anyMatch(t -> t.contains(var));
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        if (!language.isFunction(symbol)) {
            return Optional.of(new Language.Violation("bad function/arity", this));
        }
        for (Term arg : args) {
            var violation = arg.checkWellFormed(language);
            if (violation.isPresent()) return violation;
        }
        return Optional.empty();
    }
}
