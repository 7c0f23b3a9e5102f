package fol;

import fol.formula.Formula;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The symbols of a first-order language: how variables are spelled, which constants exist and which
 * function and predicate symbols are declared at which arity.
 * <p>
 * Equality, membership and the quantifiers are logical, they are always part of the language.
 */
public final class Language {

    /**
     * The first problem found by a well-formedness check.
     *
     * @param message what is wrong
     * @param node    the offending term or formula
     */
    public record Violation(String message, Object node) {
        @Override
        public String toString() {
            return message + ": " + node;
        }
    }

    public static class Constants {
        public static final Constant ZERO = new Constant("0");
        public static final Constant ONE = new Constant("1");
        public static final Constant NATURALS = new Constant("ℕ");
    }

    public static class Functions {
        public static final FSymbol succSym = new FSymbol("succ", 1);
        public static final FSymbol plusSym = new FSymbol("+", 2);
        public static final FSymbol timesSym = new FSymbol("*", 2);

        public static Function succ(Term t) {
            return new Function(succSym, List.of(t));
        }

        public static Function plus(Term left, Term right) {
            return new Function(plusSym, List.of(left, right));
        }

        public static Function times(Term left, Term right) {
            return new Function(timesSym, List.of(left, right));
        }
    }

    public static class Predicates {
        public static final PSymbol memberPSym = new PSymbol("∈", 2);
        public static final PSymbol lessPSym = new PSymbol("<", 2);

        public static Predicate member(Term element, Term domain) {
            return new Predicate(memberPSym, List.of(element, domain));
        }

        public static Predicate less(Term left, Term right) {
            return new Predicate(lessPSym, List.of(left, right));
        }
    }

    /**
     * Arithmetic over the naturals: variables {@code v1, v2, ...}, constants {@code 0} and {@code 1},
     * {@code succ}, {@code +}, {@code *} and {@code <}.
     */
    public static final Language ARITHMETIC = new Language(
            Pattern.compile("v[0-9]+"),
            Set.of(Constants.ZERO.name(), Constants.ONE.name()),
            Set.of(Functions.succSym, Functions.plusSym, Functions.timesSym),
            Set.of(Predicates.lessPSym));

    private final Pattern variablePattern;
    private final Set<String> constants;
    private final Set<FSymbol> functions;
    private final Set<PSymbol> predicates;

    public Language(Pattern variablePattern, Set<String> constants, Set<FSymbol> functions, Set<PSymbol> predicates) {
        this.variablePattern = variablePattern;
        this.constants = Set.copyOf(constants);
        this.functions = Set.copyOf(functions);
        this.predicates = Set.copyOf(predicates);
    }

    public boolean isVariable(String name) {
        return variablePattern.matcher(name).matches();
    }

    public boolean isConstant(String name) {
        return constants.contains(name);
    }

    public boolean isFunction(FSymbol symbol) {
        return functions.contains(symbol);
    }

    public boolean isPredicate(PSymbol symbol) {
        return predicates.contains(symbol);
    }

    public Language withConstants(String... names) {
        Set<String> newConstants = new HashSet<>(constants);
        newConstants.addAll(List.of(names));
        return new Language(variablePattern, newConstants, functions, predicates);
    }

    public Language withFunctions(FSymbol... symbols) {
        Set<FSymbol> newFunctions = new HashSet<>(functions);
        newFunctions.addAll(List.of(symbols));
        return new Language(variablePattern, constants, newFunctions, predicates);
    }

    public Language withPredicates(PSymbol... symbols) {
        Set<PSymbol> newPredicates = new HashSet<>(predicates);
        newPredicates.addAll(List.of(symbols));
        return new Language(variablePattern, constants, functions, newPredicates);
    }

    public void requireWellFormed(Term term) {
        var violation = term.checkWellFormed(this);
        if (violation.isPresent()) {
            throw new MalformedTermException(violation.get());
        }
    }

    public void requireWellFormed(Formula formula) {
        var violation = formula.checkWellFormed(this);
        if (violation.isPresent()) {
            throw new MalformedFormulaException(violation.get());
        }
    }

    @Override
    public String toString() {
        return "Language[variables=" + variablePattern + ", constants=" + constants
                + ", functions=" + functions + ", predicates=" + predicates + "]";
    }
}
