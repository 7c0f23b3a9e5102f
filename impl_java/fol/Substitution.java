package fol;

import fol.formula.Formula;
import fol.term.Term;
import fol.term.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simultaneous replacement of variables by terms. Immutable: every modifier returns a new instance.
 */
public final class Substitution {
    private final Map<Variable, Term> map;

    public Substitution() {
        this.map = Map.of();
    }

    private Substitution(Map<Variable, Term> map) {
        this.map = Collections.unmodifiableMap(map);
    }

    public static Substitution of(Variable var, Term term) {
        return new Substitution().and(var, term);
    }

    public Substitution and(Variable var, Term term) {
        Map<Variable, Term> newMap = new LinkedHashMap<>(map);
        newMap.put(var, term);
        return new Substitution(newMap);
    }

    public Term getOrDefault(Variable var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public Substitution without(Variable var) {
        if (!map.containsKey(var)) return this;
        Map<Variable, Term> newMap = new LinkedHashMap<>(map);
        newMap.remove(var);
        return new Substitution(newMap);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Map<Variable, Term> asMap() {
        return map;
    }

    public Term apply(Term term) {
        return term.applySub(this);
    }

    /**
     * Apply the substitution to a formula, refusing to capture any variable of the substituted terms.
     * The check is made at every quantifier on the way down, so it agrees with
     * {@link Formula#isSubstitutable} for each binding.
     *
     * @param formula the formula to substitute into
     * @return a new formula with every free occurrence of a bound variable replaced
     * @throws VariableCaptureException if some binding is not substitutable in {@code formula}
     */
    public Formula apply(Formula formula) {
        return formula.applySub(this);
    }

    /**
     * Called by a quantifier binding {@code binder} before descending into {@code body}.
     */
    public void checkCapture(Variable binder, Formula body) {
        for (var e : map.entrySet()) {
            if (e.getValue().contains(binder) && body.isFree(e.getKey())) {
                throw new VariableCaptureException(e.getKey(), e.getValue(), binder);
            }
        }
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
