package proof.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import fol.Language;
import fol.formula.Equals;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import java.util.List;
import org.junit.Test;
import proof.RuleViolationException;

public class InductionRuleTest {

    private static final Term N = Language.Constants.NATURALS;
    private static final Term ZERO = Language.Constants.ZERO;

    private final InductionRule rule = new InductionRule("n");
    private final Variable k = new Variable("k");
    private final Variable n = new Variable("n");
    private final Term kPlus1 = Language.Functions.plus(k, Language.Constants.ONE);

    private static Term sum(Term t) {
        return new Function("sum", List.of(t));
    }

    private final Formula base = new Equals(sum(ZERO), ZERO);
    private final Formula step = new Forall(k, N, new Implies(new Equals(sum(k), k), new Equals(sum(kPlus1), kPlus1)));

    @Test
    public void derivesTheUniversalClaim() {
        Formula claimed = new Forall(n, N, new Equals(sum(n), n));
        assertEquals(claimed, rule.verify(List.of(base, step), claimed));
    }

    @Test
    public void rejectsOtherBoundVariable() {
        Variable m = new Variable("m");
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(base, step), new Forall(m, N, new Equals(sum(m), m))));
        assertEquals(new Forall(n, N, new Equals(sum(n), n)), e.getDerived());
    }

    @Test
    public void rejectsOtherRightHandSide() {
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(base, step), new Forall(n, N, new Equals(sum(n), ZERO))));
    }

    @Test
    public void baseMustBeTheZeroInstance() {
        Formula wrongBase = new Equals(sum(ZERO), Language.Constants.ONE);
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(wrongBase, step), new Forall(n, N, new Equals(sum(n), n))));
        assertTrue(e.getDetail().startsWith("Base mismatch"));
    }

    @Test
    public void stepMustConcludeTheSuccessorInstance() {
        Formula wrongStep = new Forall(k, N, new Implies(new Equals(sum(k), k), new Equals(sum(k), k)));
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(base, wrongStep), new Forall(n, N, new Equals(sum(n), n))));
        assertTrue(e.getDetail().startsWith("Step conclusion mismatch"));
    }

    @Test
    public void stepMustBeUniversalImplication() {
        Formula claimed = new Forall(n, N, new Equals(sum(n), n));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(base, base), claimed));
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(base, new Forall(k, N, new Equals(sum(k), k))), claimed));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(step), claimed));
    }

    @Test
    public void inductionVariableMustNotAlreadyBeFree() {
        Formula pk = Language.Predicates.less(k, n);
        Formula freeBase = Language.Predicates.less(ZERO, n);
        Formula freeStep = new Forall(k, N, new Implies(pk, Language.Predicates.less(kPlus1, n)));
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(freeBase, freeStep), new Forall(n, N, Language.Predicates.less(n, n))));
        assertTrue(e.getDetail().contains("already free"));
    }

    @Test
    public void configurableInductionVariable() {
        Variable m = new Variable("m");
        Formula claimed = new Forall(m, N, new Equals(sum(m), m));
        assertEquals(claimed, new InductionRule("m").verify(List.of(base, step), claimed));
    }
}
