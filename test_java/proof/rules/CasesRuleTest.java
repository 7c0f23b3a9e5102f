package proof.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Predicate;
import java.util.List;
import org.junit.Test;
import proof.RuleViolationException;

public class CasesRuleTest {

    private final CasesRule rule = new CasesRule();
    private final Formula p = new Predicate("P", List.of());
    private final Formula q = new Predicate("Q", List.of());
    private final Formula r = new Predicate("R", List.of());

    @Test
    public void positiveCaseFirst() {
        assertEquals(q, rule.verify(List.of(new Implies(p, q), new Implies(new Not(p), q)), q));
    }

    @Test
    public void negatedCaseFirst() {
        assertEquals(q, rule.verify(List.of(new Implies(new Not(p), q), new Implies(p, q)), q));
    }

    @Test
    public void antecedentsMustBeComplementary() {
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(new Implies(p, q), new Implies(new Not(r), q)), q));
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(new Implies(p, q), new Implies(p, q)), q));
    }

    @Test
    public void bothCasesMustConcludeTheClaim() {
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(new Implies(p, q), new Implies(new Not(p), r)), q));
        assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(new Implies(p, q), new Implies(new Not(p), q)), r));
    }

    @Test
    public void inputsMustBeImplications() {
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(p, new Implies(new Not(p), q)), q));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(new Implies(p, q)), q));
    }
}
