package proof.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import proof.RuleViolationException;

public class PropositionalRulesTest {

    private final Formula p = new Predicate("P", List.of(new Variable("x")));
    private final Formula q = new Predicate("Q", List.of(new Variable("x")));

    @Test
    public void andJoinsInOrder() {
        AndRule rule = new AndRule();
        assertEquals(new And(p, q), rule.verify(List.of(p, q), new And(p, q)));
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> rule.verify(List.of(p, q), new And(q, p)));
        assertEquals(new And(p, q), e.getDerived());
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(p), new And(p, p)));
    }

    @Test
    public void eqIsReflexivityOnly() {
        EqRule rule = new EqRule();
        Constant a = new Constant("a");
        assertEquals(new Equals(a, a), rule.verify(List.of(), new Equals(a, a)));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), new Equals(a, new Constant("b"))));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(p), new Equals(a, a)));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), p));
    }

    @Test
    public void excludedMiddleShape() {
        ExcludedMiddleRule rule = new ExcludedMiddleRule();
        Formula lem = new Or(p, new Not(p));
        assertEquals(lem, rule.verify(List.of(), lem));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), new Or(new Not(p), p)));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), new Or(p, new Not(q))));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), new And(p, new Not(p))));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(p), lem));
    }

    @Test
    public void assumptionReadsTheLiveList() {
        List<Formula> held = new ArrayList<>(List.of(p));
        AssumptionRule rule = new AssumptionRule(() -> held);
        assertEquals(p, rule.verify(List.of(), p));
        assertThrows(RuleViolationException.class, () -> rule.verify(List.of(), q));

        held.add(q);
        assertEquals(q, rule.verify(List.of(), q));
    }
}
