package proof;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import fol.Language;
import fol.MalformedFormulaException;
import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Term;
import fol.term.Variable;
import java.util.List;
import org.junit.Test;
import proof.rules.AndRule;
import proof.rules.Rules;

public class ProofTest {

    private final Variable x = new Variable("x");
    private final Variable y = new Variable("y");
    private final Formula xEq2 = new Equals(x, new Constant("2"));
    private final Formula yEq3 = new Equals(y, new Constant("3"));

    @Test
    public void andProof() {
        Formula target = new And(xEq2, yEq3);
        Proof proof = new Proof(List.of(xEq2, yEq3), target);

        assertEquals(0, proof.addLine(xEq2, Rules.ASSUMPTION));
        assertEquals(1, proof.addLine(yEq3, Rules.ASSUMPTION));
        assertFalse(proof.isValid());
        assertEquals(2, proof.addLine(target, Rules.AND, 0, 1));

        assertTrue(proof.isValid());
        assertTrue(proof.getTargets().isEmpty());
        assertEquals(new ProofLine(target, Rules.AND, List.of(0, 1)), proof.getLines().get(2));
    }

    @Test
    public void excludedMiddleProof() {
        Formula px = new Predicate("P", List.of(x));
        Formula target = new Or(px, new Not(px));
        Proof proof = new Proof(List.of(), target);

        proof.addLine(target, Rules.LEM);

        assertTrue(proof.isValid());
    }

    @Test
    public void forallProof() {
        Term set = new Constant("X");
        Term five = new Constant("5");
        Formula yInX = Language.Predicates.member(y, set);
        Formula forallX = new Forall(x, set, new Equals(x, five));
        Formula target = new Equals(y, five);
        Proof proof = new Proof(List.of(yInX, forallX), target);

        proof.addLine(yInX, Rules.ASSUMPTION);
        proof.addLine(forallX, Rules.ASSUMPTION);
        proof.addLine(target, Rules.FORALL, 1, 0);

        assertTrue(proof.isValid());
    }

    @Test
    public void unknownRule() {
        Proof proof = new Proof(List.of(xEq2), xEq2);
        UnknownRuleException e = assertThrows(UnknownRuleException.class, () -> proof.addLine(xEq2, "MODUS_PONENS"));
        assertEquals("MODUS_PONENS", e.getRuleName());
        assertTrue(proof.getLines().isEmpty());
    }

    @Test
    public void dependenciesMustReferToEarlierLines() {
        Proof proof = new Proof(List.of(xEq2, yEq3), new And(xEq2, yEq3));
        proof.addLine(xEq2, Rules.ASSUMPTION);

        InvalidDependencyException e = assertThrows(InvalidDependencyException.class,
                () -> proof.addLine(new And(xEq2, xEq2), Rules.AND, 0, 1));
        assertEquals(1, e.getIndex());
        assertEquals(1, e.getLineCount());
        assertThrows(InvalidDependencyException.class,
                () -> proof.addLine(new And(xEq2, xEq2), Rules.AND, 0, -1));
        assertThrows(InvalidDependencyException.class,
                () -> proof.addLine(new And(xEq2, xEq2), Rules.AND, 0, 7));

        assertEquals(1, proof.getLines().size());
        proof.addLine(new And(xEq2, xEq2), Rules.AND, 0, 0);
        assertEquals(2, proof.getLines().size());
    }

    @Test
    public void rejectedLineLeavesProofUnchanged() {
        Formula target = new And(xEq2, yEq3);
        Proof proof = new Proof(List.of(xEq2, yEq3), target);
        proof.addLine(xEq2, Rules.ASSUMPTION);
        proof.addLine(yEq3, Rules.ASSUMPTION);
        String before = proof.describe();

        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> proof.addLine(new And(yEq3, xEq2), Rules.AND, 0, 1));

        assertEquals(Rules.AND, e.getRuleName());
        assertEquals(new And(yEq3, xEq2), e.getClaimed());
        assertEquals(target, e.getDerived());
        assertEquals(before, proof.describe());
        assertEquals(List.of(target), proof.getTargets());
    }

    @Test
    public void assumptionMustBeHeld() {
        Proof proof = new Proof(List.of(xEq2), yEq3);
        RuleViolationException e = assertThrows(RuleViolationException.class,
                () -> proof.addLine(yEq3, Rules.ASSUMPTION));
        assertEquals(Rules.ASSUMPTION, e.getRuleName());
        assertNull(e.getDerived());
    }

    @Test
    public void dischargeRemovesExactlyOneOccurrence() {
        Proof proof = new Proof(List.of(xEq2), xEq2);
        proof.registerModificationRule("DUPLICATE", (p, args) -> p.addTarget(p.getActiveTarget()));
        proof.applyModificationRule("DUPLICATE");
        assertEquals(List.of(xEq2, xEq2), proof.getTargets());

        proof.addLine(xEq2, Rules.ASSUMPTION);
        assertEquals(List.of(xEq2), proof.getTargets());
        assertFalse(proof.isValid());

        proof.addLine(xEq2, Rules.ASSUMPTION);
        assertTrue(proof.isValid());
    }

    @Test
    public void dischargeBeforeActiveTargetKeepsItActive() {
        Formula a = xEq2;
        Formula b = yEq3;
        Formula c = new Equals(x, y);
        Proof proof = new Proof(List.of(a), a);
        proof.registerModificationRule("MORE", (p, args) -> {
            p.addTarget(b);
            p.addTarget(c);
        });
        proof.applyModificationRule("MORE");
        proof.focusTarget(2);

        proof.addLine(a, Rules.ASSUMPTION);

        assertEquals(List.of(b, c), proof.getTargets());
        assertEquals(1, proof.getActiveTargetIndex());
        assertEquals(c, proof.getActiveTarget());
    }

    @Test
    public void dischargeAfterActiveTargetLeavesIndex() {
        Formula a = xEq2;
        Formula b = yEq3;
        Proof proof = new Proof(List.of(b), a);
        proof.registerModificationRule("MORE", (p, args) -> p.addTarget(b));
        proof.applyModificationRule("MORE");

        proof.addLine(b, Rules.ASSUMPTION);

        assertEquals(0, proof.getActiveTargetIndex());
        assertEquals(a, proof.getActiveTarget());
    }

    @Test
    public void noActiveTargetOnceComplete() {
        Proof proof = new Proof(List.of(xEq2), xEq2);
        proof.addLine(xEq2, Rules.ASSUMPTION);
        assertTrue(proof.isValid());
        assertThrows(NoActiveTargetException.class, proof::getActiveTarget);
        assertThrows(NoActiveTargetException.class, () -> proof.instantiateForall());
        assertThrows(NoActiveTargetException.class, () -> proof.focusTarget(0));
        assertTrue(proof.describe().contains("<all targets completed>"));
    }

    @Test
    public void customRulesCanBeRegisteredAndReplaced() {
        Formula claim = new Equals(y, x);
        Proof proof = new Proof(List.of(new Equals(x, y)), claim);
        proof.registerRule("SYM", (deps, claimed) -> {
            Equals eq = (Equals) deps.get(0);
            return new Equals(eq.right(), eq.left());
        });
        proof.addLine(new Equals(x, y), Rules.ASSUMPTION);

        proof.registerRule("SYM", (deps, claimed) -> deps.get(0));
        RuleViolationException e = assertThrows(RuleViolationException.class, () -> proof.addLine(claim, "SYM", 0));
        assertEquals(new Equals(x, y), e.getDerived());

        proof.registerRule("SYM", (deps, claimed) -> {
            Equals eq = (Equals) deps.get(0);
            return new Equals(eq.right(), eq.left());
        });
        proof.addLine(claim, "SYM", 0);
        assertTrue(proof.isValid());
    }

    @Test
    public void builtinRulesCanBeLeftOut() {
        Proof proof = new Proof(List.of(xEq2), xEq2, ProofOptions.defaults().withBuiltinRules(false));
        assertFalse(proof.hasRule(Rules.ASSUMPTION));
        assertThrows(UnknownRuleException.class, () -> proof.addLine(xEq2, Rules.ASSUMPTION));

        proof.registerRule(Rules.AND, new AndRule());
        assertTrue(proof.hasRule(Rules.AND));
    }

    @Test
    public void enforcedLanguageRejectsMalformedStatements() {
        Variable v1 = new Variable("v1");
        Formula good = new Equals(v1, v1);
        ProofOptions options = ProofOptions.defaults()
                .withStepVariable("v8")
                .withInductionVariable("v9")
                .withLanguage(Language.ARITHMETIC);

        assertThrows(MalformedFormulaException.class, () -> new Proof(List.of(), xEq2, options));

        Proof proof = new Proof(List.of(), good, options);
        assertThrows(MalformedFormulaException.class, () -> proof.addLine(new Equals(x, x), Rules.EQ));
        proof.addLine(good, Rules.EQ);
        assertTrue(proof.isValid());
    }

    @Test
    public void optionsMustUseVariablesOfTheEnforcedLanguage() {
        assertThrows(IllegalArgumentException.class,
                () -> ProofOptions.defaults().withLanguage(Language.ARITHMETIC));
        assertThrows(IllegalArgumentException.class,
                () -> ProofOptions.defaults().withStepVariable("v1").withLanguage(Language.ARITHMETIC));

        ProofOptions options = ProofOptions.defaults()
                .withStepVariable("v1")
                .withInductionVariable("v2")
                .withLanguage(Language.ARITHMETIC);
        assertEquals(Language.ARITHMETIC, options.enforcedLanguage().get());
    }

    @Test
    public void describeListsEverything() {
        Formula target = new And(xEq2, yEq3);
        Proof proof = new Proof(List.of(xEq2, yEq3), target);
        proof.addLine(xEq2, Rules.ASSUMPTION);
        proof.addLine(yEq3, Rules.ASSUMPTION);

        String dump = proof.describe();
        assertTrue(dump.contains("[0] (x = 2)"));
        assertTrue(dump.contains("(1) (y = 3)    [ASSUMPTION]"));
        assertTrue(dump.contains("Targets (1 remaining)"));
        assertTrue(dump.contains("[0] ((x = 2) ∧ (y = 3))   <-- active goal"));

        proof.addLine(target, Rules.AND, 0, 1);
        assertTrue(proof.describe().contains("(2) ((x = 2) ∧ (y = 3))    [AND deps: 0 1]"));
    }
}
