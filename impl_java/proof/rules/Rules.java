package proof.rules;

import proof.Proof;

/**
 * Names of the built-in line rules.
 */
public final class Rules {
    public static final String ASSUMPTION = "ASSUMPTION";
    public static final String AND = "AND";
    public static final String EQ = "EQ";
    public static final String FORALL = "FORALL";
    public static final String LEM = "LEM";
    public static final String CASES = "CASES";
    public static final String INDUCTION = "INDUCTION";

    private Rules() {
    }

    public static void registerDefaults(Proof proof) {
        proof.registerRule(ASSUMPTION, new AssumptionRule(proof::getAssumptions));
        proof.registerRule(AND, new AndRule());
        proof.registerRule(EQ, new EqRule());
        proof.registerRule(FORALL, new ForallRule());
        proof.registerRule(LEM, new ExcludedMiddleRule());
        proof.registerRule(CASES, new CasesRule());
        proof.registerRule(INDUCTION, new InductionRule(proof.getOptions().inductionVariable()));
    }
}
