package proof.tactics;

import proof.Proof;

public final class Tactics {
    public static final String INSTANTIATE_FORALL = "INSTANTIATE_FORALL";
    public static final String INSTANTIATE_IMPLICATION = "INSTANTIATE_IMPLICATION";
    public static final String INSTANTIATE_INDUCTION = "INSTANTIATE_INDUCTION";

    private Tactics() {
    }

    public static void registerDefaults(Proof proof) {
        proof.registerModificationRule(INSTANTIATE_FORALL, (p, args) -> {
            if (args.size() > 1) {
                throw new IllegalArgumentException(INSTANTIATE_FORALL + " takes at most one witness term");
            }
            p.instantiateForall(args.isEmpty() ? null : args.get(0));
        });
        proof.registerModificationRule(INSTANTIATE_IMPLICATION, (p, args) -> {
            requireNoArguments(INSTANTIATE_IMPLICATION, args.size());
            p.instantiateImplication();
        });
        proof.registerModificationRule(INSTANTIATE_INDUCTION, (p, args) -> {
            requireNoArguments(INSTANTIATE_INDUCTION, args.size());
            p.instantiateInduction();
        });
    }

    private static void requireNoArguments(String tactic, int count) {
        if (count != 0) {
            throw new IllegalArgumentException(tactic + " takes no arguments, got " + count);
        }
    }
}
