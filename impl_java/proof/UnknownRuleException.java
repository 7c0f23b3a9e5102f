package proof;

public class UnknownRuleException extends ProofException {
    private final String ruleName;

    public UnknownRuleException(String ruleName) {
        super("Unknown rule: " + ruleName);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
