package proof;

import fol.Language;

import java.util.Objects;
import java.util.Optional;

/**
 * Settings of a {@link Proof}. With a {@code language} set, every assumption, target and claimed line must
 * be well formed in it, and so must the step and induction variable names.
 */
public record ProofOptions(String stepVariable, String inductionVariable, boolean builtinRules, Language language) {
    public static final String DEFAULT_STEP_VARIABLE = "k";
    public static final String DEFAULT_INDUCTION_VARIABLE = "n";

    public ProofOptions {
        Objects.requireNonNull(stepVariable, "stepVariable");
        Objects.requireNonNull(inductionVariable, "inductionVariable");
        if (language != null) {
            if (!language.isVariable(stepVariable)) {
                throw new IllegalArgumentException("Step variable " + stepVariable + " is not a variable of " + language);
            }
            if (!language.isVariable(inductionVariable)) {
                throw new IllegalArgumentException(
                        "Induction variable " + inductionVariable + " is not a variable of " + language);
            }
        }
    }

    public static ProofOptions defaults() {
        return new ProofOptions(DEFAULT_STEP_VARIABLE, DEFAULT_INDUCTION_VARIABLE, true, null);
    }

    public ProofOptions withStepVariable(String name) {
        return new ProofOptions(name, inductionVariable, builtinRules, language);
    }

    public ProofOptions withInductionVariable(String name) {
        return new ProofOptions(stepVariable, name, builtinRules, language);
    }

    public ProofOptions withBuiltinRules(boolean enabled) {
        return new ProofOptions(stepVariable, inductionVariable, enabled, language);
    }

    public ProofOptions withLanguage(Language enforced) {
        return new ProofOptions(stepVariable, inductionVariable, builtinRules, enforced);
    }

    public Optional<Language> enforcedLanguage() {
        return Optional.ofNullable(language);
    }
}
