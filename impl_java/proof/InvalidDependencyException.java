package proof;

public class InvalidDependencyException extends ProofException {
    private final int index;
    private final int lineCount;

    public InvalidDependencyException(int index, int lineCount) {
        super(String.format("Invalid dependency index %d, the proof has %d lines", index, lineCount));
        this.index = index;
        this.lineCount = lineCount;
    }

    public int getIndex() {
        return index;
    }

    public int getLineCount() {
        return lineCount;
    }
}
