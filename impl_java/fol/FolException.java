package fol;

/**
 * Base class for errors raised while building or transforming terms and formulas.
 */
public class FolException extends RuntimeException {
    public FolException(String message) {
        super(message);
    }
}
