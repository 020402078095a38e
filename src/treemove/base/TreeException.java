package treemove.base;

/**
 * Thrown when a tree operation cannot be applied. The tree is left untouched unless
 * the exception is a {@link PartialMoveException}.
 */
public class TreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TreeError error;

    public TreeException(TreeError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public TreeException(TreeError error, String message, Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public TreeError getError() {
        return error;
    }
}
