package resqpack.exceptions;

/**
 * A conflicting in-place update was detected: a document changed between the
 * read and the write of a read-modify-write, or another save holds the
 * destination container.
 */
public class ConcurrentUpdateException extends ResqException {
    private final String target;

    public ConcurrentUpdateException(String target, String message) {
        super(message);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
