package resqpack.exceptions;

/**
 * An OID, part or array handle that the caller asked for is not present.
 */
public class NotFoundException extends ResqException {
    private final String target;

    public NotFoundException(String target, String message) {
        super(message);
        this.target = target;
    }

    /**
     * The OID, part name or array path that could not be found.
     */
    public String getTarget() {
        return target;
    }
}
