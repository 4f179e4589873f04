package resqpack.exceptions;

/**
 * The container, or one part of it, is structurally unreadable or fails a
 * consistency or checksum check.
 */
public class CorruptionException extends ResqException {
    private final String partName;

    public CorruptionException(String partName, String message) {
        super(message);
        this.partName = partName;
    }

    public CorruptionException(String partName, String message, Throwable cause) {
        super(message, cause);
        this.partName = partName;
    }

    public String getPartName() {
        return partName;
    }
}
