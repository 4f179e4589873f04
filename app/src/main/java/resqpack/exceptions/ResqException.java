package resqpack.exceptions;

/**
 * Root of the checked exceptions raised by the package engine. Every subclass
 * names the object, part, field or array it is about in its message.
 */
public class ResqException extends Exception {
    public ResqException(String message) {
        super(message);
    }

    public ResqException(String message, Throwable cause) {
        super(message, cause);
    }
}
