package resqpack.exceptions;

/**
 * Array shape or element type disagrees with the handle it is written to or
 * read from. Shapes are never coerced.
 */
public class ShapeMismatchException extends ResqException {
    private final String arrayPath;

    public ShapeMismatchException(String arrayPath, String message) {
        super(message);
        this.arrayPath = arrayPath;
    }

    public String getArrayPath() {
        return arrayPath;
    }
}
