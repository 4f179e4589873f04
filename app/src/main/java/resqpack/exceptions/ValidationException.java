package resqpack.exceptions;

import java.util.List;
import java.util.stream.Collectors;

import resqpack.core.metadata.ValidationError;

public class ValidationException extends ResqException {
    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(ValidationError error) {
        this(List.of(error));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String describe(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            return "Validation failed";
        }
        return errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; "));
    }
}
