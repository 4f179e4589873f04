package resqpack.core.metadata;

import java.util.List;

/**
 * Cross-field check contributed by an object kind, run after the field by
 * field checks of its schema.
 */
@FunctionalInterface
public interface DocumentRule {
    List<ValidationError> check(MetadataDocument document);
}
