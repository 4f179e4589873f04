package resqpack.core.metadata;

import java.util.Optional;

/**
 * Source of document schemas by type tag. The metadata store depends on this
 * alone and knows nothing about concrete object kinds.
 */
@FunctionalInterface
public interface SchemaLookup {
    Optional<DocumentSchema> schemaFor(String type);
}
