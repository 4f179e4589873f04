package resqpack.core.objects;

import java.util.Objects;
import java.util.function.Function;

import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.MetadataDocument;

/**
 * Registration of one object kind: its type tag, schema and the factory that
 * wraps a document of that type.
 *
 * @param <T> typed wrapper of the kind
 */
public final class ObjectKind<T extends ResqObject> {
    private final Class<T> objectClass;
    private final DocumentSchema schema;
    private final Function<MetadataDocument, T> factory;

    public ObjectKind(Class<T> objectClass, DocumentSchema schema, Function<MetadataDocument, T> factory) {
        this.objectClass = Objects.requireNonNull(objectClass, "objectClass");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public String getType() {
        return schema.getType();
    }

    public Class<T> getObjectClass() {
        return objectClass;
    }

    public DocumentSchema getSchema() {
        return schema;
    }

    public T wrap(MetadataDocument document) {
        return factory.apply(document);
    }

    @Override
    public String toString() {
        return "ObjectKind{" + getType() + " -> " + objectClass.getSimpleName() + "}";
    }
}
