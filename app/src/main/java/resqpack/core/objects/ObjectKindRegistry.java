package resqpack.core.objects;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.SchemaLookup;

/**
 * Maps type tags to object kinds. Adding a kind never touches the catalog or
 * the stores: they only consult this registry as a {@link SchemaLookup}.
 */
public final class ObjectKindRegistry implements SchemaLookup {
    private static final Logger log = LoggerFactory.getLogger(ObjectKindRegistry.class);

    private final Map<String, ObjectKind<?>> byType = new LinkedHashMap<>();
    private final Map<Class<?>, ObjectKind<?>> byClass = new LinkedHashMap<>();

    /**
     * Registry with every kind found through {@link ServiceLoader}.
     */
    public static ObjectKindRegistry loadDefault() {
        ObjectKindRegistry registry = new ObjectKindRegistry();
        for (ObjectKindProvider provider : ServiceLoader.load(ObjectKindProvider.class)) {
            for (ObjectKind<?> kind : provider.kinds()) {
                registry.register(kind);
            }
            log.debug("Loaded object kinds from {}", provider.getClass().getName());
        }
        return registry;
    }

    /**
     * @throws IllegalArgumentException if the type tag or wrapper class is
     *                                  already registered
     */
    public synchronized ObjectKindRegistry register(ObjectKind<?> kind) {
        if (byType.containsKey(kind.getType())) {
            throw new IllegalArgumentException("Object kind already registered: " + kind.getType());
        }
        if (byClass.containsKey(kind.getObjectClass())) {
            throw new IllegalArgumentException("Wrapper class already registered: " + kind.getObjectClass());
        }
        byType.put(kind.getType(), kind);
        byClass.put(kind.getObjectClass(), kind);
        return this;
    }

    public synchronized Optional<ObjectKind<?>> find(String type) {
        return Optional.ofNullable(byType.get(type));
    }

    @SuppressWarnings("unchecked")
    public synchronized <T extends ResqObject> Optional<ObjectKind<T>> find(Class<T> objectClass) {
        return Optional.ofNullable((ObjectKind<T>) byClass.get(objectClass));
    }

    public synchronized Collection<ObjectKind<?>> kinds() {
        return Collections.unmodifiableCollection(new ArrayList<>(byType.values()));
    }

    @Override
    public Optional<DocumentSchema> schemaFor(String type) {
        return find(type).map(ObjectKind::getSchema);
    }

    /**
     * Typed wrapper for {@code document}, or a {@link GenericResqObject} when
     * its type is not registered.
     */
    public ResqObject wrap(MetadataDocument document) {
        Optional<ObjectKind<?>> kind = find(document.getType());
        if (kind.isPresent()) {
            return kind.get().wrap(document);
        }
        return new GenericResqObject(document);
    }
}
