package resqpack.core.metadata;

/**
 * Value kinds a metadata field may declare.
 */
public enum FieldKind {
    STRING,
    INTEGER,
    DOUBLE,
    BOOLEAN,
    ENUM,
    TIMESTAMP,
    REFERENCE,
    ARRAY;

    public boolean isScalar() {
        return this != REFERENCE && this != ARRAY;
    }
}
