package resqpack.core.metadata;

import java.util.Objects;

/**
 * One validation failure, localized to an object and a field path.
 */
public final class ValidationError {

    public enum Kind {
        MISSING_FIELD,
        UNKNOWN_FIELD,
        INVALID_VALUE,
        UNKNOWN_TYPE,
        DANGLING_REFERENCE,
        WRONG_REFERENCE_TYPE,
        REFERENCE_CYCLE,
        ARRAY_MISMATCH,
        MISSING_PAYLOAD
    }

    private final Kind kind;
    private final String oid;
    private final String partName;
    private final String fieldPath;
    private final String reason;
    private final String subject;

    public ValidationError(Kind kind, String oid, String partName, String fieldPath, String reason) {
        this(kind, oid, partName, fieldPath, reason, null);
    }

    /**
     * @param subject the other object the error is about, such as the missing
     *                target of a dangling reference
     */
    public ValidationError(Kind kind, String oid, String partName, String fieldPath, String reason, String subject) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.oid = oid;
        this.partName = partName;
        this.fieldPath = fieldPath;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.subject = subject;
    }

    public Kind getKind() {
        return kind;
    }

    public String getOid() {
        return oid;
    }

    public String getPartName() {
        return partName;
    }

    /**
     * Dotted path of the offending field, or null for whole-document errors.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    public String getReason() {
        return reason;
    }

    public String getSubject() {
        return subject;
    }

    public ValidationError withPartName(String newPartName) {
        return new ValidationError(kind, oid, newPartName, fieldPath, reason, subject);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        ValidationError other = (ValidationError) obj;
        return kind == other.kind
                && Objects.equals(oid, other.oid)
                && Objects.equals(partName, other.partName)
                && Objects.equals(fieldPath, other.fieldPath)
                && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, oid, partName, fieldPath, reason);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (partName != null) {
            sb.append(" in ").append(partName);
        } else if (oid != null) {
            sb.append(" in ").append(oid);
        }
        if (fieldPath != null) {
            sb.append(" at ").append(fieldPath);
        }
        return sb.append(": ").append(reason).toString();
    }
}
