package resqpack.core.metadata;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;

/**
 * Declared fields of one document type. Checks everything that can be judged
 * from the document alone: required fields, unknown fields, value domains and
 * array declarations. Reference resolution needs the catalog and is done by
 * {@link MetadataStore#validate}.
 */
public final class DocumentSchema {
    private final String type;
    private final Map<String, FieldSpec> fields;
    private final List<DocumentRule> rules;

    private DocumentSchema(String type, Map<String, FieldSpec> fields, List<DocumentRule> rules) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
        this.rules = List.copyOf(rules);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public String getType() {
        return type;
    }

    public List<FieldSpec> getFields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public List<ValidationError> validate(MetadataDocument doc) {
        List<ValidationError> errors = new ArrayList<>();
        String oid = doc.getOid() != null ? doc.getOid().toString() : null;

        if (!type.equals(doc.getType())) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, null, null,
                    "Document type " + doc.getType() + " does not match schema " + type));
            return errors;
        }

        for (FieldSpec spec : fields.values()) {
            String name = spec.getName();
            switch (spec.getKind()) {
                case REFERENCE:
                    checkReference(spec, doc, oid, errors);
                    break;
                case ARRAY:
                    checkArray(spec, doc.getArray(name), oid, errors);
                    break;
                default:
                    checkScalar(spec, doc.getField(name), oid, errors);
                    break;
            }
            if (spec.getKind().isScalar() && (doc.getArray(name) != null || !doc.getReferences(name).isEmpty())) {
                errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, null, name,
                        "Field declared " + spec.getKind() + " holds a reference or array"));
            }
        }

        for (String name : doc.getFields().keySet()) {
            if (!fields.containsKey(name)) {
                errors.add(unknown(oid, name));
            }
        }
        for (String name : doc.getReferences().keySet()) {
            if (!fields.containsKey(name)) {
                errors.add(unknown(oid, name));
            }
        }
        for (String name : doc.getArrays().keySet()) {
            if (!fields.containsKey(name)) {
                errors.add(unknown(oid, name));
            }
        }

        if (errors.isEmpty()) {
            for (DocumentRule rule : rules) {
                errors.addAll(rule.check(doc));
            }
        }
        return errors;
    }

    private static ValidationError unknown(String oid, String name) {
        return new ValidationError(ValidationError.Kind.UNKNOWN_FIELD, oid, null, name, "Field is not declared");
    }

    private static void checkScalar(FieldSpec spec, String value, String oid, List<ValidationError> errors) {
        String name = spec.getName();
        if (value == null) {
            if (spec.isRequired()) {
                errors.add(new ValidationError(ValidationError.Kind.MISSING_FIELD, oid, null, name,
                        "Required field is missing"));
            }
            return;
        }
        try {
            switch (spec.getKind()) {
                case INTEGER:
                    checkRange(spec, Long.parseLong(value.trim()), oid, errors);
                    break;
                case DOUBLE:
                    double d = Double.parseDouble(value.trim());
                    if (Double.isNaN(d)) {
                        errors.add(invalid(oid, name, "NaN is not allowed"));
                    } else {
                        checkRange(spec, d, oid, errors);
                    }
                    break;
                case BOOLEAN:
                    if (!value.equals("true") && !value.equals("false")) {
                        errors.add(invalid(oid, name, "Expected true or false, got '" + value + "'"));
                    }
                    break;
                case ENUM:
                    if (!spec.getAllowedValues().contains(value)) {
                        errors.add(invalid(oid, name, "'" + value + "' is not one of " + spec.getAllowedValues()));
                    }
                    break;
                case TIMESTAMP:
                    Instant.parse(value.trim());
                    break;
                case STRING:
                    if (spec.isRequired() && value.isBlank()) {
                        errors.add(invalid(oid, name, "Required text is blank"));
                    }
                    break;
                default:
                    break;
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            errors.add(invalid(oid, name,
                    "Not a valid " + spec.getKind().name().toLowerCase(Locale.ROOT) + ": '" + value + "'"));
        }
    }

    private static void checkRange(FieldSpec spec, double value, String oid, List<ValidationError> errors) {
        if (spec.getMin() != null && value < spec.getMin()) {
            errors.add(invalid(oid, spec.getName(), value + " is below minimum " + spec.getMin()));
        }
        if (spec.getMax() != null && value > spec.getMax()) {
            errors.add(invalid(oid, spec.getName(), value + " is above maximum " + spec.getMax()));
        }
    }

    private static void checkReference(FieldSpec spec, MetadataDocument doc, String oid,
            List<ValidationError> errors) {
        String name = spec.getName();
        List<Oid> targets = doc.getReferences(name);
        if (targets.isEmpty()) {
            if (spec.isRequired()) {
                errors.add(new ValidationError(ValidationError.Kind.MISSING_FIELD, oid, null, name,
                        "Required reference is missing"));
            }
        } else if (!spec.isMultiple() && targets.size() > 1) {
            errors.add(invalid(oid, name, "Single reference field holds " + targets.size() + " OIDs"));
        }
        if (doc.getField(name) != null || doc.getArray(name) != null) {
            errors.add(invalid(oid, name, "Reference field holds a scalar or array"));
        }
    }

    private static void checkArray(FieldSpec spec, ArrayHandle handle, String oid, List<ValidationError> errors) {
        String name = spec.getName();
        if (handle == null) {
            if (spec.isRequired()) {
                errors.add(new ValidationError(ValidationError.Kind.MISSING_FIELD, oid, null, name,
                        "Required array is missing"));
            }
            return;
        }
        if (!spec.getElementTypes().isEmpty() && !spec.getElementTypes().contains(handle.getElementType())) {
            errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, name,
                    "Element type " + handle.getElementType().getTypeName() + " is not one of "
                            + spec.getElementTypes()));
        }
        if (spec.getRank() != null && spec.getRank() != handle.getRank()) {
            errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, name,
                    "Expected rank " + spec.getRank() + ", got " + handle.getRank()));
        }
    }

    private static ValidationError invalid(String oid, String name, String reason) {
        return new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, null, name, reason);
    }

    public static final class Builder {
        private final String type;
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final List<DocumentRule> rules = new ArrayList<>();

        private Builder(String type) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("Schema type cannot be null or blank");
            }
            this.type = type;
        }

        public Builder field(FieldSpec spec) {
            if (fields.putIfAbsent(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("Field " + spec.getName() + " declared twice in " + type);
            }
            return this;
        }

        public Builder rule(DocumentRule rule) {
            rules.add(rule);
            return this;
        }

        public DocumentSchema build() {
            return new DocumentSchema(type, new LinkedHashMap<>(fields), rules);
        }
    }
}
