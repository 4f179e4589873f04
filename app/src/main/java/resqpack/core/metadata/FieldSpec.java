package resqpack.core.metadata;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import resqpack.core.arrays.ElementType;

/**
 * Declaration of one field of a document schema. Built fluently:
 *
 * <pre>
 * FieldSpec.doubleField("XOffset").required()
 * FieldSpec.reference("SupportingRepresentation", "IjkGridRepresentation").required()
 * FieldSpec.array("Values").rank(3).elementTypes(ElementType.FLOAT64)
 * </pre>
 */
public final class FieldSpec {
    private final String name;
    private final FieldKind kind;
    private final boolean required;
    private final boolean multiple;
    private final boolean acyclic;
    private final Set<String> allowedValues;
    private final Double min;
    private final Double max;
    private final Set<String> targetTypes;
    private final Set<ElementType> elementTypes;
    private final Integer rank;

    private FieldSpec(String name, FieldKind kind, boolean required, boolean multiple, boolean acyclic,
            Set<String> allowedValues, Double min, Double max, Set<String> targetTypes,
            Set<ElementType> elementTypes, Integer rank) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        this.name = name;
        this.kind = kind;
        this.required = required;
        this.multiple = multiple;
        this.acyclic = acyclic;
        this.allowedValues = allowedValues;
        this.min = min;
        this.max = max;
        this.targetTypes = targetTypes;
        this.elementTypes = elementTypes;
        this.rank = rank;
    }

    private static FieldSpec of(String name, FieldKind kind) {
        return new FieldSpec(name, kind, false, false, false, Collections.emptySet(), null, null,
                Collections.emptySet(), Collections.emptySet(), null);
    }

    public static FieldSpec string(String name) {
        return of(name, FieldKind.STRING);
    }

    public static FieldSpec integer(String name) {
        return of(name, FieldKind.INTEGER);
    }

    public static FieldSpec doubleField(String name) {
        return of(name, FieldKind.DOUBLE);
    }

    public static FieldSpec bool(String name) {
        return of(name, FieldKind.BOOLEAN);
    }

    public static FieldSpec timestamp(String name) {
        return of(name, FieldKind.TIMESTAMP);
    }

    public static FieldSpec enumeration(String name, String... values) {
        return new FieldSpec(name, FieldKind.ENUM, false, false, false,
                Collections.unmodifiableSet(new LinkedHashSet<>(List.of(values))), null, null,
                Collections.emptySet(), Collections.emptySet(), null);
    }

    /**
     * Reference field; an empty target list accepts any object type.
     */
    public static FieldSpec reference(String name, String... targetTypes) {
        return new FieldSpec(name, FieldKind.REFERENCE, false, false, false, Collections.emptySet(), null, null,
                Collections.unmodifiableSet(new LinkedHashSet<>(List.of(targetTypes))), Collections.emptySet(),
                null);
    }

    public static FieldSpec array(String name) {
        return of(name, FieldKind.ARRAY);
    }

    public FieldSpec required() {
        return new FieldSpec(name, kind, true, multiple, acyclic, allowedValues, min, max, targetTypes,
                elementTypes, rank);
    }

    /**
     * Reference field holding any number of OIDs.
     */
    public FieldSpec multiple() {
        requireKind(FieldKind.REFERENCE);
        return new FieldSpec(name, kind, required, true, acyclic, allowedValues, min, max, targetTypes,
                elementTypes, rank);
    }

    /**
     * Following this reference field from object to object must never lead
     * back to the start.
     */
    public FieldSpec acyclic() {
        requireKind(FieldKind.REFERENCE);
        return new FieldSpec(name, kind, required, multiple, true, allowedValues, min, max, targetTypes,
                elementTypes, rank);
    }

    public FieldSpec range(double minimum, double maximum) {
        if (kind != FieldKind.INTEGER && kind != FieldKind.DOUBLE) {
            throw new IllegalStateException("Range applies to numeric fields only: " + name);
        }
        return new FieldSpec(name, kind, required, multiple, acyclic, allowedValues, minimum, maximum, targetTypes,
                elementTypes, rank);
    }

    public FieldSpec min(double minimum) {
        return range(minimum, max != null ? max : Double.POSITIVE_INFINITY);
    }

    public FieldSpec elementTypes(ElementType first, ElementType... rest) {
        requireKind(FieldKind.ARRAY);
        return new FieldSpec(name, kind, required, multiple, acyclic, allowedValues, min, max, targetTypes,
                Collections.unmodifiableSet(EnumSet.of(first, rest)), rank);
    }

    public FieldSpec rank(int expectedRank) {
        requireKind(FieldKind.ARRAY);
        return new FieldSpec(name, kind, required, multiple, acyclic, allowedValues, min, max, targetTypes,
                elementTypes, expectedRank);
    }

    private void requireKind(FieldKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Field " + name + " is " + kind + ", not " + expected);
        }
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isMultiple() {
        return multiple;
    }

    public boolean isAcyclic() {
        return acyclic;
    }

    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Set<String> getTargetTypes() {
        return targetTypes;
    }

    public Set<ElementType> getElementTypes() {
        return elementTypes;
    }

    public Integer getRank() {
        return rank;
    }

    @Override
    public String toString() {
        return "FieldSpec{" + name + ":" + kind + (required ? ", required" : "") + "}";
    }
}
