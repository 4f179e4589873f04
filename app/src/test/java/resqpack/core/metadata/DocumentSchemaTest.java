package resqpack.core.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.Compression;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;

class DocumentSchemaTest {
    private static final DocumentSchema GRID = DocumentSchema.builder("Grid")
            .field(FieldSpec.integer("Ni").required().min(1))
            .field(FieldSpec.enumeration("KDirection", "down", "up"))
            .field(FieldSpec.bool("Active"))
            .field(FieldSpec.reference("LocalCrs", "Crs"))
            .field(FieldSpec.array("Points").rank(2).elementTypes(ElementType.FLOAT64, ElementType.FLOAT32))
            .rule(doc -> "7".equals(doc.getField("Ni"))
                    ? List.of(new ValidationError(ValidationError.Kind.INVALID_VALUE, null, null, "Ni", "unlucky"))
                    : List.of())
            .build();

    private static MetadataDocument grid() {
        return new MetadataDocument(Oid.random(), "Grid", Citation.of("grid"));
    }

    private static List<ValidationError.Kind> kinds(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::getKind).collect(Collectors.toList());
    }

    @Test
    void acceptsWellFormedDocument() {
        MetadataDocument doc = grid().setField("Ni", 3).setField("KDirection", "down").setField("Active", true)
                .setReference("LocalCrs", Oid.random());

        assertThat(GRID.validate(doc)).isEmpty();
    }

    @Test
    void reportsMissingRequiredField() {
        List<ValidationError> errors = GRID.validate(grid());

        assertThat(kinds(errors)).containsExactly(ValidationError.Kind.MISSING_FIELD);
        assertThat(errors.get(0).getFieldPath()).isEqualTo("Ni");
    }

    @Test
    void reportsValueDomainViolations() {
        MetadataDocument doc = grid().setField("Ni", 0).setField("KDirection", "sideways")
                .setField("Active", "yes");

        assertThat(GRID.validate(doc)).extracting(ValidationError::getFieldPath)
                .containsExactlyInAnyOrder("Ni", "KDirection", "Active");
    }

    @Test
    void reportsUnparseableNumber() {
        List<ValidationError> errors = GRID.validate(grid().setField("Ni", "three"));

        assertThat(errors).singleElement()
                .satisfies(e -> assertThat(e.getReason()).contains("Not a valid integer"));
    }

    @Test
    void reportsUndeclaredField() {
        List<ValidationError> errors = GRID.validate(grid().setField("Ni", 2).setField("Colour", "red"));

        assertThat(kinds(errors)).containsExactly(ValidationError.Kind.UNKNOWN_FIELD);
    }

    @Test
    void checksArrayRankAndElementType() {
        ArrayHandle handle = new ArrayHandle("Points", new int[] { 2, 2, 3 }, ElementType.INT32, "arrays/x/p.bin",
                Compression.NONE, null);

        List<ValidationError> errors = GRID.validate(grid().setField("Ni", 2).setArray("Points", handle));

        assertThat(kinds(errors)).containsOnly(ValidationError.Kind.ARRAY_MISMATCH).hasSize(2);
    }

    @Test
    void runsRulesOnlyAfterFieldChecksPass() {
        assertThat(GRID.validate(grid().setField("Ni", 7))).extracting(ValidationError::getReason)
                .containsExactly("unlucky");
        assertThat(GRID.validate(grid().setField("Ni", 7).setField("Colour", "red")))
                .extracting(ValidationError::getKind)
                .containsExactly(ValidationError.Kind.UNKNOWN_FIELD);
    }

    @Test
    void rejectsDocumentOfOtherType() {
        MetadataDocument other = new MetadataDocument(Oid.random(), "Crs", Citation.of("crs"));

        assertThat(GRID.validate(other)).singleElement()
                .satisfies(e -> assertThat(e.getReason()).contains("does not match schema"));
    }

    @Test
    void builderRejectsDuplicateField() {
        assertThatThrownBy(() -> DocumentSchema.builder("X")
                .field(FieldSpec.string("A"))
                .field(FieldSpec.integer("A")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
