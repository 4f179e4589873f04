package resqpack.core.objects.impl;

import java.util.List;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

// @formatter:off
/**
 * Corner point grid of {@code Nk × Nj × Ni} cells.
 *
 * Geometry, when present, is the {@code Points} array of node coordinates:
 *
 *   shape [Nk + 1][Nj + 1][Ni + 1][3]   (x, y, z per node)
 *
 * and the optional {@code CellGeometryIsDefined} mask has shape [Nk][Nj][Ni].
 */
// @formatter:on
public final class IjkGridRepresentation extends AbstractResqObject {
    public static final String TYPE = "IjkGridRepresentation";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.integer("Ni").required().min(1))
            .field(FieldSpec.integer("Nj").required().min(1))
            .field(FieldSpec.integer("Nk").required().min(1))
            .field(FieldSpec.enumeration("KDirection", "down", "up"))
            .field(FieldSpec.reference("LocalCrs", LocalDepth3dCrs.TYPE))
            .field(FieldSpec.array("Points").rank(4).elementTypes(ElementType.FLOAT64, ElementType.FLOAT32))
            .field(FieldSpec.array("CellGeometryIsDefined").rank(3).elementTypes(ElementType.BOOL))
            .rule(IjkGridRepresentation::checkGeometryShapes)
            .build();

    public static final ObjectKind<IjkGridRepresentation> KIND =
            new ObjectKind<>(IjkGridRepresentation.class, SCHEMA, IjkGridRepresentation::new);

    public IjkGridRepresentation(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String title, int ni, int nj, int nk, Oid crs) {
        MetadataDocument doc = new MetadataDocument(TYPE, Citation.of(title))
                .setField("Ni", (long) ni)
                .setField("Nj", (long) nj)
                .setField("Nk", (long) nk)
                .setField("KDirection", "down");
        return crs == null ? doc : doc.setReference("LocalCrs", crs);
    }

    public int getNi() {
        return (int) longField("Ni");
    }

    public int getNj() {
        return (int) longField("Nj");
    }

    public int getNk() {
        return (int) longField("Nk");
    }

    public int getCellCount() {
        return getNi() * getNj() * getNk();
    }

    public Oid getLocalCrs() {
        return reference("LocalCrs");
    }

    public ArrayHandle getPoints() {
        return array("Points");
    }

    public ArrayHandle getCellGeometryIsDefined() {
        return array("CellGeometryIsDefined");
    }

    private static List<ValidationError> checkGeometryShapes(MetadataDocument doc) {
        long ni = Long.parseLong(doc.getField("Ni").trim());
        long nj = Long.parseLong(doc.getField("Nj").trim());
        long nk = Long.parseLong(doc.getField("Nk").trim());
        String oid = doc.getOid() != null ? doc.getOid().toString() : null;

        ArrayHandle points = doc.getArray("Points");
        if (points != null && !points.hasShape(new int[] { (int) nk + 1, (int) nj + 1, (int) ni + 1, 3 })) {
            return List.of(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, "Points",
                    "Expected shape [" + (nk + 1) + ", " + (nj + 1) + ", " + (ni + 1) + ", 3], got "
                            + ArrayHandle.shapeToString(points.getShape())));
        }
        ArrayHandle mask = doc.getArray("CellGeometryIsDefined");
        if (mask != null && !mask.hasShape(new int[] { (int) nk, (int) nj, (int) ni })) {
            return List.of(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null,
                    "CellGeometryIsDefined", "Expected shape [" + nk + ", " + nj + ", " + ni + "], got "
                            + ArrayHandle.shapeToString(mask.getShape())));
        }
        return List.of();
    }
}
