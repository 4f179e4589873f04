package resqpack.core.objects.impl;

import java.util.ArrayList;
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

/**
 * Path of a wellbore: {@code NodeCount} stations with measured depths
 * ({@code Mds}, shape [n]) and xyz control points ({@code ControlPoints},
 * shape [n][3]) relative to an MD datum.
 */
public final class WellboreTrajectoryRepresentation extends AbstractResqObject {
    public static final String TYPE = "WellboreTrajectoryRepresentation";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.reference("MdDatum", MdDatum.TYPE).required())
            .field(FieldSpec.reference("RepresentedInterpretation", WellboreInterpretation.TYPE))
            .field(FieldSpec.reference("LocalCrs", LocalDepth3dCrs.TYPE).required())
            .field(FieldSpec.doubleField("StartMd").required())
            .field(FieldSpec.doubleField("FinishMd").required())
            .field(FieldSpec.enumeration("MdUom", "m", "ft").required())
            .field(FieldSpec.integer("NodeCount").required().min(2))
            .field(FieldSpec.array("Mds").required().rank(1).elementTypes(ElementType.FLOAT64))
            .field(FieldSpec.array("ControlPoints").required().rank(2).elementTypes(ElementType.FLOAT64))
            .rule(WellboreTrajectoryRepresentation::checkStations)
            .build();

    public static final ObjectKind<WellboreTrajectoryRepresentation> KIND = new ObjectKind<>(
            WellboreTrajectoryRepresentation.class, SCHEMA, WellboreTrajectoryRepresentation::new);

    public WellboreTrajectoryRepresentation(MetadataDocument document) {
        super(document, SCHEMA);
    }

    /**
     * Document for a new trajectory; {@code Mds} and {@code ControlPoints}
     * arrays are supplied when the part is added.
     */
    public static MetadataDocument draft(String title, Oid mdDatum, Oid crs, Oid interpretation, double startMd,
            double finishMd, int nodeCount) {
        MetadataDocument doc = new MetadataDocument(TYPE, Citation.of(title))
                .setReference("MdDatum", mdDatum)
                .setReference("LocalCrs", crs)
                .setField("StartMd", startMd)
                .setField("FinishMd", finishMd)
                .setField("MdUom", "m")
                .setField("NodeCount", (long) nodeCount);
        return interpretation == null ? doc : doc.setReference("RepresentedInterpretation", interpretation);
    }

    public Oid getMdDatum() {
        return reference("MdDatum");
    }

    public Oid getRepresentedInterpretation() {
        return reference("RepresentedInterpretation");
    }

    public Oid getLocalCrs() {
        return reference("LocalCrs");
    }

    public double getStartMd() {
        return doubleField("StartMd", 0);
    }

    public double getFinishMd() {
        return doubleField("FinishMd", 0);
    }

    public int getNodeCount() {
        return (int) longField("NodeCount");
    }

    public ArrayHandle getMds() {
        return array("Mds");
    }

    public ArrayHandle getControlPoints() {
        return array("ControlPoints");
    }

    private static List<ValidationError> checkStations(MetadataDocument doc) {
        List<ValidationError> errors = new ArrayList<>();
        String oid = doc.getOid() != null ? doc.getOid().toString() : null;
        double start = Double.parseDouble(doc.getField("StartMd").trim());
        double finish = Double.parseDouble(doc.getField("FinishMd").trim());
        if (start > finish) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, null, "StartMd",
                    "StartMd " + start + " is beyond FinishMd " + finish));
        }
        int nodes = (int) Long.parseLong(doc.getField("NodeCount").trim());
        if (!doc.getArray("Mds").hasShape(new int[] { nodes })) {
            errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, "Mds",
                    "Expected " + nodes + " measured depths, got shape "
                            + ArrayHandle.shapeToString(doc.getArray("Mds").getShape())));
        }
        if (!doc.getArray("ControlPoints").hasShape(new int[] { nodes, 3 })) {
            errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, "ControlPoints",
                    "Expected shape [" + nodes + ", 3], got "
                            + ArrayHandle.shapeToString(doc.getArray("ControlPoints").getShape())));
        }
        return errors;
    }
}
