package resqpack.core.objects.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import resqpack.core.PackageOptions;
import resqpack.core.arrays.ArrayData;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;
import resqpack.core.objects.ObjectKindRegistry;
import resqpack.core.packaging.PackageManager;
import resqpack.exceptions.ShapeMismatchException;
import resqpack.exceptions.ValidationException;

class StandardKindsTest {
    private PackageManager manager;
    private Oid crs;
    private Oid grid;

    @BeforeEach
    void setUp() throws Exception {
        manager = PackageManager.create(PackageOptions.defaults(), ObjectKindRegistry.loadDefault());
        crs = manager.addPart(LocalDepth3dCrs.draft("local"), Map.of());
        grid = manager.addPart(IjkGridRepresentation.draft("grid", 2, 2, 1, crs), Map.of());
    }

    private MetadataDocument doc(Oid oid) throws Exception {
        return manager.getPackage().getMetadata().get(oid);
    }

    @Test
    void gridPointsMustMatchCellCounts() throws Exception {
        manager.setArray(grid, "Points", ArrayData.zeros(new int[] { 2, 3, 3, 3 },
                ElementType.FLOAT64));

        assertThatThrownBy(() -> manager.setArray(grid, "Points",
                ArrayData.zeros(new int[] { 2, 2, 2, 3 }, ElementType.FLOAT64)))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("Points");
        assertThat(doc(grid).getArray("Points").getShape()).containsExactly(2, 3, 3, 3);
    }

    @Test
    void gridWrapperExposesDimensions() throws Exception {
        IjkGridRepresentation wrapped = IjkGridRepresentation.KIND.wrap(doc(grid));

        assertThat(wrapped.getCellCount()).isEqualTo(4);
        assertThat(wrapped.getLocalCrs()).isEqualTo(crs);
        assertThat(wrapped.getPoints()).isNull();
    }

    @Test
    void gridReferenceMustPointAtCrs() {
        MetadataDocument draft = IjkGridRepresentation.draft("bad", 1, 1, 1, grid);

        assertThatThrownBy(() -> manager.addPart(draft, Map.of()))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors())
                        .extracting(ValidationError::getKind)
                        .contains(ValidationError.Kind.WRONG_REFERENCE_TYPE));
    }

    @Test
    void continuousPropertyNeedsValuesAndOrderedRange() throws Exception {
        assertThatThrownBy(() -> manager.addPart(ContinuousProperty.draft("empty", grid, "m"), Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Values");

        Oid prop = manager.addPart(ContinuousProperty.draft("depth", grid, "m")
                .setField("MinimumValue", 10.0)
                .setField("MaximumValue", 20.0),
                Map.of("Values", ArrayData.ofFloats(new int[] { 4 }, 11, 12, 13, 14)));
        MetadataDocument stored = doc(prop);

        assertThatThrownBy(() -> manager.updatePart(stored.setField("MinimumValue", 30.0), stored.getRevision()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("MinimumValue");
        assertThat(ContinuousProperty.KIND.wrap(doc(prop)).getUom()).isEqualTo("m");
    }

    @Test
    void discretePropertyRejectsFloatingPointValues() {
        assertThatThrownBy(() -> manager.addPart(DiscreteProperty.draft("facies", grid),
                Map.of("Values", ArrayData.ofDoubles(new int[] { 4 }, 1, 2, 3, 4))))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("Element type");
    }

    @Test
    void propertyKindHierarchyCannotLoop() throws Exception {
        Oid root = manager.addPart(PropertyKind.draft("porosity", "m3/m3", null), Map.of());
        Oid child = manager.addPart(PropertyKind.draft("net porosity", "m3/m3", root), Map.of());
        MetadataDocument rootDoc = doc(root);

        assertThatThrownBy(() -> manager.updatePart(rootDoc.setReference("Parent", child), rootDoc.getRevision()))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors())
                        .extracting(ValidationError::getKind)
                        .containsExactly(ValidationError.Kind.REFERENCE_CYCLE));
        assertThat(doc(root).getReference("Parent")).isNull();
    }

    @Test
    void stringTableParsesEntriesAndRejectsRepeatedKeys() throws Exception {
        Map<Long, String> table = new LinkedHashMap<>();
        table.put(0L, "shale");
        table.put(1L, "sand=clean");
        Oid lookup = manager.addPart(StringTableLookup.draft("facies", table), Map.of());

        StringTableLookup wrapped = StringTableLookup.KIND.wrap(doc(lookup));
        assertThat(wrapped.getTable()).containsExactly(Map.entry(0L, "shale"), Map.entry(1L, "sand=clean"));
        assertThat(wrapped.lookup(1)).isEqualTo("sand=clean");

        MetadataDocument stored = doc(lookup);
        assertThatThrownBy(() -> manager.updatePart(stored.setField("Table", "0=a\n0=b"), stored.getRevision()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("more than once");
        assertThatThrownBy(() -> StringTableLookup.draft("bad", Map.of(2L, "two\nlines")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trajectoryStationsMatchNodeCount() throws Exception {
        Oid feature = manager.addPart(WellboreFeature.draft("W-1"), Map.of());
        Oid interpretation = manager.addPart(WellboreInterpretation.draft(feature, "W-1 drilled"), Map.of());
        Oid datum = manager.addPart(MdDatum.draft("KB", crs, 0, 0, -25, "kelly bushing"), Map.of());
        Map<String, ArrayData> good = Map.of(
                "Mds", ArrayData.ofDoubles(new int[] { 3 }, 0, 100, 200),
                "ControlPoints", ArrayData.ofDoubles(new int[] { 3, 3 }, 0, 0, 0, 0, 0, 100, 0, 0, 200));

        Oid trajectory = manager.addPart(
                WellboreTrajectoryRepresentation.draft("W-1 path", datum, crs, interpretation, 0, 200, 3), good);

        assertThat(manager.getPackage().getCatalog().referencing(datum)).containsExactly(trajectory);
        assertThatThrownBy(() -> manager.addPart(
                WellboreTrajectoryRepresentation.draft("short", datum, crs, null, 0, 200, 4), good))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> manager.addPart(
                WellboreTrajectoryRepresentation.draft("reversed", datum, crs, null, 300, 200, 3), good))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("StartMd");
    }
}
