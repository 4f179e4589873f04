package resqpack.core.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.DanglingReferenceException;
import resqpack.exceptions.NotFoundException;

@DisplayName("IdentityCatalog")
class IdentityCatalogTest {
    private IdentityCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new IdentityCatalog();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void assignsDistinctOids() throws Exception {
            Oid a = catalog.register("obj_LocalDepth3dCrs", List.of());
            Oid b = catalog.register("obj_LocalDepth3dCrs", List.of());

            assertThat(a).isNotEqualTo(b);
            assertThat(catalog.oids()).containsExactly(a, b);
            assertThat(catalog.resolve(a).getType()).isEqualTo("obj_LocalDepth3dCrs");
        }

        @Test
        void rejectsUnknownReference() {
            Oid missing = Oid.random();

            assertThatThrownBy(() -> catalog.register("obj_IjkGridRepresentation", List.of(missing)))
                    .isInstanceOf(DanglingReferenceException.class)
                    .extracting(e -> ((DanglingReferenceException) e).getMissingOid())
                    .isEqualTo(missing.toString());
            assertThat(catalog.size()).isZero();
        }

        @Test
        void regeneratesOnCollision() throws Exception {
            Oid fixed = Oid.of(UUID.fromString("11111111-1111-4111-8111-111111111111"));
            Oid other = Oid.of(UUID.fromString("22222222-2222-4222-8222-222222222222"));
            Deque<Oid> sequence = new ArrayDeque<>(List.of(fixed, fixed, other));
            IdentityCatalog scripted = new IdentityCatalog(sequence::pop);

            scripted.register("obj_WellboreFeature", List.of());
            Oid second = scripted.register("obj_WellboreFeature", List.of());

            assertThat(second).isEqualTo(other);
        }

        @Test
        void rejectsBlankType() {
            assertThatThrownBy(() -> catalog.register(" ", List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("part names")
    class PartNames {

        @Test
        void lookupIgnoresCase() throws Exception {
            Oid oid = catalog.register("obj_WellboreFeature", List.of());
            catalog.setPartName(oid, "obj_WellboreFeature_a.xml");

            assertThat(catalog.findByPartName("OBJ_WELLBOREFEATURE_A.XML")).contains(oid);
        }

        @Test
        void rejectsNameHeldByAnotherObject() throws Exception {
            Oid a = catalog.register("obj_WellboreFeature", List.of());
            Oid b = catalog.register("obj_WellboreFeature", List.of());
            catalog.setPartName(a, "feature.xml");

            assertThatThrownBy(() -> catalog.setPartName(b, "Feature.XML"))
                    .isInstanceOf(CorruptionException.class);
        }

        @Test
        void registerExistingRejectsDuplicateOid() throws Exception {
            Oid oid = Oid.random();
            catalog.registerExisting(oid, "obj_WellboreFeature", "a.xml", Citation.of("A"), List.of());

            assertThatThrownBy(() -> catalog.registerExisting(oid, "obj_WellboreFeature", "b.xml",
                    Citation.of("B"), List.of()))
                    .isInstanceOf(CorruptionException.class)
                    .hasMessageContaining("Duplicate OID");
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        void refusesWhileReferenced() throws Exception {
            Oid crs = catalog.register("obj_LocalDepth3dCrs", List.of());
            Oid grid = catalog.register("obj_IjkGridRepresentation", List.of(crs));
            catalog.setPartName(grid, "grid.xml");

            assertThatThrownBy(() -> catalog.remove(crs, false))
                    .isInstanceOf(DanglingReferenceException.class)
                    .satisfies(e -> assertThat(((DanglingReferenceException) e).getReferencingParts())
                            .containsExactly("grid.xml"));
            assertThat(catalog.contains(crs)).isTrue();
        }

        @Test
        void cascadeInvalidatesReferrers() throws Exception {
            Oid crs = catalog.register("obj_LocalDepth3dCrs", List.of());
            Oid grid = catalog.register("obj_IjkGridRepresentation", List.of(crs));

            RemovalReport report = catalog.remove(crs, true);

            assertThat(report.isPartialFailure()).isTrue();
            assertThat(report.getInvalidated()).extracting(CatalogEntry::getOid).containsExactly(grid);
            assertThat(catalog.resolve(grid).isValid()).isFalse();
            assertThat(catalog.danglingReferences()).containsKey(grid);
        }

        @Test
        void selfReferenceDoesNotBlock() throws Exception {
            Oid oid = catalog.register("obj_PropertyKind", List.of());
            catalog.updateReferences(oid, List.of(oid));

            RemovalReport report = catalog.remove(oid, false);

            assertThat(report.getInvalidated()).isEmpty();
            assertThat(catalog.contains(oid)).isFalse();
        }

        @Test
        void unknownOidIsNotFound() {
            assertThatThrownBy(() -> catalog.remove(Oid.random(), true)).isInstanceOf(NotFoundException.class);
        }

        @Test
        void reinstateRestoresRecordAndReverseIndex() throws Exception {
            Oid crs = catalog.register("obj_LocalDepth3dCrs", List.of());
            Oid grid = catalog.register("obj_IjkGridRepresentation", List.of(crs));
            CatalogEntry snapshot = catalog.resolve(crs);

            catalog.remove(crs, true);
            catalog.reinstate(snapshot);

            assertThat(catalog.referencing(crs)).containsExactly(grid);
        }
    }

    @Test
    void updateReferencesRepairsInvalidEntry() throws Exception {
        Oid crs = catalog.register("obj_LocalDepth3dCrs", List.of());
        Oid other = catalog.register("obj_LocalDepth3dCrs", List.of());
        Oid grid = catalog.register("obj_IjkGridRepresentation", List.of(crs));
        catalog.remove(crs, true);

        catalog.updateReferences(grid, List.of(other));

        assertThat(catalog.resolve(grid).isValid()).isTrue();
        assertThat(catalog.referencing(other)).containsExactly(grid);
        assertThat(catalog.danglingReferences()).isEmpty();
    }

    @Test
    void oidParseAcceptsBracesAndUpperCase() {
        Oid oid = Oid.parse("{A1B2C3D4-0000-4000-8000-000000000001}");

        assertThat(oid.toString()).isEqualTo("a1b2c3d4-0000-4000-8000-000000000001");
        assertThatThrownBy(() -> Oid.parse("not-an-oid")).isInstanceOf(IllegalArgumentException.class);
    }
}
