package resqpack.core.container;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import resqpack.core.identity.Oid;

class ContainerLayoutTest {

    @Test
    void defaultPartNameEmbedsTypeAndOid() {
        Oid oid = Oid.parse("0b8f2f4e-7e0b-4a3e-9e4f-2a1b3c4d5e6f");

        assertThat(ContainerLayout.defaultPartName("LocalDepth3dCrs", oid))
                .isEqualTo("obj_LocalDepth3dCrs_0b8f2f4e-7e0b-4a3e-9e4f-2a1b3c4d5e6f.xml");
        assertThat(ContainerLayout.relationshipsPartFor("obj_A.xml")).isEqualTo("_rels/obj_A.xml.rels");
    }

    @Test
    void nestedPartKeepsRelationshipsBesideIt() {
        assertThat(ContainerLayout.relationshipsPartFor("sub/crs.xml")).isEqualTo("sub/_rels/crs.xml.rels");
        assertThat(ContainerLayout.relationshipsPartFor("a/b/grid.xml")).isEqualTo("a/b/_rels/grid.xml.rels");
        assertThat(ContainerLayout.isMetadataPart(ContainerLayout.relationshipsPartFor("sub/crs.xml"))).isFalse();
    }

    @Test
    void classifiesEntries() {
        assertThat(ContainerLayout.isMetadataPart("obj_Grid_1.xml")).isTrue();
        assertThat(ContainerLayout.isMetadataPart("sub/obj_Grid_1.XML")).isTrue();
        assertThat(ContainerLayout.isMetadataPart(ContainerLayout.CONTENT_TYPES)).isFalse();
        assertThat(ContainerLayout.isMetadataPart(ContainerLayout.CORE_PROPERTIES)).isFalse();
        assertThat(ContainerLayout.isMetadataPart("sub/_rels/obj_Grid_1.xml")).isFalse();
        assertThat(ContainerLayout.isArrayPart("arrays/abc/Values.bin")).isTrue();
        assertThat(ContainerLayout.isArrayPart("Values.bin")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "/abs.xml", "a\\b.xml", "../up.xml", "a//b.xml", "no-extension", "_rels/x.xml",
            "arrays/x.xml", " " })
    void rejectsUnusablePartNames(String name) {
        assertThatThrownBy(() -> ContainerLayout.requireValidPartName(name))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void relativeTargetsResolveBack() {
        assertThat(ContainerLayout.relativeTarget("a.xml", "b.xml")).isEqualTo("b.xml");
        assertThat(ContainerLayout.relativeTarget("dir/a.xml", "dir/b.xml")).isEqualTo("b.xml");
        assertThat(ContainerLayout.relativeTarget("dir/a.xml", "b.xml")).isEqualTo("../b.xml");

        assertThat(ContainerLayout.resolveTarget("dir/a.xml", "../b.xml")).isEqualTo("b.xml");
        assertThat(ContainerLayout.resolveTarget("dir/a.xml", "./c/d.xml")).isEqualTo("dir/c/d.xml");
        assertThat(ContainerLayout.resolveTarget("dir/a.xml", "/root.xml")).isEqualTo("root.xml");
    }
}
