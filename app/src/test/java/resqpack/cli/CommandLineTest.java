package resqpack.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import resqpack.ResqPack;
import resqpack.cli.commands.ValidateCommand;
import resqpack.core.arrays.ArrayData;
import resqpack.core.identity.Oid;
import resqpack.core.objects.impl.ContinuousProperty;
import resqpack.core.objects.impl.IjkGridRepresentation;
import resqpack.core.objects.impl.LocalDepth3dCrs;
import resqpack.model.Model;
import resqpack.utils.io.FileUtils;

class CommandLineTest {
    @TempDir
    Path tempDir;

    private Path container;
    private Oid crs;
    private Oid grid;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws Exception {
        Model model = Model.create();
        crs = model.add(LocalDepth3dCrs.draft("local"));
        grid = model.add(IjkGridRepresentation.draft("Grid North", 2, 1, 1, crs));
        model.add(ContinuousProperty.draft("Porosity", grid, "m3/m3"),
                Map.of("Values", ArrayData.ofDoubles(new int[] { 2 }, 0.2, 0.3)));
        container = tempDir.resolve("model.epc");
        model.save(container);
    }

    private int run(String... args) {
        CommandLine cli = ResqPack.newCommandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    void validateAcceptsCleanContainer() {
        int exit = run("validate", "--no-color", container.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("ok: 3 parts in " + container);
    }

    @Test
    void verboseValidatePrintsContainerChecksum() throws Exception {
        int exit = run("validate", "--no-color", "-v", container.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("sha256 " + FileUtils.sha256(container));
    }

    @Test
    void validateReportsBrokenParts() throws Exception {
        Model model = Model.load(container);
        String crsPart = model.partName(crs).orElseThrow();
        Path broken = tempDir.resolve("broken.epc");
        copyWithout(container, broken, crsPart);

        int exit = run("validate", "--no-color", broken.toString());

        assertThat(exit).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(out.toString())
                .contains("invalid: " + model.partName(grid).orElseThrow())
                .contains("DanglingReferenceException")
                .contains("1 problems in " + broken);
    }

    @Test
    void inspectListsMatchingObjects() {
        int exit = run("inspect", "--no-color", "--title", "grid", "--mode", "STARTS", "-a", container.toString());

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains(grid + " IjkGridRepresentation Grid North")
                .doesNotContain("Porosity")
                .contains("1 of 3 objects");
    }

    @Test
    void inspectShowsArraysAndParts() {
        int exit = run("inspect", "--no-color", "-v", "-a", "-t", "ContinuousProperty", container.toString());

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("Porosity")
                .contains("    part ")
                .contains("Values FLOAT64 [2]");
    }

    @Test
    void graphPrintsReferenceEdges() {
        int exit = run("graph", "--no-color", container.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("edge ").contains(crs.toString()).contains(grid.toString());
    }

    @Test
    void missingContainerIsFatal() {
        int exit = run("validate", tempDir.resolve("absent.epc").toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("fatal: ");
    }

    @Test
    void missingArgumentIsUsageError() {
        int exit = run("inspect");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("error: ").contains("Usage:");
    }

    @Test
    void usageErrorListsExitCodes() {
        int exit = run("validate", "--quiet", "--verbose", container.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString())
                .contains("--quiet cannot be combined")
                .contains("Exit codes: 0 ok, 1 fatal error, 2 usage error, 3 package has invalid parts");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void versionNamesSchemaAndKinds() {
        int exit = run("--version");

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("RESQML schema version 2.0")
                .contains(IjkGridRepresentation.TYPE)
                .contains(LocalDepth3dCrs.TYPE);
    }

    private static void copyWithout(Path source, Path target, String entry) throws Exception {
        try (ZipFile zip = new ZipFile(source.toFile());
                ZipOutputStream zout = new ZipOutputStream(Files.newOutputStream(target))) {
            for (ZipEntry e : Collections.list(zip.entries())) {
                if (e.getName().equals(entry)) {
                    continue;
                }
                zout.putNextEntry(new ZipEntry(e.getName()));
                try (InputStream in = zip.getInputStream(e)) {
                    in.transferTo(zout);
                }
                zout.closeEntry();
            }
        }
    }
}
