package resqpack.cli.mixins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import resqpack.core.PackageOptions;
import resqpack.core.objects.ObjectKindRegistry;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ResqException;
import resqpack.model.Model;

/**
 * Mixin for commands that work on one package container.
 *
 * Package options come from the defaults, overridden by a {@code resqpack.*}
 * properties file given with {@code --config}, overridden by explicit flags.
 */
public class PackageMixin {

    @Parameters(index = "0", paramLabel = "<container>", description = "Package container file (.epc)")
    private Path container;

    @Option(names = { "--config" }, paramLabel = "<file>", description = "Properties file with resqpack.* options")
    private Path config;

    @Option(names = { "--lenient-types" }, description = "Accept object types no kind is registered for")
    private boolean lenientTypes;

    @Option(names = { "--no-checksums" }, description = "Skip array checksum verification")
    private boolean noChecksums;

    public Path getContainer() {
        return container;
    }

    public PackageOptions options() throws ResqException {
        PackageOptions options = PackageOptions.defaults();
        if (config != null) {
            if (!Files.isRegularFile(config)) {
                throw new NotFoundException(config.toString(), "Config file not found: " + config);
            }
            Properties props = new Properties();
            try (InputStream in = Files.newInputStream(config)) {
                props.load(in);
            } catch (IOException e) {
                throw new ResqException("Cannot read config file " + config + ": " + e.getMessage(), e);
            }
            options = PackageOptions.fromProperties(props);
        }
        PackageOptions.Builder builder = options.toBuilder();
        if (lenientTypes) {
            builder.strictTypes(false);
        }
        if (noChecksums) {
            builder.verifyChecksums(false);
        }
        return builder.build();
    }

    /**
     * Loads the container; part diagnostics stay in the model's load report.
     */
    public Model open() throws ResqException {
        return Model.load(container, options(), ObjectKindRegistry.loadDefault());
    }
}
