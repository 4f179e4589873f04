package resqpack.cli.mixins;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.stream.Collectors;

import picocli.CommandLine.IVersionProvider;

import resqpack.core.metadata.MetadataCodec;
import resqpack.core.objects.ObjectKind;
import resqpack.core.objects.ObjectKindRegistry;

/**
 * Version of the tool with the metadata schema version it writes and the
 * object kinds found on the class path.
 */
public class VersionProvider implements IVersionProvider {
    static final String VERSION_RESOURCE = "/resq-version.properties";

    @Override
    public String[] getVersion() throws IOException {
        Properties build = new Properties();
        try (InputStream in = getClass().getResourceAsStream(VERSION_RESOURCE)) {
            if (in != null) {
                build.load(in);
            }
        }

        String kinds = ObjectKindRegistry.loadDefault().kinds().stream()
                .map(ObjectKind::getType)
                .sorted()
                .collect(Collectors.joining(", "));

        return new String[] {
                "@|bold resq|@ " + build.getProperty("version", "dev") + " (built "
                        + build.getProperty("build.time", "unknown") + ")",
                "RESQML schema version " + MetadataCodec.SCHEMA_VERSION,
                "Object kinds: " + kinds,
                "Java " + System.getProperty("java.version")
        };
    }
}
