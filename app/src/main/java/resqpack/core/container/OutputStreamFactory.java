package resqpack.core.container;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the stream a container is written to.
 */
@FunctionalInterface
public interface OutputStreamFactory {
    OutputStreamFactory FILES = Files::newOutputStream;

    OutputStream open(Path path) throws IOException;
}
