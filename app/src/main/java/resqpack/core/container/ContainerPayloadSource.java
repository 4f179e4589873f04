package resqpack.core.container;

import java.io.FileNotFoundException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import resqpack.core.arrays.PayloadSource;
import resqpack.utils.io.IoRetry;

/**
 * Array payload stored as an entry of a saved container. Each
 * {@link #open()} opens the container afresh and closes it with the returned
 * stream, so no file handle is held between reads.
 */
public final class ContainerPayloadSource implements PayloadSource {
    private final Path container;
    private final String entryName;
    private final IoRetry retry;

    public ContainerPayloadSource(Path container, String entryName, IoRetry retry) {
        this.container = container;
        this.entryName = entryName;
        this.retry = retry;
    }

    @Override
    public InputStream open() throws IOException {
        return retry.call("open " + describe(), () -> {
            ZipFile zip = new ZipFile(container.toFile());
            ZipEntry entry = zip.getEntry(entryName);
            if (entry == null) {
                zip.close();
                throw new FileNotFoundException("No entry " + entryName + " in " + container);
            }
            InputStream in;
            try {
                in = zip.getInputStream(entry);
            } catch (IOException e) {
                zip.close();
                throw e;
            }
            return new FilterInputStream(in) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        zip.close();
                    }
                }
            };
        });
    }

    public Path getContainer() {
        return container;
    }

    public String getEntryName() {
        return entryName;
    }

    @Override
    public String describe() {
        return container.getFileName() + "!" + entryName;
    }
}
