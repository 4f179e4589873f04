package resqpack.core.container;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.NotFoundException;
import resqpack.utils.io.FileUtils;
import resqpack.utils.io.IoRetry;

/**
 * Read access to the entries of a container file. The entry inventory is
 * taken once on open; entries whose names collide ignoring case are reported
 * by {@link #duplicateNames()} rather than silently shadowed.
 */
public final class ContainerReader implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ContainerReader.class);

    private final Path path;
    private final IoRetry retry;
    private final ZipFile zip;
    private final List<String> entryNames;
    private final Set<String> duplicates;

    private ContainerReader(Path path, IoRetry retry, ZipFile zip) {
        this.path = path;
        this.retry = retry;
        this.zip = zip;

        List<String> names = new ArrayList<>();
        Map<String, String> seen = new LinkedHashMap<>();
        Set<String> dupes = new LinkedHashSet<>();
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (entry.isDirectory()) {
                continue;
            }
            String name = entry.getName();
            String previous = seen.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                dupes.add(name);
                dupes.add(previous);
            } else {
                names.add(name);
            }
        }
        this.entryNames = Collections.unmodifiableList(names);
        this.duplicates = Collections.unmodifiableSet(dupes);
    }

    /**
     * Opens {@code path}, retrying transient failures.
     *
     * @throws NotFoundException   if the file does not exist
     * @throws CorruptionException if it is not a readable zip container
     */
    public static ContainerReader open(Path path, IoRetry retry) throws NotFoundException, CorruptionException {
        if (!FileUtils.isFile(path)) {
            throw new NotFoundException(path.toString(), "Container not found: " + path);
        }
        try {
            ZipFile zip = retry.call("open " + path, () -> new ZipFile(path.toFile()));
            ContainerReader reader = new ContainerReader(path, retry, zip);
            log.debug("Opened {} with {} entries", path, reader.entryNames.size());
            return reader;
        } catch (IOException e) {
            throw new CorruptionException(path.getFileName().toString(), "Cannot read container " + path + ": "
                    + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Distinct entry names in container order; for names that collide only the
     * first occurrence is listed.
     */
    public List<String> entryNames() {
        return entryNames;
    }

    /**
     * Every entry name that collides with another ignoring case.
     */
    public Set<String> duplicateNames() {
        return duplicates;
    }

    public boolean contains(String entryName) {
        return zip.getEntry(entryName) != null;
    }

    /**
     * Reads a whole entry.
     *
     * @throws NotFoundException   if there is no such entry
     * @throws CorruptionException if the entry cannot be read
     */
    public byte[] read(String entryName) throws NotFoundException, CorruptionException {
        ZipEntry entry = zip.getEntry(entryName);
        if (entry == null) {
            throw new NotFoundException(entryName, "No entry " + entryName + " in " + path);
        }
        try {
            return retry.call("read " + entryName, () -> {
                try (InputStream in = zip.getInputStream(entry)) {
                    return in.readAllBytes();
                }
            });
        } catch (IOException e) {
            throw new CorruptionException(entryName, "Cannot read " + entryName + " from " + path + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * A payload source for an entry that stays valid after this reader is
     * closed.
     */
    public ContainerPayloadSource payloadSource(String entryName) {
        return new ContainerPayloadSource(path, entryName, retry);
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
