package resqpack.utils.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.utils.crypto.HashUtils;

/**
 * Utility class for file operations.
 */
public class FileUtils {
    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    /**
     * Creates directories for the given path if they do not exist.
     */
    public static void createDirectories(Path path) throws IOException {
        if (path != null && !Files.exists(path)) {
            Files.createDirectories(path);
        }
    }

    /**
     * Creates a temporary file next to {@code target} so that it can later be
     * moved over it without crossing file systems.
     */
    public static Path createSiblingTempFile(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        createDirectories(dir);
        return Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    }

    /**
     * Moves {@code source} over {@code target}, atomically where the file
     * system supports it.
     */
    public static void replaceAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Hex SHA-256 of the whole file, read as a stream.
     */
    public static String sha256(Path path) throws IOException {
        MessageDigest digest = HashUtils.newSha256();
        try (InputStream in = new DigestInputStream(Files.newInputStream(path), digest)) {
            byte[] buffer = new byte[8192];
            while (in.read(buffer) >= 0) {
                // digest updates as the stream is read
            }
        }
        return HashUtils.toHex(digest.digest());
    }

    /**
     * Checks if a path is a file.
     */
    public static boolean isFile(Path path) {
        return Files.isRegularFile(path);
    }
}
