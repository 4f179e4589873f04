package resqpack.utils.io;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.zip.ZipException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries transient I/O failures with exponential backoff and jitter:
 *
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * 0.1)
 * </pre>
 *
 * Structural failures (missing file, malformed zip) are never retried since a
 * second attempt would see the same bytes.
 */
public final class IoRetry {
    private static final Logger log = LoggerFactory.getLogger(IoRetry.class);
    private static final double JITTER_FACTOR = 0.1;
    private static final long MAX_DELAY_MILLIS = 5_000;

    private final int attempts;
    private final long baseDelayMillis;

    public IoRetry(int attempts, long baseDelayMillis) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        if (baseDelayMillis < 0) {
            throw new IllegalArgumentException("baseDelayMillis must not be negative (current: " + baseDelayMillis + ")");
        }
        this.attempts = attempts;
        this.baseDelayMillis = baseDelayMillis;
    }

    public static IoRetry none() {
        return new IoRetry(1, 0);
    }

    @FunctionalInterface
    public interface IoAction<T> {
        T run() throws IOException;
    }

    public <T> T call(String what, IoAction<T> action) throws IOException {
        int attempt = 1;
        while (true) {
            try {
                return action.run();
            } catch (IOException e) {
                if (attempt >= attempts || !isTransient(e)) {
                    throw e;
                }
                long delay = delayFor(attempt);
                log.warn("I/O failure on {} (attempt {}/{}), retrying in {} ms: {}", what, attempt, attempts, delay,
                        e.getMessage());
                sleep(delay);
                attempt++;
            }
        }
    }

    long delayFor(int attempt) {
        long exponential = Math.min(baseDelayMillis * (1L << Math.min(attempt - 1, 20)), MAX_DELAY_MILLIS);
        long jitter = (long) (exponential * JITTER_FACTOR * Math.random());
        return Math.min(exponential + jitter, MAX_DELAY_MILLIS);
    }

    static boolean isTransient(IOException e) {
        return !(e instanceof ZipException
                || e instanceof NoSuchFileException
                || e instanceof FileNotFoundException
                || e instanceof InterruptedIOException);
    }

    private static void sleep(long millis) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
