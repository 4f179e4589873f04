package resqpack.core;

import java.util.Objects;
import java.util.Properties;

import resqpack.core.arrays.Compression;
import resqpack.utils.io.IoRetry;

/**
 * Package-level configuration, passed explicitly to the package manager and
 * the array store. Immutable; build with {@link #builder()}.
 */
public final class PackageOptions {
    public static final String PREFIX = "resqpack.";

    private final Compression defaultCompression;
    private final long chunkThresholdBytes;
    private final int chunkElements;
    private final int ioRetryAttempts;
    private final long ioRetryBaseDelayMillis;
    private final long saveLockTimeoutMillis;
    private final boolean strictTypes;
    private final boolean verifyChecksums;

    private PackageOptions(Builder builder) {
        this.defaultCompression = Objects.requireNonNull(builder.defaultCompression, "defaultCompression");
        this.chunkThresholdBytes = requirePositive("chunkThresholdBytes", builder.chunkThresholdBytes);
        this.chunkElements = (int) requirePositive("chunkElements", builder.chunkElements);
        this.ioRetryAttempts = (int) requirePositive("ioRetryAttempts", builder.ioRetryAttempts);
        if (builder.ioRetryBaseDelayMillis < 0) {
            throw new IllegalArgumentException("ioRetryBaseDelayMillis must not be negative");
        }
        this.ioRetryBaseDelayMillis = builder.ioRetryBaseDelayMillis;
        this.saveLockTimeoutMillis = requirePositive("saveLockTimeoutMillis", builder.saveLockTimeoutMillis);
        this.strictTypes = builder.strictTypes;
        this.verifyChecksums = builder.verifyChecksums;
    }

    public static PackageOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code resqpack.*} keys, falling back to defaults for absent keys.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static PackageOptions fromProperties(Properties props) {
        Builder builder = builder();
        String value;
        if ((value = props.getProperty(PREFIX + "defaultCompression")) != null) {
            builder.defaultCompression(Compression.fromString(value.trim()));
        }
        if ((value = props.getProperty(PREFIX + "chunkThresholdBytes")) != null) {
            builder.chunkThresholdBytes(parseLong("chunkThresholdBytes", value));
        }
        if ((value = props.getProperty(PREFIX + "chunkElements")) != null) {
            builder.chunkElements((int) parseLong("chunkElements", value));
        }
        if ((value = props.getProperty(PREFIX + "ioRetryAttempts")) != null) {
            builder.ioRetryAttempts((int) parseLong("ioRetryAttempts", value));
        }
        if ((value = props.getProperty(PREFIX + "ioRetryBaseDelayMillis")) != null) {
            builder.ioRetryBaseDelayMillis(parseLong("ioRetryBaseDelayMillis", value));
        }
        if ((value = props.getProperty(PREFIX + "saveLockTimeoutMillis")) != null) {
            builder.saveLockTimeoutMillis(parseLong("saveLockTimeoutMillis", value));
        }
        if ((value = props.getProperty(PREFIX + "strictTypes")) != null) {
            builder.strictTypes(parseBoolean("strictTypes", value));
        }
        if ((value = props.getProperty(PREFIX + "verifyChecksums")) != null) {
            builder.verifyChecksums(parseBoolean("verifyChecksums", value));
        }
        return builder.build();
    }

    public Compression getDefaultCompression() {
        return defaultCompression;
    }

    /**
     * Arrays larger than this many bytes are not kept in the read cache and
     * are meant to be consumed chunk by chunk.
     */
    public long getChunkThresholdBytes() {
        return chunkThresholdBytes;
    }

    public int getChunkElements() {
        return chunkElements;
    }

    public int getIoRetryAttempts() {
        return ioRetryAttempts;
    }

    public long getIoRetryBaseDelayMillis() {
        return ioRetryBaseDelayMillis;
    }

    public long getSaveLockTimeoutMillis() {
        return saveLockTimeoutMillis;
    }

    public boolean isStrictTypes() {
        return strictTypes;
    }

    public boolean isVerifyChecksums() {
        return verifyChecksums;
    }

    public IoRetry ioRetry() {
        return new IoRetry(ioRetryAttempts, ioRetryBaseDelayMillis);
    }

    public Builder toBuilder() {
        return builder()
                .defaultCompression(defaultCompression)
                .chunkThresholdBytes(chunkThresholdBytes)
                .chunkElements(chunkElements)
                .ioRetryAttempts(ioRetryAttempts)
                .ioRetryBaseDelayMillis(ioRetryBaseDelayMillis)
                .saveLockTimeoutMillis(saveLockTimeoutMillis)
                .strictTypes(strictTypes)
                .verifyChecksums(verifyChecksums);
    }

    private static long requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
        return value;
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + value);
    }

    @Override
    public String toString() {
        return "PackageOptions{compression=" + defaultCompression.getMarker()
                + ", chunkThresholdBytes=" + chunkThresholdBytes
                + ", chunkElements=" + chunkElements
                + ", ioRetryAttempts=" + ioRetryAttempts
                + ", strictTypes=" + strictTypes + "}";
    }

    public static final class Builder {
        private Compression defaultCompression = Compression.DEFLATE;
        private long chunkThresholdBytes = 64L * 1024 * 1024;
        private long chunkElements = 1 << 20;
        private long ioRetryAttempts = 3;
        private long ioRetryBaseDelayMillis = 50;
        private long saveLockTimeoutMillis = 30_000;
        private boolean strictTypes = true;
        private boolean verifyChecksums = true;

        private Builder() {
        }

        public Builder defaultCompression(Compression compression) {
            this.defaultCompression = compression;
            return this;
        }

        public Builder chunkThresholdBytes(long bytes) {
            this.chunkThresholdBytes = bytes;
            return this;
        }

        public Builder chunkElements(int elements) {
            this.chunkElements = elements;
            return this;
        }

        public Builder ioRetryAttempts(int attempts) {
            this.ioRetryAttempts = attempts;
            return this;
        }

        public Builder ioRetryBaseDelayMillis(long millis) {
            this.ioRetryBaseDelayMillis = millis;
            return this;
        }

        public Builder saveLockTimeoutMillis(long millis) {
            this.saveLockTimeoutMillis = millis;
            return this;
        }

        public Builder strictTypes(boolean strict) {
            this.strictTypes = strict;
            return this;
        }

        public Builder verifyChecksums(boolean verify) {
            this.verifyChecksums = verify;
            return this;
        }

        public PackageOptions build() {
            return new PackageOptions(this);
        }
    }
}
