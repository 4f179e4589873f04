package resqpack.core.arrays;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where a not-yet-materialized payload lives. Opening a source is the only
 * point at which payload I/O happens.
 */
public interface PayloadSource {
    /**
     * Opens a fresh stream positioned at the start of the payload header.
     */
    InputStream open() throws IOException;

    /**
     * Human readable location, for diagnostics.
     */
    String describe();
}
