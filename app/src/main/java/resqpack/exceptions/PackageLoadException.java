package resqpack.exceptions;

import java.util.List;

import resqpack.core.packaging.PartDiagnostic;

/**
 * Raised by a strict load when one or more parts failed their checks. The
 * individual failures stay available through {@link #getDiagnostics()}.
 */
public class PackageLoadException extends ResqException {
    private final List<PartDiagnostic> diagnostics;

    public PackageLoadException(String source, List<PartDiagnostic> diagnostics) {
        super("Failed to load " + source + ": " + diagnostics.size() + " part(s) with errors, first: "
                + (diagnostics.isEmpty() ? "none" : diagnostics.get(0)));
        this.diagnostics = List.copyOf(diagnostics);
        diagnostics.forEach(d -> addSuppressed(d.getError()));
    }

    public List<PartDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
