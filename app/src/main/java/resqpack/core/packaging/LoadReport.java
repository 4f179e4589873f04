package resqpack.core.packaging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import resqpack.exceptions.PackageLoadException;
import resqpack.exceptions.ResqException;

/**
 * Outcome of opening a container: how many parts were loaded and what went
 * wrong with the others. Parts with a diagnostic are left out of the package
 * unless the problem is confined to their own content (see
 * {@link PartDiagnostic}).
 */
public final class LoadReport {
    private final String source;
    private final int loadedParts;
    private final List<PartDiagnostic> diagnostics;

    public LoadReport(String source, int loadedParts, List<PartDiagnostic> diagnostics) {
        this.source = source;
        this.loadedParts = loadedParts;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static LoadReport empty() {
        return new LoadReport("<new>", 0, Collections.emptyList());
    }

    public String getSource() {
        return source;
    }

    public int getLoadedParts() {
        return loadedParts;
    }

    public List<PartDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public List<PartDiagnostic> diagnosticsFor(String partName) {
        List<PartDiagnostic> result = new ArrayList<>();
        for (PartDiagnostic diagnostic : diagnostics) {
            if (diagnostic.getPartName().equalsIgnoreCase(partName)) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    /**
     * Diagnostics whose error is an instance of {@code type}.
     */
    public List<PartDiagnostic> diagnosticsOf(Class<? extends ResqException> type) {
        List<PartDiagnostic> result = new ArrayList<>();
        for (PartDiagnostic diagnostic : diagnostics) {
            if (type.isInstance(diagnostic.getError())) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public void throwIfAny() throws PackageLoadException {
        if (!diagnostics.isEmpty()) {
            throw new PackageLoadException(source, diagnostics);
        }
    }

    @Override
    public String toString() {
        return "LoadReport{source=" + source + ", loaded=" + loadedParts + ", diagnostics=" + diagnostics.size() + "}";
    }
}
