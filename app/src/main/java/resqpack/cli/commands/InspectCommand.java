package resqpack.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import resqpack.cli.mixins.GlobalOptionsMixin;
import resqpack.cli.mixins.PackageMixin;
import resqpack.cli.utils.ColorOutput;
import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.MetadataDocument;
import resqpack.model.Model;
import resqpack.model.TitleMode;

@Command(name = "inspect", description = "List the objects of a package container", mixinStandardHelpOptions = true, header = "Show parts, titles and arrays", footer = {
        "",
        "Examples:",
        "  resq inspect model.epc                       All parts",
        "  resq inspect -t IjkGridRepresentation m.epc  Grids only",
        "  resq inspect --title Poro --mode STARTS m.epc    Titles starting with Poro",
        "  resq inspect -a model.epc                    Include array shapes"
})
public class InspectCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private PackageMixin packageMixin;

    @Spec
    private CommandSpec spec;

    @Option(names = { "-t", "--type" }, paramLabel = "<type>", description = "Only objects of this type, e.g. ContinuousProperty")
    private String type;

    @Option(names = { "--title" }, paramLabel = "<title>", description = "Only objects whose title matches")
    private String title;

    @Option(names = { "--mode" }, paramLabel = "<mode>", description = "Title match mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})", defaultValue = "EQUALS")
    private TitleMode mode;

    @Option(names = { "-a", "--arrays" }, description = "Show the arrays of each object")
    private boolean showArrays;

    @Override
    public Integer call() throws Exception {
        globalOptions.configure();
        PrintWriter out = spec.commandLine().getOut();

        Model model = packageMixin.open();
        List<Oid> oids = model.oids(type, title, mode);
        for (Oid oid : oids) {
            MetadataDocument doc = model.document(oid);
            out.println(ColorOutput.yellow(oid.toString()) + " " + ColorOutput.cyan(doc.getType()) + " "
                    + doc.getTitle());
            if (globalOptions.isVerbose()) {
                out.println("    part " + model.partName(oid).orElse("?"));
            }
            if (showArrays) {
                for (Map.Entry<String, ArrayHandle> array : doc.getArrays().entrySet()) {
                    ArrayHandle handle = array.getValue();
                    out.println("    " + array.getKey() + " " + handle.getElementType() + " "
                            + ArrayHandle.shapeToString(handle.getShape()) + " " + handle.getPath());
                }
            }
        }

        if (!globalOptions.isQuiet()) {
            out.println();
            out.println(oids.size() + " of " + model.size() + " objects");
            int problems = model.getLoadReport().getDiagnostics().size();
            if (problems > 0) {
                out.println(ColorOutput.red(problems + " load problems, run 'resq validate' for details"));
            }
        }
        out.flush();
        return 0;
    }
}
