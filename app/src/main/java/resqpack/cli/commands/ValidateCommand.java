package resqpack.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import resqpack.cli.mixins.GlobalOptionsMixin;
import resqpack.cli.mixins.PackageMixin;
import resqpack.cli.utils.ColorOutput;
import resqpack.core.packaging.LoadReport;
import resqpack.core.packaging.PartDiagnostic;
import resqpack.model.Model;
import resqpack.utils.io.FileUtils;

/**
 * Loads a container leniently and prints one line per diagnostic. Exits 3
 * when any part failed its checks.
 */
@Command(name = "validate", description = "Check every part of a package container", mixinStandardHelpOptions = true, header = "Report parts that fail to load or validate")
public class ValidateCommand implements Callable<Integer> {
    public static final int EXIT_INVALID = 3;

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private PackageMixin packageMixin;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        globalOptions.configure();
        PrintWriter out = spec.commandLine().getOut();

        Model model = packageMixin.open();
        LoadReport report = model.getLoadReport();
        for (PartDiagnostic diagnostic : report.getDiagnostics()) {
            out.println(ColorOutput.red("invalid: ") + diagnostic);
        }

        if (globalOptions.isVerbose()) {
            out.println("sha256 " + FileUtils.sha256(packageMixin.getContainer()));
        }

        if (report.isClean()) {
            if (!globalOptions.isQuiet()) {
                out.println(ColorOutput.green("ok: ") + report.getLoadedParts() + " parts in "
                        + packageMixin.getContainer());
            }
            out.flush();
            return 0;
        }
        if (!globalOptions.isQuiet()) {
            out.println(report.getDiagnostics().size() + " problems in " + packageMixin.getContainer());
        }
        out.flush();
        return EXIT_INVALID;
    }
}
