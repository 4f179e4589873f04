package resqpack.cli.mixins;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import resqpack.cli.utils.ColorOutput;

/**
 * Output and logging switches shared by every {@code resq} command.
 *
 * The engine logs under the {@code resqpack} logger. Its level follows the
 * flags; the root logger stays at WARN so library chatter never reaches the
 * terminal.
 */
public class GlobalOptionsMixin {
    static final String ENGINE_LOGGER = "resqpack";

    @Spec(Spec.Target.MIXEE)
    private CommandSpec mixee;

    @Option(names = { "-v", "--verbose" }, description = "Also print part names, array shapes and the container checksum")
    private boolean verbose;

    @Option(names = { "-q", "--quiet" }, description = "Print only diagnostics and errors, no summary line")
    private boolean quiet;

    @Option(names = { "--debug" }, description = "Log load and save steps and print stack traces (implies --verbose)")
    private boolean debug;

    @Option(names = { "--no-color" }, description = "Print diagnostics without ANSI colors")
    private boolean noColor;

    /**
     * Applies the flags to the engine logger and the color output.
     *
     * @throws ParameterException if {@code --quiet} is combined with
     *                            {@code --verbose} or {@code --debug}
     */
    public void configure() {
        if (quiet && (verbose || debug)) {
            throw new ParameterException(mixee.commandLine(),
                    "--quiet cannot be combined with --verbose or --debug");
        }
        Logger engine = (Logger) LoggerFactory.getLogger(ENGINE_LOGGER);
        if (debug) {
            engine.setLevel(Level.DEBUG);
        } else if (verbose) {
            engine.setLevel(Level.INFO);
        } else if (quiet) {
            engine.setLevel(Level.ERROR);
        } else {
            engine.setLevel(Level.WARN);
        }
        ColorOutput.setColorEnabled(!noColor);
    }

    public boolean isVerbose() {
        return verbose || debug;
    }

    public boolean isQuiet() {
        return quiet;
    }
}
