package resqpack.cli.exceptions;

import java.io.PrintWriter;

import picocli.CommandLine;
import picocli.CommandLine.IParameterExceptionHandler;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.UnmatchedArgumentException;

import resqpack.cli.commands.ValidateCommand;

/**
 * Reports a bad command line with the usage of the command it was meant for.
 * Exits 2, kept apart from the exit code validate uses for an invalid
 * package.
 */
public class ResqParameterExceptionHandler implements IParameterExceptionHandler {
    public static final int EXIT_USAGE = 2;

    @Override
    public int handleParseException(ParameterException ex, String[] args) {
        CommandLine cmd = ex.getCommandLine();
        PrintWriter err = cmd.getErr();

        err.println("error: " + ex.getMessage());
        UnmatchedArgumentException.printSuggestions(ex, err);
        err.println();
        cmd.usage(err);
        err.println();
        err.println("Exit codes: 0 ok, 1 fatal error, " + EXIT_USAGE + " usage error, "
                + ValidateCommand.EXIT_INVALID + " package has invalid parts (validate)");
        err.flush();

        return EXIT_USAGE;
    }
}
