package resqpack.cli.exceptions;

import resqpack.exceptions.ResqException;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;

/**
 * Custom exception handler for execution exceptions
 */
public class ResqExecutionExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult) {

        if (ex instanceof ResqException) {
            commandLine.getErr().println("fatal: " + ex.getMessage());
            for (Throwable suppressed : ex.getSuppressed()) {
                commandLine.getErr().println("  also: " + suppressed.getMessage());
            }
        } else {
            commandLine.getErr().println("error: " + ex.getMessage());
        }
        if (parseResult.hasMatchedOption("--debug")) {
            ex.printStackTrace(commandLine.getErr());
        }

        return 1;
    }
}
