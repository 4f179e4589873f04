package resqpack;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import resqpack.cli.commands.GraphCommand;
import resqpack.cli.commands.InspectCommand;
import resqpack.cli.commands.ValidateCommand;
import resqpack.cli.exceptions.ResqExecutionExceptionHandler;
import resqpack.cli.exceptions.ResqParameterExceptionHandler;
import resqpack.cli.mixins.GlobalOptionsMixin;
import resqpack.cli.mixins.VersionProvider;

@Command(name = "resq", description = "Inspect and check RESQML style package containers", versionProvider = VersionProvider.class, mixinStandardHelpOptions = true, subcommands = {
                InspectCommand.class,
                ValidateCommand.class,
                GraphCommand.class,
                CommandLine.HelpCommand.class
}, footer = {
                "",
                "Examples:",
                "  resq inspect model.epc              List parts, titles and arrays",
                "  resq validate model.epc             Report every part that fails its checks",
                "  resq graph model.epc                Print the reference edges",
                "  resq --version                      Show version information"
})
public class ResqPack implements Runnable {
        @Mixin
        private GlobalOptionsMixin globalOptions;

        public static void main(String[] args) {
                System.exit(newCommandLine().execute(args));
        }

        /**
         * Command line with the handlers and settings {@link #main} uses.
         */
        public static CommandLine newCommandLine() {
                CommandLine commandLine = new CommandLine(new ResqPack())
                                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                                .setExecutionExceptionHandler(new ResqExecutionExceptionHandler())
                                .setParameterExceptionHandler(new ResqParameterExceptionHandler())
                                .setUsageHelpAutoWidth(true);

                commandLine.setAbbreviatedSubcommandsAllowed(true);
                commandLine.setAbbreviatedOptionsAllowed(true);
                return commandLine;
        }

        @Override
        public void run() {
                // When no subcommand is specified, show help
                CommandLine.usage(this, System.out);
        }
}
