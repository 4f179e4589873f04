package resqpack.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import resqpack.cli.mixins.GlobalOptionsMixin;
import resqpack.cli.mixins.PackageMixin;
import resqpack.model.Model;
import resqpack.model.ObjectGraph;

@Command(name = "graph", description = "Print the reference graph of a package container", mixinStandardHelpOptions = true)
public class GraphCommand implements Callable<Integer> {

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
        ObjectGraph graph = model.asGraph(null);
        for (ObjectGraph.Node node : graph.getNodes().values()) {
            out.println("node " + node);
        }
        for (ObjectGraph.Edge edge : graph.getEdges()) {
            out.println("edge " + edge);
        }
        out.flush();
        return 0;
    }
}
