package vkgraph.commands;

import picocli.CommandLine;
import vkgraph.core.Config;
import vkgraph.graph.GraphStore;
import vkgraph.logic.AnalyticQuery;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

@CommandLine.Command(name = "query", description = "Run analytic queries against the stored graph")
public class Query implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOptions store;

    @CommandLine.Option(
            names = "--query",
            description = "Query to run: ${COMPLETION-CANDIDATES} (default: all)"
    )
    AnalyticQuery query;

    Supplier<Config> configSource = Config::load;
    Prompter prompter = Prompter.console();
    Function<Config, GraphStore> storeFactory = cfg -> store.connect(cfg);

    @Override
    public Integer call() {
        Config cfg = store.resolve(configSource.get(), prompter);
        PrintWriter out = spec.commandLine().getOut();
        try (GraphStore graph = storeFactory.apply(cfg)) {
            if (query != null) {
                query.run(graph, out);
            } else {
                AnalyticQuery.runAll(graph, out);
            }
        }
        return 0;
    }
}
