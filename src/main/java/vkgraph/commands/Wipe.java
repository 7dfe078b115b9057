package vkgraph.commands;

import picocli.CommandLine;
import vkgraph.core.Config;
import vkgraph.graph.GraphStore;

import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

@CommandLine.Command(name = "wipe", description = "Delete every node and relationship from the Neo4j database")
public class Wipe implements Callable<Integer> {

    @CommandLine.Mixin
    StoreOptions store;

    Supplier<Config> configSource = Config::load;
    Prompter prompter = Prompter.console();
    Function<Config, GraphStore> storeFactory = cfg -> store.connect(cfg);

    @Override
    public Integer call() {
        Config cfg = store.resolve(configSource.get(), prompter);
        try (GraphStore graph = storeFactory.apply(cfg)) {
            graph.wipe();
        }
        return 0;
    }
}
