package vkgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import vkgraph.commands.Crawl;
import vkgraph.commands.Query;
import vkgraph.commands.Wipe;

@CommandLine.Command(
        name = "vk-graph",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "VK Data Collector and Neo4j Analyzer",
        subcommands = {
                Crawl.class,
                Query.class,
                Wipe.class
        }
)
public class Main implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        var out = spec.commandLine().getOut();
        out.println("Subcommands:");
        out.println("  crawl   (collect a user's graph from VK into Neo4j, then report)");
        out.println("  query   (run analytic queries on the stored graph)");
        out.println("  wipe    (clear the Neo4j database)");
        out.flush();
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** Fully configured command line; errors escaping a subcommand are logged and exit with 1. */
    public static CommandLine commandLine() {
        return new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.error("{} failed: {}", cmd.getCommandName(), ex.toString(), ex);
                    return 1;
                });
    }
}
