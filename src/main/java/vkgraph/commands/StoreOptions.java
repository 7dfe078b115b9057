package vkgraph.commands;

import picocli.CommandLine;
import vkgraph.core.Config;
import vkgraph.graph.Neo4jGraphStore;

/** Neo4j connection options shared by every subcommand. */
public class StoreOptions {

    @CommandLine.Option(
            names = "--uri",
            description = "Neo4j URI (default: neo4j.uri / NEO4J_URI, else bolt://localhost:7687)"
    )
    String uri;

    @CommandLine.Option(
            names = "--db-user",
            description = "Neo4j user name (default: neo4j.user / NEO4J_USER, else neo4j)"
    )
    String dbUser;

    /** Overlays the options on {@code cfg}, prompting for the password if none is configured. */
    Config resolve(Config cfg, Prompter prompter) {
        String u = uri != null ? uri : cfg.neo4jUri();
        String user = dbUser != null ? dbUser : cfg.neo4jUser();
        String password = prompter.orAsk(cfg.neo4jPassword(), "Neo4j password for " + user, true);
        return cfg.withNeo4j(u, user, password);
    }

    Neo4jGraphStore connect(Config cfg) {
        return Neo4jGraphStore.connect(cfg.neo4jUri(), cfg.neo4jUser(), cfg.neo4jPassword());
    }
}
