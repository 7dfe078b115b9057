package vkgraph.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import vkgraph.core.Config;
import vkgraph.core.Http;
import vkgraph.graph.GraphStore;
import vkgraph.logic.AnalyticQuery;
import vkgraph.logic.CrawlOrchestrator;
import vkgraph.logic.SubscriptionCollector;
import vkgraph.model.CrawlLimits;
import vkgraph.model.CrawlStats;
import vkgraph.vk.VkApiClient;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

@CommandLine.Command(name = "crawl", description = "Crawl a user's friends and subscriptions into Neo4j, then print the report")
public class Crawl implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOptions store;

    @CommandLine.Option(
            names = "--user",
            description = "Root VK user id or screen name (prompted when omitted)"
    )
    String user;

    @CommandLine.Option(
            names = "--depth-limit",
            defaultValue = "3",
            description = "Depth limit, root user is depth 1 (default: ${DEFAULT-VALUE})"
    )
    int depthLimit;

    @CommandLine.Option(
            names = "--friends-limit",
            defaultValue = "100",
            description = "Friends fetched per user (default: ${DEFAULT-VALUE})"
    )
    int friendsLimit;

    @CommandLine.Option(
            names = "--subscriptions-limit",
            defaultValue = "300",
            description = "Group subscriptions kept per user (default: ${DEFAULT-VALUE})"
    )
    int subscriptionsLimit;

    @CommandLine.Option(
            names = "--no-wipe",
            description = "Keep existing graph data instead of clearing the database first"
    )
    boolean noWipe;

    @CommandLine.Option(
            names = "--skip-report",
            description = "Do not run the analytic queries after crawling"
    )
    boolean skipReport;

    Supplier<Config> configSource = Config::load;
    Prompter prompter = Prompter.console();
    Function<Config, GraphStore> storeFactory = cfg -> store.connect(cfg);

    @Override
    public Integer call() throws Exception {
        final CrawlLimits limits = limits();

        Config cfg = configSource.get();
        String token = prompter.orAsk(cfg.accessToken(), "VK access token", true);
        String serviceToken = prompter.orAsk(cfg.serviceToken(), "VK service token", true);
        String root = prompter.orAsk(user, "VK user id or screen name", false);
        if (token.isBlank() || serviceToken.isBlank() || root.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "VK access token, service token and root user are required to collect data.");
        }
        cfg = store.resolve(cfg.withTokens(token, serviceToken), prompter);

        final var vk = new VkApiClient(cfg, new Http(cfg));
        final var collector = new SubscriptionCollector(vk);

        try (GraphStore graph = storeFactory.apply(cfg)) {
            if (!noWipe) graph.wipe();

            long t0 = System.currentTimeMillis();
            CrawlStats stats = new CrawlOrchestrator(vk, collector, graph).crawl(root, limits);
            long seconds = (System.currentTimeMillis() - t0) / 1000;
            log.info("Data saved to Neo4j in {}s ({} users expanded)", seconds, stats.usersExpanded());

            if (!skipReport) {
                PrintWriter out = spec.commandLine().getOut();
                AnalyticQuery.runAll(graph, out);
            }
        }
        return 0;
    }

    private CrawlLimits limits() {
        try {
            return new CrawlLimits(depthLimit, friendsLimit, subscriptionsLimit);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
