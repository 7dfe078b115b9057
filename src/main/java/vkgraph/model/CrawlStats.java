package vkgraph.model;

/** Summary of one crawl run. */
public record CrawlStats(
        int usersExpanded,
        int friendEdges,
        int subscriptionEdges,
        int privateSkipped,
        int fetchFailures,
        int storeFailures
) {
    public static CrawlStats empty() {
        return new CrawlStats(0, 0, 0, 0, 0, 0);
    }
}
