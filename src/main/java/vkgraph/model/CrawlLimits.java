package vkgraph.model;

public record CrawlLimits(int depthLimit, int friendsLimit, int subscriptionsLimit) {
    public static final int DEFAULT_DEPTH = 3;
    public static final int DEFAULT_FRIENDS = 100;
    public static final int DEFAULT_SUBSCRIPTIONS = 300;

    public CrawlLimits {
        if (depthLimit < 1) throw new IllegalArgumentException("depth limit must be at least 1");
        if (friendsLimit < 1) throw new IllegalArgumentException("friends limit must be at least 1");
        if (subscriptionsLimit < 1) throw new IllegalArgumentException("subscriptions limit must be at least 1");
    }

    public static CrawlLimits defaults() {
        return new CrawlLimits(DEFAULT_DEPTH, DEFAULT_FRIENDS, DEFAULT_SUBSCRIPTIONS);
    }
}
