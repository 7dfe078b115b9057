package vkgraph.logic;

import vkgraph.graph.WriteResult;
import vkgraph.model.CrawlStats;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable bookkeeping of a single crawl. One instance is shared by every traversal
 * step of that crawl and dropped when it ends. Not thread-safe.
 */
final class CrawlState {
    private final Set<Long> visited = new HashSet<>();

    int usersExpanded;
    int friendEdges;
    int subscriptionEdges;
    int privateSkipped;
    int fetchFailures;
    int storeFailures;

    /** @return true the first time {@code userId} is seen, false ever after */
    boolean markVisited(long userId) {
        return visited.add(userId);
    }

    boolean isVisited(long userId) {
        return visited.contains(userId);
    }

    int visitedCount() {
        return visited.size();
    }

    /** Counts a failed write; returns whether the write was applied. */
    boolean record(WriteResult result) {
        if (!result.applied()) storeFailures++;
        return result.applied();
    }

    CrawlStats toStats() {
        return new CrawlStats(usersExpanded, friendEdges, subscriptionEdges, privateSkipped, fetchFailures, storeFailures);
    }
}
