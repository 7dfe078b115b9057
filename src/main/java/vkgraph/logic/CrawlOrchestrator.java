package vkgraph.logic;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vkgraph.graph.GraphStore;
import vkgraph.model.CrawlLimits;
import vkgraph.model.CrawlStats;
import vkgraph.model.Group;
import vkgraph.model.User;
import vkgraph.vk.ApiResult;
import vkgraph.vk.FatalApiException;
import vkgraph.vk.UnexpectedShapeException;
import vkgraph.vk.VkApiClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Depth-limited crawl of the friendship graph starting at one user.
 *
 * <p>Traversal is depth-first pre-order over an explicit stack. Every user id is expanded
 * at most once per crawl: the visited set is shared by the whole traversal and checked
 * when an entry is taken off the stack. The root is depth 1; friends of a user at depth
 * {@code d} are expanded only while {@code d < depthLimit}, but FRIEND edges are written
 * for every expanded user regardless of depth.</p>
 *
 * <p>Fetch failures for one user's friends or subscriptions are contained to that user
 * (its counts fall back to 0). Only a failure to resolve the root profile aborts the crawl.</p>
 */
public class CrawlOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

    private final VkApiClient vk;
    private final SubscriptionCollector subscriptions;
    private final GraphStore store;

    public CrawlOrchestrator(VkApiClient vk, SubscriptionCollector subscriptions, GraphStore store) {
        this.vk = vk; this.subscriptions = subscriptions; this.store = store;
    }

    private record Step(long userId, int depth, User profile) {}

    /**
     * @param rootIdentifier numeric id or screen name of the root user
     * @throws FatalApiException if the root profile cannot be fetched
     */
    public CrawlStats crawl(String rootIdentifier, CrawlLimits limits) throws FatalApiException {
        User root = fetchRoot(rootIdentifier);
        if (root == null) {
            log.warn("Root profile {} is private; nothing to crawl", rootIdentifier);
            return CrawlStats.empty();
        }

        var state = new CrawlState();
        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(root.id(), 1, root));

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            if (!state.markVisited(step.userId())) continue;

            User user = step.profile() != null ? step.profile() : fetchProfile(step.userId(), state);
            if (user == null) continue;

            List<Long> friends = expand(user, limits, state);
            log.info("User {} stored (depth {}, {} users visited so far)", user.id(), step.depth(), state.visitedCount());

            if (step.depth() < limits.depthLimit()) {
                // reverse push keeps API order when popping
                for (int i = friends.size() - 1; i >= 0; i--) {
                    long friendId = friends.get(i);
                    if (!state.isVisited(friendId)) {
                        stack.push(new Step(friendId, step.depth() + 1, null));
                    }
                }
            }
        }

        CrawlStats stats = state.toStats();
        log.info("Crawl from {} done: {} users expanded, {} FRIEND edges, {} SUBSCRIBED_TO edges, "
                        + "{} private skipped, {} fetch failures, {} store failures",
                root.id(), stats.usersExpanded(), stats.friendEdges(), stats.subscriptionEdges(),
                stats.privateSkipped(), stats.fetchFailures(), stats.storeFailures());
        return stats;
    }

    private User fetchRoot(String rootIdentifier) throws FatalApiException {
        ApiResult result = vk.usersGet(rootIdentifier);
        if (result.isPrivateProfile()) return null;
        try {
            return firstProfile(result);
        } catch (UnexpectedShapeException e) {
            throw new FatalApiException("users.get", "cannot resolve root user " + rootIdentifier + ": " + e.getMessage(), e);
        }
    }

    private User fetchProfile(long userId, CrawlState state) {
        try {
            ApiResult result = vk.usersGet(String.valueOf(userId));
            if (result.isPrivateProfile()) {
                state.privateSkipped++;
                return null;
            }
            return firstProfile(result);
        } catch (FatalApiException | UnexpectedShapeException e) {
            log.error("Failed to fetch profile of user {}: {}", userId, e.getMessage());
            state.fetchFailures++;
            return null;
        }
    }

    private static User firstProfile(ApiResult result) throws UnexpectedShapeException {
        JsonNode arr = result.array("users.get");
        if (arr.isEmpty()) {
            throw new UnexpectedShapeException("users.get returned no profile");
        }
        return ProfileNormalizer.normalize(arr.get(0));
    }

    /** Writes the user, its friends and subscriptions; returns the non-private friend ids in API order. */
    private List<Long> expand(User user, CrawlLimits limits, CrawlState state) {
        state.usersExpanded++;
        // edges MATCH on the user node, so it must exist before them
        state.record(store.upsertUser(user));

        var friendIds = new ArrayList<Long>();
        int friendsCount = 0;
        try {
            ApiResult result = vk.friendsGet(user.id(), limits.friendsLimit());
            if (!result.isPrivateProfile()) {
                JsonNode items = result.object("friends.get").path("items");
                friendsCount = items.size();
                for (JsonNode item : items) {
                    User friend = ProfileNormalizer.normalize(item);
                    if (friend.privateProfile()) {
                        state.privateSkipped++;
                        continue;
                    }
                    state.record(store.upsertUser(friend));
                    if (state.record(store.upsertFriendEdge(user.id(), friend.id()))) state.friendEdges++;
                    friendIds.add(friend.id());
                }
                log.debug("User {}: {} friends, {} kept", user.id(), friendsCount, friendIds.size());
            }
        } catch (UnexpectedShapeException e) {
            log.warn("{} (user {})", e.getMessage(), user.id());
            friendsCount = 0;
        } catch (FatalApiException e) {
            log.error("Failed to fetch friends of user {}: {}", user.id(), e.getMessage());
            state.fetchFailures++;
            friendsCount = 0;
        }

        int subscriptionsCount = 0;
        try {
            subscriptionsCount = subscriptions.collect(user.id(), limits.subscriptionsLimit(), groups -> {
                for (Group group : groups) {
                    state.record(store.upsertGroup(group));
                    if (state.record(store.upsertSubscriptionEdge(user.id(), group.id()))) state.subscriptionEdges++;
                }
            });
        } catch (FatalApiException e) {
            log.error("Failed to fetch subscriptions of user {}: {}", user.id(), e.getMessage());
            state.fetchFailures++;
        }

        state.record(store.upsertUser(user.withCounts(friendsCount, subscriptionsCount)));
        return friendIds;
    }
}
