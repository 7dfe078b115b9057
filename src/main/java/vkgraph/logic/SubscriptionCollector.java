package vkgraph.logic;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vkgraph.model.Group;
import vkgraph.vk.ApiResult;
import vkgraph.vk.FatalApiException;
import vkgraph.vk.UnexpectedShapeException;
import vkgraph.vk.VkApiClient;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Enumerates a user's open group subscriptions and resolves their details.
 * Resolved groups are handed over one lookup batch at a time, so batches resolved
 * before a failing one are kept. Not resumable: a failed collection is retried by
 * calling {@link #collect} again.
 */
public class SubscriptionCollector {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionCollector.class);

    public static final int PAGE_SIZE = 200;
    public static final int LOOKUP_BATCH = 500;

    private final VkApiClient vk;

    public SubscriptionCollector(VkApiClient vk) { this.vk = vk; }

    /**
     * @param onBatch receives the groups of each lookup batch, in subscription order
     * @return subscription total as reported by the API, before filtering and truncation
     */
    public int collect(long userId, int limit, Consumer<List<Group>> onBatch) throws FatalApiException {
        var page = collectGroupIds(userId, limit);
        resolveGroups(page.groupIds(), onBatch);
        return page.totalCount();
    }

    record IdPage(int totalCount, List<Long> groupIds) {}

    IdPage collectGroupIds(long userId, int limit) throws FatalApiException {
        var ids = new ArrayList<Long>();
        int total = 0;
        int offset = 0;

        while (true) {
            ApiResult result = vk.getSubscriptions(userId, offset, PAGE_SIZE);
            if (result.isPrivateProfile()) {
                log.warn("Subscriptions of {} are not accessible", userId);
                break;
            }
            JsonNode page;
            try {
                page = result.object("users.getSubscriptions");
            } catch (UnexpectedShapeException e) {
                log.warn("{} (user {})", e.getMessage(), userId);
                break;
            }

            JsonNode items = page.path("items");
            total = page.path("count").asInt(0);
            for (JsonNode sub : items) {
                if (sub.path("is_closed").asInt(0) == 0) {
                    ids.add(sub.path("id").asLong());
                }
            }

            if (items.size() < PAGE_SIZE || ids.size() >= limit) break;
            offset += PAGE_SIZE;
        }

        List<Long> truncated = ids.size() > limit ? new ArrayList<>(ids.subList(0, limit)) : ids;
        return new IdPage(total, truncated);
    }

    void resolveGroups(List<Long> groupIds, Consumer<List<Group>> onBatch) throws FatalApiException {
        for (int from = 0; from < groupIds.size(); from += LOOKUP_BATCH) {
            List<Long> chunk = groupIds.subList(from, Math.min(from + LOOKUP_BATCH, groupIds.size()));
            JsonNode info;
            try {
                info = vk.groupsGetById(chunk).array("groups.getById");
            } catch (UnexpectedShapeException e) {
                log.warn("Skipping {} groups starting at {}: {}", chunk.size(), chunk.get(0), e.getMessage());
                continue;
            }
            var groups = new ArrayList<Group>();
            for (JsonNode g : info) {
                groups.add(new Group(
                        g.path("id").asLong(),
                        g.path("name").asText(""),
                        g.path("members_count").asInt(0)
                ));
            }
            onBatch.accept(groups);
        }
    }
}
