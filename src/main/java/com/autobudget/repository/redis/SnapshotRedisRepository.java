package com.autobudget.repository.redis;

import com.autobudget.domain.model.Snapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Per-campaign snapshot time series backed by a Redis sorted set.
 *
 * <p>The score is the snapshot's epoch-millisecond timestamp and the member is the
 * snapshot JSON (which embeds the timestamp, so members never collide). Range queries by
 * score return members ordered by time, and retention is a single
 * {@code ZREMRANGEBYSCORE} per campaign.
 */
@Repository
public class SnapshotRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRedisRepository.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    public SnapshotRedisRepository(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
    }

    public void append(String campaignId, Snapshot snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot serialization failed for campaign " + campaignId, e);
        }
        stringRedisTemplate.opsForZSet().add(RedisKeys.snapshots(campaignId), json, snapshot.timestamp());
    }

    /**
     * Snapshots with {@code fromEpochMs <= timestamp <= toEpochMs}, ascending by timestamp.
     * Members that cannot be parsed are skipped with a warning.
     */
    public List<Snapshot> findBetween(String campaignId, long fromEpochMs, long toEpochMs) {
        Set<String> members =
                stringRedisTemplate.opsForZSet().rangeByScore(RedisKeys.snapshots(campaignId), fromEpochMs, toEpochMs);
        if (members == null || members.isEmpty()) {
            return Collections.emptyList();
        }

        List<Snapshot> snapshots = new ArrayList<>(members.size());
        for (String member : members) {
            try {
                snapshots.add(objectMapper.readValue(member, Snapshot.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable snapshot for campaign {}: {}", campaignId, e.getOriginalMessage());
            }
        }
        return snapshots;
    }

    /**
     * Removes every snapshot with {@code timestamp < cutoffEpochMs}.
     *
     * @return number of snapshots removed
     */
    public long deleteOlderThan(String campaignId, long cutoffEpochMs) {
        Long removed = stringRedisTemplate
                .opsForZSet()
                .removeRangeByScore(RedisKeys.snapshots(campaignId), Double.NEGATIVE_INFINITY, cutoffEpochMs - 1);
        return removed != null ? removed : 0;
    }
}
