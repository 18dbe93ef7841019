package com.autobudget.repository.redis;

import com.autobudget.domain.model.Campaign;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for managed campaigns.
 *
 * <p>Each campaign is a hash of string fields so that operators and this service can update
 * individual fields without read-modify-write of a whole document. Writes are partial
 * ({@code HSET} of the given fields only) and there are no transactions: a single control
 * loop instance is assumed to own writes to each campaign.
 */
@Repository
public class CampaignRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(CampaignRedisRepository.class);

    private static final long SCAN_BATCH = 200;

    private final StringRedisTemplate stringRedisTemplate;

    public CampaignRedisRepository(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Returns every campaign hash under {@code autobudget:campaign:*}, ordered by id and
     * normalized on read. Keys are discovered with SCAN, so a hash written directly by an
     * operator is picked up on the next cycle.
     */
    public List<Campaign> findAll() {
        Set<String> ids = new TreeSet<>();
        ScanOptions options = ScanOptions.scanOptions()
                .match(RedisKeys.KEY_PREFIX_CAMPAIGN + "*")
                .count(SCAN_BATCH)
                .build();
        try (Cursor<String> keys = stringRedisTemplate.scan(options)) {
            while (keys.hasNext()) {
                String id = keys.next().substring(RedisKeys.KEY_PREFIX_CAMPAIGN.length());
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        }

        List<Campaign> campaigns = new ArrayList<>(ids.size());
        for (String id : ids) {
            Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(RedisKeys.campaign(id));
            if (entries.isEmpty()) {
                log.debug("Campaign {} has no fields, skipping", id);
                continue;
            }
            campaigns.add(CampaignMapper.fromHash(id, toStringMap(entries)));
        }
        return campaigns;
    }

    /** Partial update: only the given fields are written, all others are left untouched. */
    public void update(String campaignId, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        stringRedisTemplate.opsForHash().putAll(RedisKeys.campaign(campaignId), fields);
    }

    private static Map<String, String> toStringMap(Map<Object, Object> entries) {
        Map<String, String> hash = new LinkedHashMap<>(entries.size());
        entries.forEach((key, value) -> hash.put(String.valueOf(key), value == null ? null : String.valueOf(value)));
        return hash;
    }
}
