package com.autobudget.repository.redis;

import com.autobudget.domain.model.RunMetadata;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RunMetadataRedisRepository {

    private final StringRedisTemplate stringRedisTemplate;

    public void save(RunMetadata runMetadata) {
        stringRedisTemplate
                .opsForHash()
                .putAll(
                        RedisKeys.KEY_METADATA,
                        Map.of(
                                "last_update", runMetadata.getLastUpdate().toString(),
                                "update_timestamp", String.valueOf(runMetadata.getUpdateTimestamp()),
                                "total_campaigns", String.valueOf(runMetadata.getTotalCampaigns()),
                                "cycle_count", String.valueOf(runMetadata.getCycleCount())));
    }
}
