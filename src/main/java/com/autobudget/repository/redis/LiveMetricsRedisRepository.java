package com.autobudget.repository.redis;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.domain.model.LiveChannelMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read-only access to the live channel counters published by the channel monitor.
 *
 * <p>The hash is owned by another process: one field per monitored channel, each value a
 * JSON object. Records without a channel name cannot be joined and are dropped.
 */
@Repository
public class LiveMetricsRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(LiveMetricsRedisRepository.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final AutoBudgetConfig autoBudgetConfig;

    public LiveMetricsRedisRepository(
            StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, AutoBudgetConfig autoBudgetConfig) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.autoBudgetConfig = autoBudgetConfig;
    }

    public List<LiveChannelMetrics> findAll() {
        String key = autoBudgetConfig.getStore().getLiveMetricsKey();
        Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(key);
        if (entries.isEmpty()) {
            return Collections.emptyList();
        }

        List<LiveChannelMetrics> metrics = new ArrayList<>(entries.size());
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            try {
                LiveChannelMetrics live =
                        objectMapper.readValue(String.valueOf(entry.getValue()), LiveChannelMetrics.class);
                if (live.getChannel() != null && !live.getChannel().isBlank()) {
                    metrics.add(live);
                }
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable live metrics record {}: {}", entry.getKey(), e.getOriginalMessage());
            }
        }
        return metrics;
    }
}
