package com.autobudget.repository.redis;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.domain.model.ActionLogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Append-only audit log of applied actions, a Redis list written at the tail.
 * The oldest entries are trimmed once the list exceeds the configured maximum.
 */
@Repository
public class ActionLogRedisRepository {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final AutoBudgetConfig autoBudgetConfig;

    public ActionLogRedisRepository(
            StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, AutoBudgetConfig autoBudgetConfig) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.autoBudgetConfig = autoBudgetConfig;
    }

    public void append(ActionLogEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Action log serialization failed", e);
        }
        Long size = stringRedisTemplate.opsForList().rightPush(RedisKeys.KEY_ACTION_LOG, json);
        int maxEntries = autoBudgetConfig.getActionLogMaxEntries();
        if (size != null && size > maxEntries) {
            stringRedisTemplate.opsForList().trim(RedisKeys.KEY_ACTION_LOG, -maxEntries, -1);
        }
    }
}
