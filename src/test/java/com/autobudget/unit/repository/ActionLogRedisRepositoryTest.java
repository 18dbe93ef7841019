package com.autobudget.unit.repository;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.domain.model.ActionLogEntry;
import com.autobudget.repository.redis.ActionLogRedisRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class ActionLogRedisRepositoryTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private ActionLogRedisRepository repository;

    private final ActionLogEntry entry = new ActionLogEntry("11:30", "pause", "ShopA", "ROAS low", 1L);

    @BeforeEach
    void setUp() {
        AutoBudgetConfig config = new AutoBudgetConfig();
        config.setActionLogMaxEntries(3);
        when(stringRedisTemplate.opsForList()).thenReturn(listOperations);
        repository = new ActionLogRedisRepository(stringRedisTemplate, new ObjectMapper(), config);
    }

    @Test
    @DisplayName("Appends at the tail without trimming under the cap")
    void underCap() {
        when(listOperations.rightPush(eq("autobudget:action-log"), anyString())).thenReturn(3L);

        repository.append(entry);

        verify(listOperations, never()).trim(anyString(), anyLong(), anyLong());
    }

    @Test
    @DisplayName("Trims the oldest entries over the cap")
    void overCap() {
        when(listOperations.rightPush(eq("autobudget:action-log"), anyString())).thenReturn(4L);

        repository.append(entry);

        verify(listOperations).trim("autobudget:action-log", -3, -1);
    }
}
