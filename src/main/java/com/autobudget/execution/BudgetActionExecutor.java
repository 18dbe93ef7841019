package com.autobudget.execution;

import com.autobudget.budget.BudgetCalculator;
import com.autobudget.budget.BudgetValidationResult;
import com.autobudget.domain.enums.ActionKind;
import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.enums.RemoteOutcome;
import com.autobudget.domain.model.ActionLogEntry;
import com.autobudget.domain.model.BudgetAction;
import com.autobudget.observability.AutoBudgetMetrics;
import com.autobudget.remote.RemoteAdsApi;
import com.autobudget.repository.redis.ActionLogRedisRepository;
import com.autobudget.repository.redis.CampaignFields;
import com.autobudget.repository.redis.CampaignMapper;
import com.autobudget.repository.redis.CampaignRedisRepository;
import java.time.Clock;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies budget actions with store-first, remote-eventual semantics.
 *
 * <p>Order of effects for one action:
 * <ol>
 *   <li>Budget actions are re-validated; an invalid budget is rejected with no effect at all.</li>
 *   <li>The campaign hash is updated. This write is authoritative; if it fails the action is
 *       not applied and nothing else happens.</li>
 *   <li>If the remote API supports the operation and a credential is available, the change is
 *       mirrored once. A failed mirror is logged and never rolled back or retried.</li>
 *   <li>An entry is appended to the action log, whatever the remote outcome.</li>
 * </ol>
 */
@Service
public class BudgetActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(BudgetActionExecutor.class);

    private final CampaignRedisRepository campaignRedisRepository;
    private final ActionLogRedisRepository actionLogRedisRepository;
    private final Optional<RemoteAdsApi> remoteAdsApi;
    private final AutoBudgetMetrics autoBudgetMetrics;
    private final Clock clock;

    public BudgetActionExecutor(
            CampaignRedisRepository campaignRedisRepository,
            ActionLogRedisRepository actionLogRedisRepository,
            Optional<RemoteAdsApi> remoteAdsApi,
            AutoBudgetMetrics autoBudgetMetrics,
            Clock clock) {
        this.campaignRedisRepository = campaignRedisRepository;
        this.actionLogRedisRepository = actionLogRedisRepository;
        this.remoteAdsApi = remoteAdsApi;
        this.autoBudgetMetrics = autoBudgetMetrics;
        this.clock = clock;
    }

    public ExecutionResult execute(BudgetAction action, Optional<String> credential) {
        ActionKind kind = action.getKind();
        log.info("[AUTO] {}: {} - {}", action.getChannel(), kind.getStoreValue(), action.getReason());

        if (kind.changesBudget()) {
            BudgetValidationResult validation = BudgetCalculator.validate(action.getNewBudget());
            if (!validation.isValid()) {
                log.warn("Rejected {} for {}: {}", kind.getStoreValue(), action.getChannel(), validation);
                autoBudgetMetrics.recordAction(kind, AutoBudgetMetrics.RESULT_REJECTED);
                return ExecutionResult.rejected(validation.getReason());
            }
        }

        long now = clock.millis();
        try {
            campaignRedisRepository.update(action.getCampaignId(), storeUpdates(action, now));
        } catch (RuntimeException e) {
            log.error("Store update failed for {} ({}), action not applied: {}",
                    action.getChannel(), action.getCampaignId(), e.getMessage());
            autoBudgetMetrics.recordAction(kind, AutoBudgetMetrics.RESULT_STORE_FAILED);
            return ExecutionResult.rejected("Store update failed: " + e.getMessage());
        }
        autoBudgetMetrics.recordAction(kind, AutoBudgetMetrics.RESULT_APPLIED);

        RemoteOutcome remoteOutcome = mirror(action, credential);

        try {
            actionLogRedisRepository.append(new ActionLogEntry(
                    LocalTime.now(clock).format(CampaignMapper.HH_MM),
                    kind.getStoreValue(),
                    action.getChannel(),
                    action.getReason(),
                    now));
        } catch (RuntimeException e) {
            log.warn("Action log append failed for {}: {}", action.getChannel(), e.getMessage());
        }
        return ExecutionResult.applied(remoteOutcome);
    }

    static Map<String, String> storeUpdates(BudgetAction action, long now) {
        Map<String, String> updates = new HashMap<>();
        updates.put(CampaignFields.LAST_AUTO_ACTION, String.valueOf(now));
        if (action.getScheduleKey() != null) {
            updates.put(CampaignFields.LAST_SCHEDULE_ACTION, action.getScheduleKey());
        }
        switch (action.getKind()) {
            case SET_BUDGET, INCREASE_BUDGET -> {
                updates.put(CampaignFields.DAILY_BUDGET, action.getNewBudget().toPlainString());
                updates.put(CampaignFields.STATUS, CampaignStatus.ACTIVE.getStoreValue());
            }
            case PAUSE -> updates.put(CampaignFields.STATUS, CampaignStatus.PAUSED.getStoreValue());
            case RESUME -> updates.put(CampaignFields.STATUS, CampaignStatus.ACTIVE.getStoreValue());
        }
        return updates;
    }

    private RemoteOutcome mirror(BudgetAction action, Optional<String> credential) {
        RemoteOperation operation = remoteOperation(action.getKind());
        if (remoteAdsApi.isEmpty() || !remoteAdsApi.get().supports(operation) || credential.isEmpty()) {
            return RemoteOutcome.NOT_ATTEMPTED;
        }
        RemoteAdsApi api = remoteAdsApi.get();
        String cookie = credential.get();

        RemoteOutcome outcome;
        try {
            boolean ok = switch (operation) {
                case SET_BUDGET -> api.setBudget(cookie, action.getCampaignId(), action.getNewBudget());
                case PAUSE -> api.pause(cookie, action.getCampaignId());
                case RESUME -> api.resume(cookie, action.getCampaignId());
                default -> throw new IllegalStateException("Not a write operation: " + operation);
            };
            outcome = ok ? RemoteOutcome.SUCCEEDED : RemoteOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Remote {} failed for {}: {}", operation, action.getChannel(), e.getMessage());
            outcome = RemoteOutcome.FAILED;
        }
        if (outcome == RemoteOutcome.FAILED) {
            log.warn("Remote {} not applied for {}, store already updated", operation, action.getChannel());
        }
        autoBudgetMetrics.recordRemoteWrite(operation, outcome);
        return outcome;
    }

    static RemoteOperation remoteOperation(ActionKind kind) {
        return switch (kind) {
            case SET_BUDGET, INCREASE_BUDGET -> RemoteOperation.SET_BUDGET;
            case PAUSE -> RemoteOperation.PAUSE;
            case RESUME -> RemoteOperation.RESUME;
        };
    }
}
