package com.autobudget.remote;

import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.model.RemoteCampaign;
import com.autobudget.exception.RemoteApiException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Operations of the remote ads platform.
 *
 * <p>Every call is a single attempt bounded by the configured timeout. Transport failures,
 * non-JSON bodies and calls to an unsupported operation raise {@link RemoteApiException};
 * callers log and skip. The whole API may be absent, in which case no bean of this type
 * exists and the service runs in store-only mode.
 */
public interface RemoteAdsApi {

    /** Whether the endpoint for {@code operation} is configured. */
    boolean supports(RemoteOperation operation);

    /** Display name of the authenticated account, empty when the credential is rejected. */
    Optional<String> verifyAuth(String credential);

    Optional<BigDecimal> getBalance(String credential);

    List<RemoteCampaign> getCampaigns(String credential);

    /** True when the platform accepted the new budget. */
    boolean setBudget(String credential, String campaignId, BigDecimal amount);

    boolean pause(String credential, String campaignId);

    boolean resume(String credential, String campaignId);
}
