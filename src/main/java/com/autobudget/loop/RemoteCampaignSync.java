package com.autobudget.loop;

import com.autobudget.directory.ChannelDirectory;
import com.autobudget.domain.enums.CampaignStatus;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.model.Campaign;
import com.autobudget.domain.model.RemoteCampaign;
import com.autobudget.engine.ChannelIndex;
import com.autobudget.exception.RemoteApiException;
import com.autobudget.remote.RemoteAdsApi;
import com.autobudget.repository.redis.CampaignFields;
import com.autobudget.repository.redis.CampaignRedisRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pulls the remote campaign list and merges it into the managed campaigns.
 *
 * <p>Rows are matched to campaigns by channel name, ignoring case. A matched campaign gets
 * its spend, ROAS, credit, visits and conversion rate from the remote row, and is flipped to
 * {@code budget_full} once spend reaches 99% of its daily budget. Updates go to the store and
 * to the in-memory campaign so the rest of the cycle sees them.
 */
@Component
public class RemoteCampaignSync {

    private static final Logger log = LoggerFactory.getLogger(RemoteCampaignSync.class);

    static final BigDecimal FULL_RATIO = new BigDecimal("0.99");

    private final Optional<RemoteAdsApi> remoteAdsApi;
    private final ChannelDirectory channelDirectory;
    private final CampaignRedisRepository campaignRedisRepository;
    private final Clock clock;

    public RemoteCampaignSync(
            Optional<RemoteAdsApi> remoteAdsApi,
            ChannelDirectory channelDirectory,
            CampaignRedisRepository campaignRedisRepository,
            Clock clock) {
        this.remoteAdsApi = remoteAdsApi;
        this.channelDirectory = channelDirectory;
        this.campaignRedisRepository = campaignRedisRepository;
        this.clock = clock;
    }

    /**
     * @return number of campaigns updated from the remote list
     * @throws RemoteApiException when the campaign list cannot be fetched
     */
    public int sync(List<Campaign> campaigns) {
        if (remoteAdsApi.isEmpty() || !remoteAdsApi.get().supports(RemoteOperation.CAMPAIGN_LIST)) {
            return 0;
        }
        RemoteAdsApi api = remoteAdsApi.get();

        List<String> channels = campaigns.stream()
                .map(Campaign::getChannel)
                .filter(channel -> channel != null && !channel.isBlank())
                .collect(Collectors.toList());
        Optional<String> credential = channelDirectory.firstCredentialFor(channels);
        if (credential.isEmpty()) {
            log.warn("No credential found for any campaign channel, skipping remote sync");
            return 0;
        }

        if (api.supports(RemoteOperation.BALANCE)) {
            try {
                api.getBalance(credential.get()).ifPresent(balance -> log.info("Ads balance: {}", balance));
            } catch (RemoteApiException e) {
                log.warn("Ads balance unavailable: {}", e.getMessage());
            }
        }

        List<RemoteCampaign> remoteCampaigns = api.getCampaigns(credential.get());
        log.info("Remote API returned {} campaigns", remoteCampaigns.size());

        ChannelIndex<Campaign> byChannel = ChannelIndex.of(campaigns, Campaign::getChannel);
        int merged = 0;
        for (RemoteCampaign remote : remoteCampaigns) {
            Optional<Campaign> match = byChannel.lookup(remote.getChannelName());
            if (match.isEmpty()) {
                continue;
            }
            Campaign campaign = match.get();
            try {
                campaignRedisRepository.update(campaign.getCampaignId(), merge(campaign, remote));
                merged++;
            } catch (RuntimeException e) {
                log.warn("Remote merge failed for campaign {}: {}", campaign.getCampaignId(), e.getMessage());
            }
        }
        return merged;
    }

    /** Applies the remote row to the in-memory campaign and returns the matching store fields. */
    Map<String, String> merge(Campaign campaign, RemoteCampaign remote) {
        BigDecimal spent = remote.getCost() != null ? remote.getCost() : BigDecimal.ZERO;
        BigDecimal credit = remote.getBalance() != null ? remote.getBalance() : BigDecimal.ZERO;

        campaign.setSpentToday(spent);
        campaign.setRoas(remote.getRoas());
        campaign.setAdCredit(credit);
        campaign.setVisits(remote.getVisits());
        campaign.setConversionRate(remote.getConversionRate());

        Map<String, String> updates = new HashMap<>();
        updates.put(CampaignFields.SPENT_TODAY, spent.toPlainString());
        updates.put(CampaignFields.ROAS, String.valueOf(remote.getRoas()));
        updates.put(CampaignFields.AD_CREDIT, credit.toPlainString());
        updates.put(CampaignFields.VISITS, String.valueOf(remote.getVisits()));
        updates.put(CampaignFields.CONVERSION_RATE, String.valueOf(remote.getConversionRate()));
        updates.put(CampaignFields.LAST_UPDATE, LocalDateTime.now(clock).toString());

        if (spent.compareTo(campaign.getDailyBudget().multiply(FULL_RATIO)) >= 0) {
            campaign.setStatus(CampaignStatus.BUDGET_FULL);
            updates.put(CampaignFields.STATUS, CampaignStatus.BUDGET_FULL.getStoreValue());
        }
        return updates;
    }
}
