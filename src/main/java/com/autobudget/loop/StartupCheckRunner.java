package com.autobudget.loop;

import com.autobudget.directory.ChannelDirectory;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.model.Campaign;
import com.autobudget.remote.RemoteAdsApi;
import com.autobudget.repository.redis.CampaignRedisRepository;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Logs the operating mode once the application is ready, loads the channel directory and
 * verifies the first available credential. Nothing here is fatal: the control loop starts
 * regardless and degrades to store-only mode.
 */
@Component
public class StartupCheckRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupCheckRunner.class);

    private final Optional<RemoteAdsApi> remoteAdsApi;
    private final ChannelDirectory channelDirectory;
    private final CampaignRedisRepository campaignRedisRepository;

    public StartupCheckRunner(
            Optional<RemoteAdsApi> remoteAdsApi,
            ChannelDirectory channelDirectory,
            CampaignRedisRepository campaignRedisRepository) {
        this.remoteAdsApi = remoteAdsApi;
        this.channelDirectory = channelDirectory;
        this.campaignRedisRepository = campaignRedisRepository;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        channelDirectory.refreshIfStale();
        if (channelDirectory.size() == 0) {
            log.warn("No channel credentials loaded, remote calls will be skipped");
        }

        if (remoteAdsApi.isEmpty()) {
            log.warn("==================================================");
            log.warn("REMOTE ADS API NOT CONFIGURED (autobudget.remote.base-url)");
            log.warn("Running in store-only mode: no remote reads or writes");
            log.warn("==================================================");
            return;
        }

        RemoteAdsApi api = remoteAdsApi.get();
        List<RemoteOperation> supported = Arrays.stream(RemoteOperation.values())
                .filter(api::supports)
                .collect(Collectors.toList());
        log.info("Remote ads API operations enabled: {}", supported);
        if (!api.supports(RemoteOperation.CAMPAIGN_LIST)) {
            log.warn("Campaign list endpoint not configured, remote sync disabled");
        }
        if (api.supports(RemoteOperation.VERIFY_AUTH)) {
            verifyFirstCredential(api);
        }
    }

    private void verifyFirstCredential(RemoteAdsApi api) {
        try {
            List<String> channels = campaignRedisRepository.findAll().stream()
                    .map(Campaign::getChannel)
                    .filter(channel -> channel != null && !channel.isBlank())
                    .collect(Collectors.toList());
            Optional<String> credential = channelDirectory.firstCredentialFor(channels);
            if (credential.isEmpty()) {
                log.warn("No credential available to verify remote authentication");
                return;
            }
            api.verifyAuth(credential.get())
                    .ifPresentOrElse(
                            name -> log.info("Remote authentication OK as {}", name),
                            () -> log.warn("Remote authentication rejected the first available credential"));
        } catch (RuntimeException e) {
            log.warn("Remote authentication check failed: {}", e.getMessage());
        }
    }
}
