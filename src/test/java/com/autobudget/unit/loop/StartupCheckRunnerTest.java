package com.autobudget.unit.loop;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.autobudget.directory.ChannelDirectory;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.model.Campaign;
import com.autobudget.exception.RemoteApiException;
import com.autobudget.loop.StartupCheckRunner;
import com.autobudget.remote.RemoteAdsApi;
import com.autobudget.repository.redis.CampaignRedisRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StartupCheckRunnerTest {

    @Mock
    private RemoteAdsApi remoteAdsApi;

    @Mock
    private ChannelDirectory channelDirectory;

    @Mock
    private CampaignRedisRepository campaignRedisRepository;

    @Test
    @DisplayName("Store-only mode loads the directory and never touches the store")
    void storeOnly() {
        StartupCheckRunner runner = new StartupCheckRunner(Optional.empty(), channelDirectory, campaignRedisRepository);

        runner.onApplicationEvent(null);

        verify(channelDirectory).refreshIfStale();
        verifyNoInteractions(campaignRedisRepository);
    }

    @Test
    @DisplayName("Verifies the first available credential when the endpoint is configured")
    void verifiesFirstCredential() {
        StartupCheckRunner runner =
                new StartupCheckRunner(Optional.of(remoteAdsApi), channelDirectory, campaignRedisRepository);
        when(remoteAdsApi.supports(RemoteOperation.VERIFY_AUTH)).thenReturn(true);
        when(campaignRedisRepository.findAll())
                .thenReturn(List.of(Campaign.builder().campaignId("c1").channel("ShopA").build()));
        when(channelDirectory.firstCredentialFor(List.of("ShopA"))).thenReturn(Optional.of("cookie"));
        when(remoteAdsApi.verifyAuth("cookie")).thenReturn(Optional.of("shopa_owner"));

        runner.onApplicationEvent(null);

        verify(remoteAdsApi).verifyAuth("cookie");
    }

    @Test
    @DisplayName("Skips verification when the endpoint is not configured")
    void verifyNotSupported() {
        StartupCheckRunner runner =
                new StartupCheckRunner(Optional.of(remoteAdsApi), channelDirectory, campaignRedisRepository);

        runner.onApplicationEvent(null);

        verify(remoteAdsApi, never()).verifyAuth(anyString());
    }

    @Test
    @DisplayName("Authentication failure is logged, not thrown")
    void verifyFailureTolerated() {
        StartupCheckRunner runner =
                new StartupCheckRunner(Optional.of(remoteAdsApi), channelDirectory, campaignRedisRepository);
        when(remoteAdsApi.supports(RemoteOperation.VERIFY_AUTH)).thenReturn(true);
        when(campaignRedisRepository.findAll())
                .thenReturn(List.of(Campaign.builder().campaignId("c1").channel("ShopA").build()));
        when(channelDirectory.firstCredentialFor(List.of("ShopA"))).thenReturn(Optional.of("cookie"));
        when(remoteAdsApi.verifyAuth("cookie")).thenThrow(new RemoteApiException("VERIFY_AUTH request failed"));

        assertThatCode(() -> runner.onApplicationEvent(null)).doesNotThrowAnyException();
    }
}
