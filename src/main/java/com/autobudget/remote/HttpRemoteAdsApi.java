package com.autobudget.remote;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.domain.enums.RemoteOperation;
import com.autobudget.domain.model.RemoteCampaign;
import com.autobudget.exception.RemoteApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link RemoteAdsApi} over HTTP with {@link RestTemplate}.
 *
 * <p>The credential is a browser cookie string ({@code k1=v1; k2=v2}). It is sent as the
 * {@code Cookie} header and its {@code csrftoken} value is echoed in {@code x-csrftoken}.
 * Read calls require a {@code data} member; write calls succeed on {@code code == 0} or
 * {@code success == true}.
 */
public class HttpRemoteAdsApi implements RemoteAdsApi {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteAdsApi.class);

    static final String CSRF_COOKIE = "csrftoken";
    static final String CSRF_HEADER = "x-csrftoken";
    static final int PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final AutoBudgetConfig.Remote remote;
    private final ObjectMapper objectMapper;

    public HttpRemoteAdsApi(RestTemplate restTemplate, AutoBudgetConfig.Remote remote, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.remote = remote;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(RemoteOperation operation) {
        String path = path(operation);
        return remote.isConfigured() && path != null && !path.isBlank();
    }

    @Override
    public Optional<String> verifyAuth(String credential) {
        JsonNode data = call(RemoteOperation.VERIFY_AUTH, HttpMethod.GET, credential, null, Map.of()).path("data");
        if (!data.isObject() || data.isEmpty()) {
            return Optional.empty();
        }
        String name = data.hasNonNull("userName") ? data.get("userName").asText() : data.path("name").asText("unknown");
        return Optional.of(name);
    }

    @Override
    public Optional<BigDecimal> getBalance(String credential) {
        JsonNode data = call(RemoteOperation.BALANCE, HttpMethod.GET, credential, null, Map.of()).path("data");
        if (data.isObject()) {
            data = data.path("balance");
        }
        return decimal(data);
    }

    @Override
    public List<RemoteCampaign> getCampaigns(String credential) {
        JsonNode data = call(
                        RemoteOperation.CAMPAIGN_LIST,
                        HttpMethod.GET,
                        credential,
                        null,
                        Map.of("page", "1", "pageSize", String.valueOf(PAGE_SIZE)))
                .path("data");
        JsonNode list = data.has("list") ? data.get("list") : data;
        if (!list.isArray()) {
            throw new RemoteApiException(RemoteOperation.CAMPAIGN_LIST + " response has no campaign list");
        }

        List<RemoteCampaign> campaigns = new ArrayList<>(list.size());
        for (JsonNode row : list) {
            campaigns.add(RemoteCampaign.builder()
                    .channelName(first(row, "channelName", "username").asText(""))
                    .cost(decimal(first(row, "cost", "spend")).orElse(BigDecimal.ZERO))
                    .roas(row.path("roas").asDouble(0))
                    .balance(decimal(first(row, "balance", "credit")).orElse(BigDecimal.ZERO))
                    .visits(first(row, "visits", "impressions").asLong(0))
                    .conversionRate(row.path("conversionRate").asDouble(0))
                    .build());
        }
        return campaigns;
    }

    @Override
    public boolean setBudget(String credential, String campaignId, BigDecimal amount) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("campaignId", campaignId);
        payload.put("dailyBudget", amount);
        return accepted(call(RemoteOperation.SET_BUDGET, HttpMethod.POST, credential, payload, Map.of()));
    }

    @Override
    public boolean pause(String credential, String campaignId) {
        return accepted(
                call(RemoteOperation.PAUSE, HttpMethod.POST, credential, Map.of("campaignId", campaignId), Map.of()));
    }

    @Override
    public boolean resume(String credential, String campaignId) {
        return accepted(
                call(RemoteOperation.RESUME, HttpMethod.POST, credential, Map.of("campaignId", campaignId), Map.of()));
    }

    private JsonNode call(
            RemoteOperation operation,
            HttpMethod method,
            String credential,
            Map<String, Object> payload,
            Map<String, String> query) {
        if (!supports(operation)) {
            throw new RemoteApiException("Remote operation " + operation + " is not configured");
        }
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(remote.getBaseUrl()).path(path(operation));
        query.forEach(uri::queryParam);
        URI target = uri.build().toUri();

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(target, method, new HttpEntity<>(payload, headers(credential)), String.class);
        } catch (RestClientException e) {
            throw new RemoteApiException(operation + " request failed: " + e.getMessage(), e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new RemoteApiException(
                    operation + " returned an empty body",
                    Map.of("operation", operation.name(), "status", response.getStatusCode().value()));
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException(operation + " returned a non-JSON body", e);
        }
    }

    private boolean accepted(JsonNode response) {
        boolean ok = response.path("code").isNumber() && response.path("code").asInt() == 0
                || response.path("success").asBoolean(false);
        if (!ok) {
            log.warn("Remote write rejected: {}", response);
        }
        return ok;
    }

    static HttpHeaders headers(String credential) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (credential != null && !credential.isBlank()) {
            headers.set(HttpHeaders.COOKIE, credential);
            headers.set(CSRF_HEADER, parseCookies(credential).getOrDefault(CSRF_COOKIE, ""));
        }
        return headers;
    }

    static Map<String, String> parseCookies(String credential) {
        Map<String, String> cookies = new HashMap<>();
        for (String pair : credential.split(";")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                cookies.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return cookies;
    }

    private String path(RemoteOperation operation) {
        return switch (operation) {
            case VERIFY_AUTH -> remote.getVerifyAuthPath();
            case BALANCE -> remote.getBalancePath();
            case CAMPAIGN_LIST -> remote.getCampaignListPath();
            case SET_BUDGET -> remote.getSetBudgetPath();
            case PAUSE -> remote.getPausePath();
            case RESUME -> remote.getResumePath();
        };
    }

    private static JsonNode first(JsonNode row, String name, String alias) {
        return row.hasNonNull(name) ? row.get(name) : row.path(alias);
    }

    private static Optional<BigDecimal> decimal(JsonNode node) {
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isTextual()) {
            try {
                return Optional.of(new BigDecimal(node.asText().trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric amount '{}'", node.asText());
            }
        }
        return Optional.empty();
    }
}
