package io.github.samzhu.keeper.provider;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.github.samzhu.keeper.config.KeeperProperties.ProviderConfig;
import io.github.samzhu.keeper.exception.ProviderException;

/**
 * 通用 GPU 市集 REST 介接。
 *
 * <p>端點：
 * <ul>
 *   <li>{@code POST /instances} - 開機，回傳 {@code {id, accessUrl}}</li>
 *   <li>{@code DELETE /instances/{id}} - 停機</li>
 *   <li>{@code GET /health} - 健康檢查</li>
 * </ul>
 *
 * <p>所有呼叫使用 Bearer token 與設定的連線/讀取逾時。
 */
public class HttpGpuProvider implements GpuProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpGpuProvider.class);

    private final String name;
    private final ProviderConfig config;
    private final RestClient restClient;
    private final RestClient healthClient;
    private final Duration healthCheckTimeout;

    /**
     * @param probeTimeout 健康探測的逾時上限，探測用的連線與讀取逾時不會超過此值
     */
    public HttpGpuProvider(String name, ProviderConfig config, Duration probeTimeout, RestClient.Builder builder) {
        this.name = name;
        this.config = config;
        this.healthCheckTimeout = probeTimeout.compareTo(config.timeout()) < 0 ? probeTimeout : config.timeout();
        this.restClient = buildClient(builder, config, config.timeout());
        this.healthClient = buildClient(builder, config, healthCheckTimeout);
    }

    private static RestClient buildClient(RestClient.Builder builder, ProviderConfig config, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        RestClient.Builder configured = builder.clone()
            .baseUrl(config.endpoint())
            .requestFactory(requestFactory);
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            configured.defaultHeader("Authorization", "Bearer " + config.apiKey());
        }
        return configured.build();
    }

    Duration healthCheckTimeout() {
        return healthCheckTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String region() {
        return config.region();
    }

    @Override
    public int priority() {
        return config.priority();
    }

    @Override
    public ProvisionedInstance provision(ProvisionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("label", "keeper-" + request.sessionId());
        body.put("gpuType", request.gpuType());
        body.put("gpuCount", request.gpuCount());
        if (request.modelId() != null) {
            body.put("modelId", request.modelId());
        }

        try {
            InstanceResponse response = restClient.post()
                .uri("/instances")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(InstanceResponse.class);

            if (response == null || response.id() == null) {
                throw new ProviderException(name, "provision", "empty instance response");
            }
            log.debug("Provider instance created: provider={}, instanceId={}", name, response.id());
            return new ProvisionedInstance(name, response.id(), response.accessUrl());
        } catch (RestClientException e) {
            throw new ProviderException(name, "provision", e);
        }
    }

    @Override
    public void terminate(String instanceId) {
        try {
            restClient.delete()
                .uri("/instances/{id}", instanceId)
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientException e) {
            throw new ProviderException(name, "terminate", e);
        }
    }

    @Override
    public void healthCheck() {
        try {
            healthClient.get()
                .uri("/health")
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientException e) {
            throw new ProviderException(name, "healthCheck", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InstanceResponse(String id, String accessUrl) {
    }
}
