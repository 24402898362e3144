package io.github.samzhu.keeper.provider;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.keeper.config.KeeperProperties.ProviderConfig;
import io.github.samzhu.keeper.exception.ProviderException;

/**
 * 本地模擬供應商，供開發環境與測試使用。
 *
 * <p>實例只存在記憶體中；可透過 {@link #setAvailable(boolean)} 模擬供應商故障。
 */
public class LocalGpuProvider implements GpuProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalGpuProvider.class);

    private final String name;
    private final String region;
    private final int priority;
    private final Map<String, ProvisionRequest> instances = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    public LocalGpuProvider(String name, ProviderConfig config) {
        this(name, config.region(), config.priority());
    }

    public LocalGpuProvider(String name, String region, int priority) {
        this.name = name;
        this.region = region;
        this.priority = priority;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String region() {
        return region;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public ProvisionedInstance provision(ProvisionRequest request) {
        ensureAvailable("provision");
        String instanceId = name + "-" + UUID.randomUUID();
        instances.put(instanceId, request);
        log.info("Local instance started: provider={}, instanceId={}, gpu={}x{}",
            name, instanceId, request.gpuCount(), request.gpuType());
        return new ProvisionedInstance(name, instanceId, "http://localhost/" + instanceId);
    }

    @Override
    public void terminate(String instanceId) {
        ensureAvailable("terminate");
        if (instances.remove(instanceId) != null) {
            log.info("Local instance stopped: provider={}, instanceId={}", name, instanceId);
        }
    }

    @Override
    public void healthCheck() {
        ensureAvailable("healthCheck");
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int runningInstances() {
        return instances.size();
    }

    private void ensureAvailable(String operation) {
        if (!available) {
            throw new ProviderException(name, operation, "provider unavailable");
        }
    }
}
