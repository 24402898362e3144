package io.github.samzhu.keeper.provider;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.ProviderConfig;

/**
 * 已設定的 GPU 供應商集合。
 *
 * <p>依 {@code keeper.providers.<name>.kind} 建立對應實作：
 * <ul>
 *   <li>{@code http} - {@link HttpGpuProvider}</li>
 *   <li>{@code local} - {@link LocalGpuProvider}</li>
 * </ul>
 * 停用的供應商不會被建立。
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, GpuProvider> providers;

    public ProviderRegistry(List<GpuProvider> providers) {
        Map<String, GpuProvider> byName = new LinkedHashMap<>();
        providers.forEach(p -> byName.put(p.name(), p));
        this.providers = Map.copyOf(byName);
    }

    /**
     * 從組態建立。
     *
     * @param properties Keeper 組態
     * @param restClientBuilder HTTP 供應商使用的 RestClient builder
     * @return ProviderRegistry
     * @throws IllegalStateException 未知的 kind
     */
    public static ProviderRegistry fromProperties(KeeperProperties properties, RestClient.Builder restClientBuilder) {
        List<GpuProvider> created = properties.providers().entrySet().stream()
            .filter(entry -> entry.getValue().enabled())
            .map(entry -> create(entry.getKey(), entry.getValue(), properties.health().probeTimeout(), restClientBuilder))
            .toList();
        log.info("Provider registry initialized: {}", created.stream().map(GpuProvider::name).toList());
        return new ProviderRegistry(created);
    }

    private static GpuProvider create(String name, ProviderConfig config, Duration probeTimeout,
            RestClient.Builder restClientBuilder) {
        return switch (config.kind()) {
            case "http" -> new HttpGpuProvider(name, config, probeTimeout, restClientBuilder);
            case "local" -> new LocalGpuProvider(name, config);
            default -> throw new IllegalStateException(
                "Unknown provider kind '" + config.kind() + "' for provider '" + name + "'");
        };
    }

    public Optional<GpuProvider> get(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public Collection<GpuProvider> all() {
        return providers.values();
    }
}
