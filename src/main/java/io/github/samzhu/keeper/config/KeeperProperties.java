package io.github.samzhu.keeper.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Keeper 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link ReaperConfig} - 殭屍 Session 回收設定</li>
 *   <li>{@link HealthConfig} - 供應商健康探測設定</li>
 *   <li>{@link BreakerConfig} - 各外部依賴的 Circuit Breaker 參數</li>
 *   <li>{@link ProviderConfig} - GPU 供應商連線設定</li>
 *   <li>{@link TierLimits} - 訂閱等級配額表</li>
 *   <li>{@link GpuTierConfig} - GPU 等級與每分鐘價格</li>
 *   <li>{@link TopUpConfig} - 自動儲值預設值</li>
 *   <li>{@link StreamConfig} - SSE 推播設定</li>
 *   <li>{@link PaymentConfig} - 金流服務設定</li>
 *   <li>{@link ExecutorConfig} - 背景任務執行緒池</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * keeper:
 *   reaper:
 *     inactivity-threshold: 30m
 *     scan-cron: "0 0/5 * * * *"
 *   breakers:
 *     vast:
 *       failure-threshold: 3
 *       reset-timeout: 30s
 *       half-open-max-calls: 3
 *   tiers:
 *     free:
 *       max-concurrent-sessions: 1
 *       daily-minutes: 60
 *       monthly-minutes: 300
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "keeper")
public record KeeperProperties(
    ReaperConfig reaper,
    HealthConfig health,
    BreakerConfig defaultBreaker,
    Map<String, BreakerConfig> breakers,
    Map<String, ProviderConfig> providers,
    Map<String, TierLimits> tiers,
    Map<String, GpuTierConfig> gpuTiers,
    TopUpConfig topUp,
    StreamConfig stream,
    PaymentConfig payment,
    ExecutorConfig executor
) {
    public KeeperProperties {
        if (reaper == null) {
            reaper = ReaperConfig.defaults();
        }
        if (health == null) {
            health = HealthConfig.defaults();
        }
        if (defaultBreaker == null) {
            defaultBreaker = BreakerConfig.defaults();
        }
        if (breakers == null) {
            breakers = Map.of();
        }
        if (providers == null) {
            providers = Map.of();
        }
        if (tiers == null || tiers.isEmpty()) {
            tiers = TierLimits.defaultTable();
        } else if (!tiers.containsKey("free")) {
            // free 是未知等級的退路，必須存在
            Map<String, TierLimits> withFree = new LinkedHashMap<>(tiers);
            withFree.put("free", TierLimits.defaultTable().get("free"));
            tiers = withFree;
        }
        if (gpuTiers == null || gpuTiers.isEmpty()) {
            gpuTiers = GpuTierConfig.defaultTable();
        }
        if (topUp == null) {
            topUp = TopUpConfig.defaults();
        }
        if (stream == null) {
            stream = StreamConfig.defaults();
        }
        if (payment == null) {
            payment = PaymentConfig.defaults();
        }
        if (executor == null) {
            executor = ExecutorConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的配置（測試與本地開發用）。
     */
    public static KeeperProperties defaults() {
        return new KeeperProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * 取得指定依賴的 Circuit Breaker 參數，未設定時使用 {@code defaultBreaker}。
     *
     * @param name 依賴名稱，例如 {@code vast}、{@code stripe}
     * @return Circuit Breaker 參數
     */
    public BreakerConfig breakerFor(String name) {
        return breakers.getOrDefault(name, defaultBreaker);
    }

    /**
     * 殭屍 Session 回收設定。
     *
     * <p>掃描排程 {@code keeper.reaper.scan-cron} 由 {@code @Scheduled} 直接讀取。
     *
     * @param inactivityThreshold 無活動多久視為殭屍，預設 30 分鐘
     * @param runOnStartup 啟動完成時是否立即掃描一次
     */
    public record ReaperConfig(
        Duration inactivityThreshold,
        Boolean runOnStartup
    ) {
        public ReaperConfig {
            if (inactivityThreshold == null || inactivityThreshold.isNegative() || inactivityThreshold.isZero()) {
                inactivityThreshold = Duration.ofMinutes(30);
            }
            if (runOnStartup == null) {
                runOnStartup = Boolean.TRUE;
            }
        }

        public static ReaperConfig defaults() {
            return new ReaperConfig(Duration.ofMinutes(30), true);
        }
    }

    /**
     * 供應商健康探測設定。
     *
     * <p>錯誤率 (0-100) 的演進規則：
     * <pre>
     * 成功：errorRate = max(0, errorRate - successDecay)，狀態 HEALTHY
     * 失敗：errorRate = min(100, errorRate + failurePenalty)
     *       errorRate &gt; downThreshold ? DOWN : DEGRADED
     * </pre>
     *
     * <p>探測排程 {@code keeper.health.probe-cron} 由 {@code @Scheduled} 直接讀取。
     *
     * @param probeTimeout 單一探測的逾時上限，預設 5 秒
     * @param successDecay 成功時錯誤率遞減量
     * @param failurePenalty 失敗時錯誤率遞增量
     * @param downThreshold 錯誤率超過此值即標記為 DOWN
     * @param digestCompression 延遲 T-Digest 壓縮因子
     */
    public record HealthConfig(
        Duration probeTimeout,
        double successDecay,
        double failurePenalty,
        double downThreshold,
        int digestCompression
    ) {
        public HealthConfig {
            if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero()) {
                probeTimeout = Duration.ofSeconds(5);
            }
            if (successDecay <= 0) {
                successDecay = 0.5;
            }
            if (failurePenalty <= 0) {
                failurePenalty = 10;
            }
            if (downThreshold <= 0) {
                downThreshold = 50;
            }
            if (digestCompression <= 0) {
                digestCompression = 100;
            }
        }

        public static HealthConfig defaults() {
            return new HealthConfig(Duration.ofSeconds(5), 0.5, 10, 50, 100);
        }
    }

    /**
     * Circuit Breaker 參數。
     *
     * @param failureThreshold 連續失敗幾次後開路
     * @param resetTimeout 開路後多久允許試探
     * @param halfOpenMaxCalls 半開狀態允許的試探呼叫數
     */
    public record BreakerConfig(
        int failureThreshold,
        Duration resetTimeout,
        int halfOpenMaxCalls
    ) {
        public BreakerConfig {
            if (failureThreshold <= 0) {
                failureThreshold = 5;
            }
            if (resetTimeout == null || resetTimeout.isNegative()) {
                resetTimeout = Duration.ofSeconds(30);
            }
            if (halfOpenMaxCalls <= 0) {
                halfOpenMaxCalls = 3;
            }
        }

        public static BreakerConfig defaults() {
            return new BreakerConfig(5, Duration.ofSeconds(30), 3);
        }
    }

    /**
     * GPU 供應商連線設定。
     *
     * @param kind 實作種類：{@code http} (REST 市集) 或 {@code local} (本地模擬)
     * @param endpoint API base URL
     * @param apiKey Bearer token，空值表示未啟用
     * @param region 區域標籤
     * @param priority 排序權重，數字越小越優先
     * @param enabled 是否啟用
     * @param timeout 連線與讀取逾時
     */
    public record ProviderConfig(
        String kind,
        String endpoint,
        String apiKey,
        String region,
        int priority,
        Boolean enabled,
        Duration timeout
    ) {
        public ProviderConfig {
            if (kind == null || kind.isBlank()) {
                kind = "http";
            }
            if (region == null || region.isBlank()) {
                region = "global";
            }
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofSeconds(10);
            }
        }
    }

    /**
     * 訂閱等級配額，{@code -1} 表示無限制。
     *
     * @param maxConcurrentSessions 同時進行中的 Session 上限
     * @param dailyMinutes 每日分鐘上限
     * @param monthlyMinutes 每月分鐘上限
     * @param maxStorageMb 儲存空間上限 (MB)
     * @param apiRatePerMinute 每分鐘 API 呼叫上限
     * @param maxTeamMembers 團隊成員上限
     */
    public record TierLimits(
        int maxConcurrentSessions,
        int dailyMinutes,
        int monthlyMinutes,
        long maxStorageMb,
        int apiRatePerMinute,
        int maxTeamMembers
    ) {
        public static final int UNLIMITED = -1;

        public boolean hasDailyCap() {
            return dailyMinutes > 0;
        }

        public boolean hasMonthlyCap() {
            return monthlyMinutes > 0;
        }

        /**
         * 預設配額表。
         */
        public static Map<String, TierLimits> defaultTable() {
            Map<String, TierLimits> table = new LinkedHashMap<>();
            table.put("free", new TierLimits(1, 60, 300, 500, 30, 0));
            table.put("starter", new TierLimits(2, 240, 2000, 5000, 60, 3));
            table.put("pro", new TierLimits(5, 720, 10000, 50000, 300, 10));
            table.put("enterprise", new TierLimits(20, UNLIMITED, UNLIMITED, 500000, 1000, 100));
            return table;
        }
    }

    /**
     * GPU 運算等級與定價。
     *
     * @param name 顯示名稱
     * @param gpuOptions 可用的 GPU 型號，第一個為預設
     * @param vramGb 顯示記憶體 (GB)
     * @param pricePerMinuteCents 每分鐘價格 (美分)
     */
    public record GpuTierConfig(
        String name,
        List<String> gpuOptions,
        int vramGb,
        long pricePerMinuteCents
    ) {
        public String defaultGpuType() {
            return gpuOptions == null || gpuOptions.isEmpty() ? null : gpuOptions.get(0);
        }

        /**
         * 預設 GPU 等級表。
         */
        public static Map<String, GpuTierConfig> defaultTable() {
            Map<String, GpuTierConfig> table = new LinkedHashMap<>();
            table.put("starter", new GpuTierConfig("Starter", List.of("RTX 4090", "RTX 5090"), 24, 1));
            table.put("pro", new GpuTierConfig("Pro", List.of("A100 40GB", "A100 80GB"), 80, 3));
            table.put("beast", new GpuTierConfig("Beast Mode", List.of("H100 80GB", "H100 8x"), 640, 7));
            table.put("ultra", new GpuTierConfig("Ultra", List.of("B300"), 288, 12));
            return table;
        }
    }

    /**
     * 自動儲值預設值，用戶未自訂時套用。
     *
     * @param defaultThresholdCents 餘額低於此值觸發 (美分)，預設 500
     * @param defaultAmountCents 每次儲值金額 (美分)，預設 2000
     */
    public record TopUpConfig(
        long defaultThresholdCents,
        long defaultAmountCents
    ) {
        public TopUpConfig {
            if (defaultThresholdCents <= 0) {
                defaultThresholdCents = 500;
            }
            if (defaultAmountCents <= 0) {
                defaultAmountCents = 2000;
            }
        }

        public static TopUpConfig defaults() {
            return new TopUpConfig(500, 2000);
        }
    }

    /**
     * SSE 推播設定。
     *
     * @param heartbeatIntervalMs 心跳間隔 (毫秒)，預設 30 秒
     * @param emitterTimeoutMs SseEmitter 逾時 (毫秒)，0 表示不逾時
     */
    public record StreamConfig(
        long heartbeatIntervalMs,
        long emitterTimeoutMs
    ) {
        public StreamConfig {
            if (heartbeatIntervalMs <= 0) {
                heartbeatIntervalMs = 30_000;
            }
            if (emitterTimeoutMs < 0) {
                emitterTimeoutMs = 0;
            }
        }

        public static StreamConfig defaults() {
            return new StreamConfig(30_000, 0);
        }
    }

    /**
     * 金流服務設定。
     *
     * @param apiBase Stripe API base URL
     * @param secretKey Stripe secret key，空值表示停用自動儲值扣款
     * @param currency 幣別
     * @param timeout 連線與讀取逾時
     */
    public record PaymentConfig(
        String apiBase,
        String secretKey,
        String currency,
        Duration timeout
    ) {
        public PaymentConfig {
            if (apiBase == null || apiBase.isBlank()) {
                apiBase = "https://api.stripe.com";
            }
            if (currency == null || currency.isBlank()) {
                currency = "usd";
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofSeconds(15);
            }
        }

        public boolean isConfigured() {
            return secretKey != null && !secretKey.isBlank();
        }

        public static PaymentConfig defaults() {
            return new PaymentConfig("https://api.stripe.com", null, "usd", Duration.ofSeconds(15));
        }
    }

    /**
     * 背景任務執行緒池設定（供應商停機、探測、自動儲值）。
     *
     * @param corePoolSize 核心執行緒數
     * @param maxPoolSize 最大執行緒數
     * @param queueCapacity 佇列容量
     */
    public record ExecutorConfig(
        int corePoolSize,
        int maxPoolSize,
        int queueCapacity
    ) {
        public ExecutorConfig {
            if (corePoolSize <= 0) {
                corePoolSize = 4;
            }
            if (maxPoolSize < corePoolSize) {
                maxPoolSize = Math.max(corePoolSize, 16);
            }
            if (queueCapacity <= 0) {
                queueCapacity = 500;
            }
        }

        public static ExecutorConfig defaults() {
            return new ExecutorConfig(4, 16, 500);
        }
    }
}
