package io.github.samzhu.keeper.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.keeper.document.CreditTransaction;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.dto.SessionActivityData;
import io.github.samzhu.keeper.dto.SessionMetrics;
import io.github.samzhu.keeper.dto.api.AutoTopUpConfigRequest;
import io.github.samzhu.keeper.dto.api.AutoTopUpConfigResponse;
import io.github.samzhu.keeper.dto.api.CreateSessionRequest;
import io.github.samzhu.keeper.dto.api.QuotaDecision;
import io.github.samzhu.keeper.dto.api.ReaperRunResponse;
import io.github.samzhu.keeper.dto.api.SessionResponse;
import io.github.samzhu.keeper.dto.api.TransactionResponse;
import io.github.samzhu.keeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.keeper.provider.ProviderHealthRecord;
import io.github.samzhu.keeper.resilience.CircuitBreaker;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊 Jackson 與 Spring Data 需要反射存取的類別：
 * <ul>
 *   <li>MongoDB 文件 - {@link GpuSession}、{@link CreditTransaction}、{@link UserAccount}</li>
 *   <li>CloudEvent payload - {@link SessionActivityData}</li>
 *   <li>API 請求/回應 record</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.KeeperRuntimeHints.class)
public class NativeHintsConfig {

    /**
     * RuntimeHintsRegistrar 實作，註冊 Keeper 服務所需的反射提示。
     */
    static class KeeperRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // Document
            hints.reflection()
                .registerType(GpuSession.class, MemberCategory.values())
                .registerType(CreditTransaction.class, MemberCategory.values())
                .registerType(UserAccount.class, MemberCategory.values());

            // CloudEvent payload 與 SSE
            hints.reflection()
                .registerType(SessionActivityData.class, MemberCategory.values())
                .registerType(SessionMetrics.class, MemberCategory.values());

            // API DTO
            hints.reflection()
                .registerType(CreateSessionRequest.class, MemberCategory.values())
                .registerType(SessionResponse.class, MemberCategory.values())
                .registerType(QuotaDecision.class, MemberCategory.values())
                .registerType(UsageSummaryResponse.class, MemberCategory.values())
                .registerType(UsageSummaryResponse.Usage.class, MemberCategory.values())
                .registerType(UsageSummaryResponse.Percentages.class, MemberCategory.values())
                .registerType(KeeperProperties.TierLimits.class, MemberCategory.values())
                .registerType(AutoTopUpConfigRequest.class, MemberCategory.values())
                .registerType(AutoTopUpConfigResponse.class, MemberCategory.values())
                .registerType(TransactionResponse.class, MemberCategory.values())
                .registerType(ReaperRunResponse.class, MemberCategory.values())
                .registerType(CircuitBreaker.CircuitStats.class, MemberCategory.values())
                .registerType(ProviderHealthRecord.class, MemberCategory.values());
        }
    }
}
