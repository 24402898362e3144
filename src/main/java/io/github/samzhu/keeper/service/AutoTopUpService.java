package io.github.samzhu.keeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.TopUpConfig;
import io.github.samzhu.keeper.document.CreditTransaction;
import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.repository.CreditTransactionRepository;
import io.github.samzhu.keeper.repository.UserAccountRepository;
import io.github.samzhu.keeper.resilience.CircuitBreakerRegistry;
import io.github.samzhu.keeper.service.PaymentGateway.ChargeResult;

/**
 * 自動儲值服務。
 *
 * <p>觸發條件（全部成立才扣款）：
 * <ul>
 *   <li>用戶啟用自動儲值</li>
 *   <li>餘額低於門檻（預設 500 美分）</li>
 *   <li>已綁定付款方式</li>
 * </ul>
 *
 * <p>扣款經過 {@code stripe} 斷路器，每次嘗試使用新的冪等鍵。
 * 成功後以 {@code $inc} 增加餘額並寫入一筆 {@code auto_topup} 交易。
 * 任何失敗只記錄日誌並回傳結果，不會拋出例外。
 */
@Service
public class AutoTopUpService {

    private static final Logger log = LoggerFactory.getLogger(AutoTopUpService.class);

    static final String PAYMENT_DEPENDENCY = "stripe";

    private final UserAccountRepository userAccountRepository;
    private final CreditTransactionRepository creditTransactionRepository;
    private final PaymentGateway paymentGateway;
    private final CircuitBreakerRegistry circuitBreakers;
    private final TopUpConfig defaults;
    private final Clock clock;
    private final Executor executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public AutoTopUpService(
            UserAccountRepository userAccountRepository,
            CreditTransactionRepository creditTransactionRepository,
            PaymentGateway paymentGateway,
            CircuitBreakerRegistry circuitBreakers,
            KeeperProperties properties,
            Clock clock,
            @Qualifier("backgroundExecutor") Executor executor) {
        this.userAccountRepository = userAccountRepository;
        this.creditTransactionRepository = creditTransactionRepository;
        this.paymentGateway = paymentGateway;
        this.circuitBreakers = circuitBreakers;
        this.defaults = properties.topUp();
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * 檢查並在需要時執行自動儲值。
     *
     * @param userId 用戶 ID
     * @return 執行結果，不會拋出例外
     */
    public TopUpResult checkAutoTopUp(String userId) {
        if (!inFlight.add(userId)) {
            log.debug("Auto top-up already in progress: userId={}", userId);
            return TopUpResult.of(userId, Outcome.IN_PROGRESS, "top-up already in progress");
        }
        try {
            return doCheck(userId);
        } catch (Exception e) {
            log.error("Auto top-up failed: userId={}, error={}", userId, e.getMessage(), e);
            return TopUpResult.of(userId, Outcome.FAILED, e.getMessage());
        } finally {
            inFlight.remove(userId);
        }
    }

    /**
     * 提交到背景執行緒池執行 {@link #checkAutoTopUp(String)}。
     *
     * @param userId 用戶 ID
     */
    public void triggerAsync(String userId) {
        try {
            executor.execute(() -> {
                TopUpResult result = checkAutoTopUp(userId);
                log.debug("Async auto top-up finished: userId={}, outcome={}", userId, result.outcome());
            });
        } catch (RejectedExecutionException e) {
            log.error("Auto top-up task rejected by executor: userId={}", userId, e);
        }
    }

    /**
     * 套用預設值後的觸發門檻。
     */
    public long effectiveThreshold(UserAccount account) {
        return account.autoTopUpThresholdCents() > 0
            ? account.autoTopUpThresholdCents()
            : defaults.defaultThresholdCents();
    }

    /**
     * 套用預設值後的儲值金額。
     */
    public long effectiveAmount(UserAccount account) {
        return account.autoTopUpAmountCents() > 0
            ? account.autoTopUpAmountCents()
            : defaults.defaultAmountCents();
    }

    private TopUpResult doCheck(String userId) {
        UserAccount account = userAccountRepository.findByUserId(userId).orElse(null);
        if (account == null) {
            log.warn("Auto top-up skipped, account not found: userId={}", userId);
            return TopUpResult.of(userId, Outcome.ACCOUNT_NOT_FOUND, "account not found");
        }
        if (!account.autoTopUpEnabled()) {
            return TopUpResult.of(userId, Outcome.DISABLED, "auto top-up disabled");
        }

        long threshold = effectiveThreshold(account);
        if (account.creditBalanceCents() >= threshold) {
            return TopUpResult.of(userId, Outcome.NOT_NEEDED, "balance above threshold");
        }
        if (!account.hasPaymentMethod()) {
            log.warn("Auto top-up skipped, no payment method: userId={}, balance={}",
                userId, account.creditBalanceCents());
            return TopUpResult.of(userId, Outcome.NO_PAYMENT_METHOD, "no payment method on file");
        }

        long amount = effectiveAmount(account);
        String idempotencyKey = "topup_" + userId + "_" + UUID.randomUUID();
        log.info("Auto top-up triggered: userId={}, balance={}, threshold={}, amount={}",
            userId, account.creditBalanceCents(), threshold, amount);

        ChargeResult charge = circuitBreakers.get(PAYMENT_DEPENDENCY).execute(() ->
            paymentGateway.charge(account.paymentCustomerRef(), amount, idempotencyKey, "Keeper auto top-up"));

        if (!charge.success()) {
            log.warn("Auto top-up charge declined: userId={}, reason={}", userId, charge.failureMessage());
            return TopUpResult.of(userId, Outcome.FAILED, charge.failureMessage());
        }

        Instant now = clock.instant();
        try {
            userAccountRepository.incrementBalanceByUserId(userId, amount, now);
            creditTransactionRepository.insert(
                CreditTransaction.autoTopUp(userId, amount, charge.paymentReference(), now));
        } catch (RuntimeException e) {
            // 已扣款但未入帳，需人工對帳
            log.error("Auto top-up charged but not credited: userId={}, amount={}, paymentReference={}",
                userId, amount, charge.paymentReference(), e);
            return new TopUpResult(userId, Outcome.FAILED, amount, charge.paymentReference(), e.getMessage());
        }

        log.info("Auto top-up completed: userId={}, amount={}, paymentReference={}",
            userId, amount, charge.paymentReference());
        return new TopUpResult(userId, Outcome.CHARGED, amount, charge.paymentReference(), null);
    }

    /**
     * 自動儲值結果類型。
     */
    public enum Outcome {
        CHARGED,
        NOT_NEEDED,
        DISABLED,
        NO_PAYMENT_METHOD,
        ACCOUNT_NOT_FOUND,
        IN_PROGRESS,
        FAILED
    }

    /**
     * 自動儲值結果。
     *
     * @param userId 用戶 ID
     * @param outcome 結果類型
     * @param amountCents 儲值金額，未扣款為 0
     * @param paymentReference 金流參考編號
     * @param message 說明
     */
    public record TopUpResult(
        String userId,
        Outcome outcome,
        long amountCents,
        String paymentReference,
        String message
    ) {
        static TopUpResult of(String userId, Outcome outcome, String message) {
            return new TopUpResult(userId, outcome, 0L, null, message);
        }
    }
}
