package io.github.samzhu.keeper.controller;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.dto.api.AutoTopUpConfigRequest;
import io.github.samzhu.keeper.dto.api.AutoTopUpConfigResponse;
import io.github.samzhu.keeper.dto.api.TransactionResponse;
import io.github.samzhu.keeper.exception.AccountNotFoundException;
import io.github.samzhu.keeper.repository.CreditTransactionRepository;
import io.github.samzhu.keeper.repository.UserAccountRepository;
import io.github.samzhu.keeper.service.AutoTopUpService;

/**
 * 帳戶 API 控制器。
 *
 * <p>提供自動儲值設定與交易記錄查詢。
 */
@RestController
@RequestMapping("/api/v1/accounts")
public class AccountApiController {

    private static final Logger log = LoggerFactory.getLogger(AccountApiController.class);

    private final UserAccountRepository userAccountRepository;
    private final CreditTransactionRepository creditTransactionRepository;
    private final AutoTopUpService autoTopUpService;
    private final Clock clock;

    public AccountApiController(
            UserAccountRepository userAccountRepository,
            CreditTransactionRepository creditTransactionRepository,
            AutoTopUpService autoTopUpService,
            Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.creditTransactionRepository = creditTransactionRepository;
        this.autoTopUpService = autoTopUpService;
        this.clock = clock;
    }

    // ========== 自動儲值 ==========

    @GetMapping("/{userId}/auto-topup")
    public ResponseEntity<AutoTopUpConfigResponse> getAutoTopUp(@PathVariable String userId) {
        return ResponseEntity.ok(toResponse(findAccount(userId)));
    }

    /**
     * 更新自動儲值設定，未指定的金額使用預設值。
     *
     * @param userId 用戶 ID
     * @param request 設定請求
     * @return 更新後的設定
     */
    @PutMapping("/{userId}/auto-topup")
    public ResponseEntity<AutoTopUpConfigResponse> updateAutoTopUp(
            @PathVariable String userId,
            @RequestBody @Validated AutoTopUpConfigRequest request) {

        log.info("Updating auto top-up for user: {} -> enabled={}, threshold={}, amount={}",
            userId, request.enabled(), request.thresholdCents(), request.amountCents());

        long updated = userAccountRepository.updateAutoTopUpByUserId(
            userId,
            request.enabled(),
            request.thresholdCents() != null ? request.thresholdCents() : 0L,
            request.amountCents() != null ? request.amountCents() : 0L,
            clock.instant()
        );
        if (updated == 0) {
            throw new AccountNotFoundException(userId);
        }

        UserAccount account = findAccount(userId);
        if (account.autoTopUpEnabled()) {
            autoTopUpService.triggerAsync(userId);
        }
        return ResponseEntity.ok(toResponse(account));
    }

    // ========== 交易記錄 ==========

    /**
     * 分頁查詢交易記錄，新的在前。
     *
     * @param userId 用戶 ID
     * @param page 頁碼（從 0 開始）
     * @param size 每頁數量（最多 100）
     * @return 交易記錄
     */
    @GetMapping("/{userId}/transactions")
    public ResponseEntity<Page<TransactionResponse>> getTransactions(
            @PathVariable String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        log.debug("Getting transactions: userId={}, page={}, size={}", userId, page, size);

        int effectiveSize = Math.min(Math.max(size, 1), 100);
        Page<TransactionResponse> transactions = creditTransactionRepository
            .findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(Math.max(page, 0), effectiveSize))
            .map(TransactionResponse::from);
        return ResponseEntity.ok(transactions);
    }

    private UserAccount findAccount(String userId) {
        return userAccountRepository.findByUserId(userId)
            .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    private AutoTopUpConfigResponse toResponse(UserAccount account) {
        return new AutoTopUpConfigResponse(
            account.userId(),
            account.autoTopUpEnabled(),
            autoTopUpService.effectiveThreshold(account),
            autoTopUpService.effectiveAmount(account),
            account.creditBalanceCents(),
            account.hasPaymentMethod()
        );
    }
}
