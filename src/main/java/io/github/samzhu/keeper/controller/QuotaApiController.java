package io.github.samzhu.keeper.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.keeper.config.KeeperProperties.TierLimits;
import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.dto.api.QuotaDecision;
import io.github.samzhu.keeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.keeper.exception.AccountNotFoundException;
import io.github.samzhu.keeper.repository.UserAccountRepository;
import io.github.samzhu.keeper.service.QuotaService;

/**
 * 配額查詢 API 控制器。
 *
 * <p>提供建立前檢查、用量摘要與等級配額查詢。
 */
@RestController
@RequestMapping("/api/v1/quota")
public class QuotaApiController {

    private static final Logger log = LoggerFactory.getLogger(QuotaApiController.class);

    private final QuotaService quotaService;
    private final UserAccountRepository userAccountRepository;

    public QuotaApiController(QuotaService quotaService, UserAccountRepository userAccountRepository) {
        this.quotaService = quotaService;
        this.userAccountRepository = userAccountRepository;
    }

    // ========== 用戶配額 ==========

    /**
     * 檢查用戶目前是否可以建立新 Session。
     *
     * @param userId 用戶 ID
     * @return 檢查結果
     */
    @GetMapping("/users/{userId}/check")
    public ResponseEntity<QuotaDecision> checkSessionAllowed(@PathVariable String userId) {
        log.debug("Checking session quota for user: {}", userId);
        return ResponseEntity.ok(quotaService.checkSessionAllowed(userId, tierOf(userId)));
    }

    /**
     * 取得用戶用量摘要。
     *
     * @param userId 用戶 ID
     * @return 用量摘要
     */
    @GetMapping("/users/{userId}/usage")
    public ResponseEntity<UsageSummaryResponse> getUsageSummary(@PathVariable String userId) {
        log.debug("Getting usage summary for user: {}", userId);
        return ResponseEntity.ok(quotaService.getUsageSummary(userId, tierOf(userId)));
    }

    // ========== 等級配額 ==========

    @GetMapping("/tiers/{tier}")
    public ResponseEntity<TierLimits> getTierLimits(@PathVariable String tier) {
        return ResponseEntity.ok(quotaService.getLimits(tier));
    }

    private String tierOf(String userId) {
        return userAccountRepository.findByUserId(userId)
            .map(UserAccount::tier)
            .orElseThrow(() -> new AccountNotFoundException(userId));
    }
}
