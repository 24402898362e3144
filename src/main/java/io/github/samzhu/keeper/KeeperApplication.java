package io.github.samzhu.keeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Keeper Service - GPU 租用 Session 生命週期、容錯與計費對帳服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>維護 Session 狀態機 (pending → provisioning → ready → active → terminated)</li>
 *   <li>定時偵測並回收殭屍 Session (zombie reaper)</li>
 *   <li>以 Circuit Breaker 隔離不穩定的 GPU 供應商與金流服務</li>
 *   <li>定時探測供應商健康度並排序，供開機時故障轉移</li>
 *   <li>依訂閱等級檢查配額</li>
 *   <li>結算 Session 費用、寫入交易帳本、自動儲值</li>
 *   <li>以 SSE 推播 Session 狀態與指標</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * 建立請求 → Quota 檢查 → Provider 排序 → Circuit Breaker → 開機
 *                                   ↓
 *   GPU Agent (CloudEvents) → 活動紀錄 (updatedAt) → SSE metrics
 *                                   ↓
 *   使用者終止 / Zombie Reaper → 結算 → credit_transactions → 自動儲值
 * </pre>
 */
@SpringBootApplication
@EnableScheduling
public class KeeperApplication {

    private static final Logger log = LoggerFactory.getLogger(KeeperApplication.class);

    public static void main(String[] args) {
        log.info("Starting Keeper Service - GPU Session Lifecycle & Billing");
        SpringApplication.run(KeeperApplication.class, args);
    }
}
