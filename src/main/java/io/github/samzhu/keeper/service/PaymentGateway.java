package io.github.samzhu.keeper.service;

/**
 * 金流能力介面。
 *
 * <p>卡片被拒等業務性失敗以 {@link ChargeResult#failed(String)} 回傳；
 * 連線或伺服器錯誤則拋出例外，交由斷路器記錄。
 */
public interface PaymentGateway {

    /**
     * 對已綁定的付款方式發起離線扣款。
     *
     * @param customerRef 金流客戶參考編號
     * @param amountCents 金額 (美分)
     * @param idempotencyKey 冪等鍵，同一次嘗試重送不會重複扣款
     * @param description 扣款說明
     * @return 扣款結果
     */
    ChargeResult charge(String customerRef, long amountCents, String idempotencyKey, String description);

    /**
     * 扣款結果。
     *
     * @param success 是否成功
     * @param paymentReference 成功時的金流參考編號
     * @param failureMessage 失敗原因
     */
    record ChargeResult(boolean success, String paymentReference, String failureMessage) {

        public static ChargeResult succeeded(String paymentReference) {
            return new ChargeResult(true, paymentReference, null);
        }

        public static ChargeResult failed(String failureMessage) {
            return new ChargeResult(false, null, failureMessage);
        }
    }
}
