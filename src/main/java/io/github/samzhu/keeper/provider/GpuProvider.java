package io.github.samzhu.keeper.provider;

/**
 * GPU 供應商能力介面。
 *
 * <p>實作只負責單次呼叫，不做重試與斷路；失敗一律拋出
 * {@link io.github.samzhu.keeper.exception.ProviderException}。
 */
public interface GpuProvider {

    /**
     * @return 供應商名稱，同時作為斷路器名稱
     */
    String name();

    String region();

    /**
     * @return 排序權重，數字越小越優先
     */
    int priority();

    ProvisionedInstance provision(ProvisionRequest request);

    void terminate(String instanceId);

    /**
     * 健康檢查，成功即正常返回。
     */
    void healthCheck();
}
