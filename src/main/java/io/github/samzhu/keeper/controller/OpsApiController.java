package io.github.samzhu.keeper.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.keeper.dto.api.ReaperRunResponse;
import io.github.samzhu.keeper.provider.ProviderHealthMonitor;
import io.github.samzhu.keeper.provider.ProviderHealthRecord;
import io.github.samzhu.keeper.resilience.CircuitBreaker.CircuitStats;
import io.github.samzhu.keeper.resilience.CircuitBreakerRegistry;
import io.github.samzhu.keeper.service.ZombieReaperService;

/**
 * 運維 API 控制器。
 *
 * <p>斷路器狀態與重置、供應商健康度、手動觸發殭屍回收。
 */
@RestController
@RequestMapping("/api/v1/ops")
public class OpsApiController {

    private static final Logger log = LoggerFactory.getLogger(OpsApiController.class);

    private final CircuitBreakerRegistry circuitBreakers;
    private final ProviderHealthMonitor healthMonitor;
    private final ZombieReaperService reaperService;

    public OpsApiController(
            CircuitBreakerRegistry circuitBreakers,
            ProviderHealthMonitor healthMonitor,
            ZombieReaperService reaperService) {
        this.circuitBreakers = circuitBreakers;
        this.healthMonitor = healthMonitor;
        this.reaperService = reaperService;
    }

    @GetMapping("/circuits")
    public ResponseEntity<List<CircuitStats>> getCircuits() {
        return ResponseEntity.ok(circuitBreakers.snapshot());
    }

    /**
     * 強制關閉斷路器。
     *
     * @param name 依賴名稱
     * @return 重置後的統計，不存在時 404
     */
    @PostMapping("/circuits/{name}/reset")
    public ResponseEntity<CircuitStats> resetCircuit(@PathVariable String name) {
        log.info("Manual circuit reset requested: {}", name);
        if (!circuitBreakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(circuitBreakers.get(name).stats());
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderHealthRecord>> getProviders() {
        return ResponseEntity.ok(healthMonitor.getAll());
    }

    @PostMapping("/reaper/run")
    public ResponseEntity<ReaperRunResponse> runReaper() {
        log.info("Manual zombie cleanup triggered");
        return ResponseEntity.ok(reaperService.runOnce());
    }
}
