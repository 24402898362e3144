package io.github.samzhu.keeper.dto.api;

import java.time.Instant;

import io.github.samzhu.keeper.document.GpuSession;

/**
 * Session API 回應。
 */
public record SessionResponse(
    String id,
    String userId,
    String type,
    String tier,
    String gpuType,
    int gpuCount,
    String modelId,
    String status,
    String provider,
    String accessUrl,
    long pricePerMinuteCents,
    Instant createdAt,
    Instant startedAt,
    Instant updatedAt,
    Instant terminatedAt,
    String terminationReason,
    Long totalMinutes,
    Long totalCostCents
) {

    public static SessionResponse from(GpuSession session) {
        return new SessionResponse(
            session.id(),
            session.userId(),
            session.type(),
            session.tier(),
            session.gpuType(),
            session.gpuCount(),
            session.modelId(),
            session.status(),
            session.provider(),
            session.accessUrl(),
            session.pricePerMinuteCents(),
            session.createdAt(),
            session.startedAt(),
            session.updatedAt(),
            session.terminatedAt(),
            session.terminationReason(),
            session.totalMinutes(),
            session.totalCostCents()
        );
    }
}
