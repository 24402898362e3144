package io.github.samzhu.keeper.dto.api;

import java.time.Instant;

import io.github.samzhu.keeper.document.CreditTransaction;

/**
 * 交易記錄回應。
 */
public record TransactionResponse(
    String id,
    String sessionId,
    String type,
    long amountCents,
    String description,
    Instant createdAt
) {

    public static TransactionResponse from(CreditTransaction tx) {
        return new TransactionResponse(
            tx.id(),
            tx.sessionId(),
            tx.type(),
            tx.amountCents(),
            tx.description(),
            tx.createdAt()
        );
    }
}
