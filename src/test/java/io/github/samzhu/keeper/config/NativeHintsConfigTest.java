package io.github.samzhu.keeper.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.predicate.RuntimeHintsPredicates;

import io.github.samzhu.keeper.document.CreditTransaction;
import io.github.samzhu.keeper.document.GpuSession;
import io.github.samzhu.keeper.document.UserAccount;
import io.github.samzhu.keeper.dto.SessionActivityData;
import io.github.samzhu.keeper.dto.api.SessionResponse;
import io.github.samzhu.keeper.resilience.CircuitBreaker;

class NativeHintsConfigTest {

    @Test
    void shouldRegisterReflectionForDocumentsAndPayloads() {
        // Given
        RuntimeHints hints = new RuntimeHints();

        // When
        new NativeHintsConfig.KeeperRuntimeHints().registerHints(hints, getClass().getClassLoader());

        // Then
        assertThat(RuntimeHintsPredicates.reflection().onType(GpuSession.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(CreditTransaction.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(UserAccount.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(SessionActivityData.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(SessionResponse.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(CircuitBreaker.CircuitStats.class)).accepts(hints);
    }
}
