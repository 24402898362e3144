package io.github.samzhu.keeper.document;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GPU Session 狀態與合法轉移表。
 *
 * <p>文件中以小寫字串儲存（{@link #code()}），此列舉只負責轉移規則。
 *
 * <pre>
 * pending → provisioning → ready → active ⇄ paused
 *    │           │           │        │        │
 *    └───────────┴───────────┴────────┴────────┴──→ terminated | error
 * </pre>
 */
public enum SessionStatus {

    PENDING("pending"),
    PROVISIONING("provisioning"),
    READY("ready"),
    ACTIVE("active"),
    PAUSED("paused"),
    TERMINATED("terminated"),
    ERROR("error");

    private static final Map<SessionStatus, Set<SessionStatus>> TRANSITIONS = Map.of(
        PENDING, EnumSet.of(PROVISIONING, TERMINATED, ERROR),
        PROVISIONING, EnumSet.of(READY, TERMINATED, ERROR),
        READY, EnumSet.of(ACTIVE, TERMINATED, ERROR),
        ACTIVE, EnumSet.of(PAUSED, TERMINATED, ERROR),
        PAUSED, EnumSet.of(ACTIVE, TERMINATED, ERROR),
        TERMINATED, EnumSet.noneOf(SessionStatus.class),
        ERROR, EnumSet.noneOf(SessionStatus.class)
    );

    /** 佔用配額的狀態 */
    public static final Set<SessionStatus> OCCUPYING = EnumSet.of(PENDING, PROVISIONING, READY, ACTIVE, PAUSED);

    /** 殭屍回收會檢查的狀態 */
    public static final Set<SessionStatus> ZOMBIE_CANDIDATES = EnumSet.of(PROVISIONING, READY, ACTIVE);

    private final String code;

    SessionStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * 所有可以轉移到 {@code target} 的來源狀態。
     */
    public static Set<SessionStatus> sourcesOf(SessionStatus target) {
        Set<SessionStatus> sources = EnumSet.noneOf(SessionStatus.class);
        for (SessionStatus status : values()) {
            if (status.canTransitionTo(target)) {
                sources.add(status);
            }
        }
        return sources;
    }

    public static List<String> codes(Set<SessionStatus> statuses) {
        return statuses.stream().map(SessionStatus::code).sorted().toList();
    }

    /**
     * 由儲存的字串轉回列舉。
     *
     * @throws IllegalArgumentException 未知狀態
     */
    public static SessionStatus of(String code) {
        return Arrays.stream(values())
            .filter(s -> s.code.equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + code));
    }
}
