package io.github.samzhu.keeper.document;

import java.util.Arrays;

/**
 * Session 終止原因，以小寫字串儲存。
 */
public enum TerminationReason {

    USER("user"),
    ADMIN("admin"),
    ZOMBIE_CLEANUP("zombie_cleanup"),
    PROVIDER_FAILURE("provider_failure");

    private final String code;

    TerminationReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TerminationReason of(String code) {
        return Arrays.stream(values())
            .filter(r -> r.code.equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown termination reason: " + code));
    }
}
