package com.ryuqq.typeguard.core.event;

import java.util.Optional;

/**
 * 사용자 생성 경로.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum CreationSource {

    REGISTRATION("registration"),
    ADMIN("admin"),
    IMPORT("import");

    private final String wireName;

    CreationSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CreationSource> fromWireName(String wireName) {
        for (CreationSource source : values()) {
            if (source.wireName.equals(wireName)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    static String[] wireNames() {
        CreationSource[] sources = values();
        String[] names = new String[sources.length];
        for (int i = 0; i < sources.length; i++) {
            names[i] = sources[i].wireName;
        }
        return names;
    }
}
