package com.talent.match.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String OUTCOME = "outcome";
    public static final String DEFAULT_CATEGORY = "General";
    public static final String ATHLETIC_MARKETPLACE = "athletic";

    public static final String SKILL_MAPPING_CACHE = "skillMappingCache";
    public static final String ENGINE_CONFIG_CACHE = "engineConfigCache";
    public static final String SNAPSHOT_RESILIENCE = "marketplaceSnapshot";
}
