package com.yerin.jobclient.infra;

import java.util.function.UnaryOperator;

/**
 * Picks the effective backend address: explicit value, then the
 * {@value #ENV_VAR} environment variable, then {@value #DEFAULT_URL}.
 */
public final class BackendAddressResolver {

    public static final String ENV_VAR = "REDIS_URL";
    public static final String DEFAULT_URL = "redis://localhost:6379/0";

    private BackendAddressResolver() {}

    public static String resolve(String override, UnaryOperator<String> env) {
        if (override != null && !override.isBlank()) return override.trim();
        String fromEnv = env.apply(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        return DEFAULT_URL;
    }

    public static String resolve(String override) {
        return resolve(override, System::getenv);
    }
}
