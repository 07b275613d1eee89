package com.sunny.jobconsole.core.enums;

/**
 * executor heartbeat timing, in seconds
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class RegistryConfig {

    // executor beat interval
    public static final int BEAT_TIMEOUT = 30;
    // an entry older than this is stale, still usable as last resort
    public static final int DEAD_TIMEOUT = BEAT_TIMEOUT * 3;

    public enum RegistType{ EXECUTOR, ADMIN }

    /**
     * oldest update time (epoch ms) still counted as alive
     */
    public static long aliveCutoff(long nowMs, int deadTimeoutSeconds) {
        int timeout = deadTimeoutSeconds <= 0 ? DEAD_TIMEOUT : deadTimeoutSeconds;
        return nowMs - timeout * 1000L;
    }

}
