package com.example.CourseRag.util;

import org.slf4j.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Emits a warning the first time a key is seen and stays silent afterwards.
 * Keys are backend names such as "embedding-model" or "neo4j".
 */
public final class OneTimeWarnings {

    private final Logger log;
    private final Set<String> fired = ConcurrentHashMap.newKeySet();

    public OneTimeWarnings(Logger log) {
        this.log = log;
    }

    /**
     * @return true when this call actually logged
     */
    public boolean warn(String key, String message, Object... args) {
        if (!fired.add(key)) {
            return false;
        }
        log.warn(message, args);
        return true;
    }

    public boolean hasFired(String key) {
        return fired.contains(key);
    }
}
