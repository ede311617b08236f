package com.example.orderbridge.transform;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fails attempts for keys matching configured prefixes.
 * <ul>
 *   <li>fail-once prefixes: the first attempt for a key fails, later attempts succeed</li>
 *   <li>always-fail prefixes: every attempt fails</li>
 * </ul>
 * Attempt counts are kept per key in memory, so they reset on restart.
 */
@Slf4j
public class PrefixFaultInjectionPolicy implements FaultInjectionPolicy {

    private final List<String> failOncePrefixes;
    private final List<String> alwaysFailPrefixes;
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();

    public PrefixFaultInjectionPolicy(List<String> failOncePrefixes, List<String> alwaysFailPrefixes) {
        this.failOncePrefixes = List.copyOf(failOncePrefixes);
        this.alwaysFailPrefixes = List.copyOf(alwaysFailPrefixes);
        log.warn("Fault injection ENABLED - fail once: {}, always fail: {}", this.failOncePrefixes, this.alwaysFailPrefixes);
    }

    @Override
    public boolean shouldFail(String messageKey) {
        if (messageKey == null) {
            return false;
        }
        if (matches(alwaysFailPrefixes, messageKey)) {
            return true;
        }
        if (matches(failOncePrefixes, messageKey)) {
            int attempt = attempts.merge(messageKey, 1, Integer::sum);
            return attempt == 1;
        }
        return false;
    }

    private static boolean matches(List<String> prefixes, String messageKey) {
        return prefixes.stream().anyMatch(prefix -> !prefix.isEmpty() && messageKey.startsWith(prefix));
    }
}
