package com.quotagate.config;

import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RuleConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rule set keyed by operation id.
 *
 * Read-only while serving. {@link #reload(Collection)} validates a complete
 * replacement and swaps it in with one reference write, so a reader sees
 * either the old set or the new one, never a mix.
 */
@Slf4j
public class RateLimitRuleRegistry {

    private final AtomicReference<Map<String, RateLimitRule>> rules;
    private final AtomicReference<Set<String>> requiredOperations = new AtomicReference<>(Set.of());

    private RateLimitRuleRegistry(Map<String, RateLimitRule> initial) {
        this.rules = new AtomicReference<>(initial);
    }

    /**
     * @throws RuleConfigurationException listing every invalid or duplicated rule
     */
    public static RateLimitRuleRegistry of(Collection<RateLimitRule> rules) {
        RateLimitRuleRegistry registry = new RateLimitRuleRegistry(validated(rules));
        log.info("Loaded {} rate limit rules: {}", registry.size(), registry.operationIds());
        return registry;
    }

    public Optional<RateLimitRule> find(String operationId) {
        if (operationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get().get(operationId));
    }

    /**
     * Declares the operations that must always have a rule. Checked now and on
     * every reload.
     *
     * @throws RuleConfigurationException if any of them lacks a rule
     */
    public void requireOperations(Collection<String> operationIds) {
        Set<String> required = Collections.unmodifiableSet(new LinkedHashSet<>(operationIds));
        checkCoverage(rules.get(), required);
        requiredOperations.set(required);
        log.info("Verified rate limit rules for {} registered operations", required.size());
    }

    /**
     * Replaces the whole rule set. On failure the current set keeps serving.
     *
     * @throws RuleConfigurationException if the new set is invalid or drops a required operation
     */
    public void reload(Collection<RateLimitRule> replacement) {
        Map<String, RateLimitRule> next = validated(replacement);
        checkCoverage(next, requiredOperations.get());
        rules.set(next);
        log.info("Reloaded {} rate limit rules", next.size());
    }

    public Map<String, RateLimitRule> snapshot() {
        return rules.get();
    }

    public Set<String> operationIds() {
        return new TreeSet<>(rules.get().keySet());
    }

    public int size() {
        return rules.get().size();
    }

    private static Map<String, RateLimitRule> validated(Collection<RateLimitRule> candidates) {
        List<String> problems = new ArrayList<>();
        Map<String, RateLimitRule> byOperation = new LinkedHashMap<>();
        for (RateLimitRule rule : candidates) {
            problems.addAll(rule.violations());
            if (rule.getOperationId() != null && byOperation.put(rule.getOperationId(), rule) != null) {
                problems.add(rule.getOperationId() + ": more than one rule for the operation");
            }
        }
        if (!problems.isEmpty()) {
            throw new RuleConfigurationException(problems);
        }
        for (RateLimitRule rule : byOperation.values()) {
            if (!rule.isSatisfiable()) {
                log.warn("Rule {} can never admit a call: cost {} exceeds capacity {}",
                        rule.getOperationId(), rule.getCost(), rule.getCapacity());
            }
        }
        return Collections.unmodifiableMap(byOperation);
    }

    private static void checkCoverage(Map<String, RateLimitRule> candidate, Set<String> required) {
        List<String> missing = new ArrayList<>();
        for (String operationId : required) {
            if (!candidate.containsKey(operationId)) {
                missing.add("no rule for registered operation " + operationId);
            }
        }
        if (!missing.isEmpty()) {
            throw new RuleConfigurationException(missing);
        }
    }
}
