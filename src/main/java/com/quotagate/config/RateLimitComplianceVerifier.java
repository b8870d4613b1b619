package com.quotagate.config;

import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimitScope;
import com.quotagate.core.RuleConfigurationException;
import com.quotagate.web.RateLimited;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Startup check that every {@link RateLimited} handler names an operation
 * with a rule, and that USER_RESOURCE operations say where the resource id
 * comes from. Any gap aborts startup.
 */
@Slf4j
public class RateLimitComplianceVerifier implements SmartInitializingSingleton {

    private final RequestMappingHandlerMapping handlerMapping;
    private final RateLimitRuleRegistry rules;

    public RateLimitComplianceVerifier(RequestMappingHandlerMapping handlerMapping, RateLimitRuleRegistry rules) {
        this.handlerMapping = handlerMapping;
        this.rules = rules;
    }

    @Override
    public void afterSingletonsInstantiated() {
        verify(handlerMapping.getHandlerMethods().values(), rules);
    }

    /**
     * @return the operations found on the handlers
     * @throws RuleConfigurationException on the first pass that finds any gap
     */
    static Set<String> verify(Collection<HandlerMethod> handlers, RateLimitRuleRegistry rules) {
        Set<String> operations = new LinkedHashSet<>();
        List<String> problems = new ArrayList<>();

        for (HandlerMethod handler : handlers) {
            RateLimited annotation = handler.getMethodAnnotation(RateLimited.class);
            if (annotation == null) {
                continue;
            }
            String operation = annotation.operation();
            String where = handler.getBeanType().getSimpleName() + "#" + handler.getMethod().getName();
            if (operation.isBlank()) {
                problems.add(where + ": @RateLimited without an operation");
                continue;
            }
            operations.add(operation);

            Optional<RateLimitRule> rule = rules.find(operation);
            if (rule.isPresent() && rule.get().getScope() == RateLimitScope.USER_RESOURCE
                    && annotation.resourceVariable().isBlank()) {
                problems.add(where + ": operation " + operation + " is USER_RESOURCE scoped but names no resourceVariable");
            }
        }

        if (!problems.isEmpty()) {
            throw new RuleConfigurationException(problems);
        }
        rules.requireOperations(operations);
        log.info("Rate limited operations on handlers: {}", operations);
        return operations;
    }
}
