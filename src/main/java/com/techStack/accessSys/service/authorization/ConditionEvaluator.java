package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.condition.ConditionPredicate;
import com.techStack.accessSys.service.authorization.condition.EvaluationAttributes;
import com.techStack.accessSys.service.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a permission's conditions hold. Predicates are a conjunction;
 * a missing attribute or a malformed predicate makes the permission unsatisfied.
 * Nothing here throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionEvaluator {

    private final EngineMetrics metrics;

    public boolean isSatisfied(PermissionRecord permission, EvaluationAttributes attributes) {
        if (permission.isUnconditional()) {
            return true;
        }
        for (ConditionPredicate predicate : permission.getConditions()) {
            if (!holds(permission, predicate, attributes)) {
                return false;
            }
        }
        return true;
    }

    private boolean holds(PermissionRecord permission, ConditionPredicate predicate, EvaluationAttributes attributes) {
        Optional<Object> actual = attributes.resolve(predicate.attributePath());
        if (actual.isEmpty()) {
            log.debug("Condition '{}' of permission {} unsatisfied: attribute absent",
                    predicate.attributePath(), permission.getId());
            return false;
        }
        try {
            return predicate.test(actual.get());
        } catch (MalformedConditionException e) {
            log.warn("⚠️ Permission {} treated as unsatisfied: {}", permission.getId(), e.getMessage());
            metrics.recordMalformedCondition();
            return false;
        } catch (RuntimeException e) {
            log.warn("⚠️ Condition '{}' of permission {} failed on {}; treated as unsatisfied",
                    predicate.attributePath(), permission.getId(), actual.get(), e);
            metrics.recordMalformedCondition();
            return false;
        }
    }
}
