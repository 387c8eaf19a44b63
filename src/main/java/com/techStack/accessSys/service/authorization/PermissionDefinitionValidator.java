package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;
import com.techStack.accessSys.exception.validation.ValidationException;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.condition.ConditionPredicate;
import com.techStack.accessSys.models.authorization.condition.MalformedPredicate;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Write-path gate for permission definitions. The evaluation path tolerates bad
 * data by never satisfying it; this rejects it before it is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionDefinitionValidator {

    private final PermissionCompiler compiler;

    /**
     * @return the compiled record when the definition is acceptable
     * @throws com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException
     *         unless exactly one of resourceId / resourcePath is set
     * @throws MalformedConditionException for the first condition that cannot be parsed
     * @throws ValidationException for missing type or actions, or any unknown field level,
     *         including one inside a list
     */
    public PermissionRecord validate(PermissionDefinition definition) {
        if (definition == null) {
            throw new ValidationException("permission", "Permission definition is required");
        }
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new ValidationException("id", "Permission id is required");
        }
        if (definition.getResourceType() == null || definition.getResourceType().isBlank()) {
            throw new ValidationException("resourceType", "Resource type is required");
        }
        if (PermissionCompiler.normalizeActions(definition.getActions()).isEmpty()) {
            throw new ValidationException("actions", "At least one action is required");
        }
        for (Map.Entry<String, Object> entry : definition.getFieldPermissions().entrySet()) {
            List<Object> unknown = PermissionCompiler.unknownLevels(entry.getValue());
            if (!unknown.isEmpty()) {
                throw new ValidationException("fieldPermissions." + entry.getKey(),
                        "Unknown field level: " + (unknown.size() == 1 ? unknown.get(0) : unknown));
            }
        }

        PermissionRecord record = compiler.compile(definition);

        for (ConditionPredicate predicate : record.getConditions()) {
            if (predicate instanceof MalformedPredicate malformed) {
                throw new MalformedConditionException(malformed.attributePath(), malformed.reason());
            }
        }

        log.debug("✅ Permission definition {} is valid", definition.getId());
        return record;
    }
}
