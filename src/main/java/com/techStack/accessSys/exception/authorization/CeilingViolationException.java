package com.techStack.accessSys.exception.authorization;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A proposed ceiling names a capability or action its parent layer does not allow.
 */
@Getter
public class CeilingViolationException extends CustomException {

    private final String tenantId;
    private final String capability;
    private final String action;

    public CeilingViolationException(String tenantId, String capability, String action) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, buildMessage(tenantId, capability, action),
                "ceiling." + capability, ErrorCode.CEILING_VIOLATION.getCode());
        this.tenantId = tenantId;
        this.capability = capability;
        this.action = action;
    }

    private static String buildMessage(String tenantId, String capability, String action) {
        if (action == null) {
            return String.format("Ceiling for tenant %s includes capability %s which the parent layer does not allow",
                    tenantId, capability);
        }
        return String.format("Ceiling for tenant %s includes %s:%s which the parent layer does not allow",
                tenantId, capability, action);
    }
}
