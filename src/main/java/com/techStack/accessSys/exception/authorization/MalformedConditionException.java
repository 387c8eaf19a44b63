package com.techStack.accessSys.exception.authorization;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Unsupported operator or operand type in a condition entry.
 * On the evaluation path this only ever makes the permission unsatisfied.
 */
@Getter
public class MalformedConditionException extends CustomException {

    private final String attributePath;

    public MalformedConditionException(String attributePath, String reason) {
        super(HttpStatus.BAD_REQUEST, "Malformed condition on '" + attributePath + "': " + reason,
                "conditions." + attributePath, ErrorCode.MALFORMED_CONDITION.getCode());
        this.attributePath = attributePath;
    }
}
