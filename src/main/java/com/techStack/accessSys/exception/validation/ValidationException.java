package com.techStack.accessSys.exception.validation;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ValidationException extends CustomException {
    public ValidationException(String field, String message) {
        super(HttpStatus.BAD_REQUEST, message, field, ErrorCode.VALIDATION_ERROR.getCode());
    }
}
