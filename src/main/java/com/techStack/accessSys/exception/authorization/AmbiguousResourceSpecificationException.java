package com.techStack.accessSys.exception.authorization;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class AmbiguousResourceSpecificationException extends CustomException {
    public AmbiguousResourceSpecificationException(String permissionId) {
        super(HttpStatus.BAD_REQUEST,
                "Permission " + permissionId + " must set exactly one of resourceId or resourcePath",
                "resourceId", ErrorCode.AMBIGUOUS_RESOURCE_SPECIFICATION.getCode());
    }
}
