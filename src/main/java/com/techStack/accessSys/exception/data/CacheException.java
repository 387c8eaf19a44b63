package com.techStack.accessSys.exception.data;

import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Cache exception
 */
public class CacheException extends CustomException {
    public CacheException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause, null, ErrorCode.CACHE_ERROR.getCode());
    }
}
