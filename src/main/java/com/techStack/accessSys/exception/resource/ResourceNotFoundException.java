package com.techStack.accessSys.exception.resource;

import com.techStack.accessSys.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends CustomException {
    public ResourceNotFoundException(String kind, String id) {
        super(HttpStatus.NOT_FOUND, kind + " not found: " + id);
    }
}
