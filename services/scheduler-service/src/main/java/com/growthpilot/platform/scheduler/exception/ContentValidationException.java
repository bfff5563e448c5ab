package com.growthpilot.platform.scheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class ContentValidationException extends RuntimeException {

    public ContentValidationException(String message) {
        super(message);
    }
}
