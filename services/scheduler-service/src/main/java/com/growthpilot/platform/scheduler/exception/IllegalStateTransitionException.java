package com.growthpilot.platform.scheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** A requested status change is not allowed from the entity's current status. */
@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalStateTransitionException extends RuntimeException {

    public IllegalStateTransitionException(String message) {
        super(message);
    }

    public IllegalStateTransitionException(String entityType, Object id, Object from, Object to) {
        super(String.format("%s %s cannot transition from %s to %s", entityType, id, from, to));
    }
}
