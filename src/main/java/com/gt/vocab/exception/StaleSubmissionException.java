package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when an answer is submitted for a task that is not the lesson's outstanding task
@ResponseStatus(value = HttpStatus.CONFLICT)
public class StaleSubmissionException extends RuntimeException {

    public StaleSubmissionException(String msg) {
        super(msg);
    }
}
