package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Surfaced to clients as "lesson temporarily unavailable"
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE, reason = "Lesson temporarily unavailable")
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String msg) {
        super(msg);
    }

    public GenerationUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
