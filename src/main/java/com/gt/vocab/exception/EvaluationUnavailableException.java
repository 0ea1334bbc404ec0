package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class EvaluationUnavailableException extends RuntimeException {

    public EvaluationUnavailableException(String msg) {
        super(msg);
    }
}
