package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidTemplateException extends RuntimeException {

    public InvalidTemplateException(String msg) {
        super(msg);
    }
}
