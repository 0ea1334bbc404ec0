package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.CONFLICT)
public class LessonInProgressException extends RuntimeException {

    private final long lessonId;

    public LessonInProgressException(long lessonId) {
        super("Lesson " + lessonId + " is still in progress");
        this.lessonId = lessonId;
    }

    public long getLessonId() {
        return lessonId;
    }
}
