package com.gt.vocab.model;

import java.util.Set;

public enum LessonStatus {
    CREATED,
    IN_PROGRESS,
    FINISHED;

    public boolean canTransitionTo(LessonStatus next) {
        return switch (this) {
            case CREATED -> Set.of(IN_PROGRESS, FINISHED).contains(next);
            case IN_PROGRESS -> Set.of(IN_PROGRESS, FINISHED).contains(next);
            case FINISHED -> false;
        };
    }
}
