package com.gt.vocab.model;

import java.time.Instant;

public record Lesson(long id,
                     long userId,
                     LessonStatus status,
                     int currentSequenceNumber,
                     Long currentTaskId,
                     Instant createInstant,
                     Instant finishInstant) { }
