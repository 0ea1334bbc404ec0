package com.gt.vocab.lesson.model;

public record LessonSlot(long evaluationId, int sequenceNumber, long wordId, boolean review) { }
