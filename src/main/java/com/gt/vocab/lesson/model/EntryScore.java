package com.gt.vocab.lesson.model;

public record EntryScore(int sequenceNumber, long wordId, int score) { }
