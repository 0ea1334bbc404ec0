package com.gt.vocab.model;

public record ScheduledWord(int sequenceNumber, Word word, boolean review) { }
