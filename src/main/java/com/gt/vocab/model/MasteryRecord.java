package com.gt.vocab.model;

import java.time.Instant;

public record MasteryRecord(long userId, Word word, int score, Instant updateInstant) { }
