package com.gt.vocab.model;

import java.util.List;

public record LessonSummary(long lessonId, List<WordScore> finalScores, double meanScore) { }
