package com.gt.vocab.lesson.model;

import com.gt.vocab.model.LessonSummary;
import com.gt.vocab.model.Task;
import com.gt.vocab.model.WordScore;

import java.util.List;

/**
 * Either the next task of the lesson or, after the last slot, the final summary.
 */
public record SubmissionResult(List<WordScore> scores, Task nextTask, Integer nextOrder, LessonSummary summary) { }
