package com.gt.vocab.lesson.model;

import com.gt.vocab.model.Lesson;
import com.gt.vocab.model.Task;

public record LessonView(Lesson lesson, Task currentTask, int plannedWords) { }
