package com.gt.vocab.lesson.model;

import com.gt.vocab.model.Task;

// firstTask and order are null when nothing was due and the lesson was created finished
public record LessonStart(long lessonId, Task firstTask, Integer order) { }
