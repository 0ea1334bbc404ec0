package com.gt.vocab.lesson.model;

import com.gt.vocab.model.Task;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.Word;

import java.util.List;

// What a learner sees of a task; the answer stays on the server
public record ClientTask(long taskId, int order, TaskType taskType, String prompt, List<String> targetWords) {

    public static ClientTask from(Task task, int order) {
        return new ClientTask(task.id(), order, task.taskType(), task.prompt(), task.targetWords().stream().map(Word::word).toList());
    }
}
