package com.gt.vocab.task.type;

import com.gt.vocab.model.TaskType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class TaskTypeStrategies {

    private final Map<TaskType, TaskTypeStrategy> strategies = new EnumMap<>(TaskType.class);

    @Autowired
    public TaskTypeStrategies(List<TaskTypeStrategy> taskTypeStrategies) {
        for (TaskTypeStrategy strategy : taskTypeStrategies) {
            if (strategies.put(strategy.taskType(), strategy) != null) {
                throw new IllegalStateException("Duplicate strategy for task type " + strategy.taskType());
            }
        }
    }

    public TaskTypeStrategy get(TaskType taskType) {
        TaskTypeStrategy strategy = strategies.get(taskType);

        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for task type " + taskType);
        }

        return strategy;
    }
}
