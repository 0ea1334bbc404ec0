package com.gt.vocab.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Task(long id,
                   TemplateDef template,
                   Map<String, Resource> resources,
                   String prompt,
                   String answer,
                   List<Word> targetWords) {

    public Task {
        if (!new HashSet<>(template.parameterNames()).equals(resources.keySet())) {
            throw new IllegalArgumentException("Resources " + resources.keySet() + " do not match the parameters of template " + template.id());
        }
        if (targetWords.isEmpty()) {
            throw new IllegalArgumentException("Task must target at least one word");
        }

        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        targetWords = List.copyOf(targetWords);
    }

    public TaskType taskType() {
        return template.taskType();
    }
}
