package com.gt.vocab.task.type;

import java.util.Collections;
import java.util.Map;

/**
 * What a task type needs generated for one task.
 *
 * @param resourceSpecs one spec per template parameter
 * @param fixedAnswer the correct answer when the type decides it up front, otherwise null
 * @param answerRequest instruction for synthesizing the answer from the rendered prompt; used only when
 *                      {@code fixedAnswer} is null
 */
public record TaskBlueprint(Map<String, ResourceSpec> resourceSpecs, String fixedAnswer, String answerRequest) {

    public TaskBlueprint {
        resourceSpecs = Collections.unmodifiableMap(resourceSpecs);
    }

    /**
     * @param description what the generator is asked to write for the parameter
     * @param linksTargetWords whether the resource exercises the task's target words
     */
    public record ResourceSpec(String description, boolean linksTargetWords) { }
}
