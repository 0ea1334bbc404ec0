package com.gt.vocab.task.type;

import com.gt.vocab.model.Task;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.WordScore;

import java.util.List;
import java.util.Random;

/**
 * Generation and grading rules of one {@link TaskType}. Adding a task type means adding a strategy bean;
 * the generator and the evaluation engine dispatch on {@link #taskType()}.
 */
public interface TaskTypeStrategy {

    TaskType taskType();

    /**
     * @throws com.gt.vocab.exception.InvalidTemplateException when the template cannot produce tasks of this type
     */
    void validateTemplate(TemplateDef templateDef);

    TaskBlueprint blueprint(TemplateDef templateDef, Random random);

    /**
     * @return exactly one score per target word of the task
     */
    List<WordScore> grade(Task task, String submittedAnswer);
}
