package com.gt.vocab.task.type;

import com.gt.vocab.exception.InvalidTemplateException;
import com.gt.vocab.mastery.MasteryScores;
import com.gt.vocab.model.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Multiple choice between the option parameters {@code A} to {@code D}. One option, chosen at generation
 * time, is written with the target words; the others are distractors. The answer is the option's name.
 */
@Component
public class FourChoiceTaskStrategy implements TaskTypeStrategy {

    public static final List<String> OPTIONS = List.of("A", "B", "C", "D");

    private static final String CORRECT_OPTION_SUFFIX = " This option is the correct answer and must use the target words.";
    private static final String DISTRACTOR_SUFFIX = " This option is a plausible but wrong answer and must not use the target words.";

    private final int wrongAnswerScore;

    @Autowired
    public FourChoiceTaskStrategy(@Value("${vocab.evaluation.fourChoicePenalty:2}") int wrongAnswerScore) {
        this.wrongAnswerScore = MasteryScores.clamp(wrongAnswerScore);
    }

    @Override
    public TaskType taskType() {
        return TaskType.FOUR_CHOICE;
    }

    @Override
    public void validateTemplate(TemplateDef templateDef) {
        if (!new HashSet<>(templateDef.parameterNames()).containsAll(OPTIONS)) {
            throw new InvalidTemplateException("Four choice template must declare parameters " + OPTIONS);
        }
    }

    @Override
    public TaskBlueprint blueprint(TemplateDef templateDef, Random random) {
        String correctOption = OPTIONS.get(random.nextInt(OPTIONS.size()));

        Map<String, TaskBlueprint.ResourceSpec> resourceSpecs = new LinkedHashMap<>();
        for (TemplateParameter parameter : templateDef.parameters()) {
            if (parameter.name().equals(correctOption)) {
                resourceSpecs.put(parameter.name(), new TaskBlueprint.ResourceSpec(parameter.description() + CORRECT_OPTION_SUFFIX, true));
            } else if (OPTIONS.contains(parameter.name())) {
                resourceSpecs.put(parameter.name(), new TaskBlueprint.ResourceSpec(parameter.description() + DISTRACTOR_SUFFIX, false));
            } else {
                resourceSpecs.put(parameter.name(), new TaskBlueprint.ResourceSpec(parameter.description(), true));
            }
        }

        return new TaskBlueprint(resourceSpecs, correctOption, null);
    }

    @Override
    public List<WordScore> grade(Task task, String submittedAnswer) {
        boolean correct = submittedAnswer != null && submittedAnswer.trim().equalsIgnoreCase(task.answer());
        int score = correct ? MasteryScores.MAX_SCORE : wrongAnswerScore;

        return task.targetWords().stream()
                .map(word -> new WordScore(word, score))
                .toList();
    }
}
