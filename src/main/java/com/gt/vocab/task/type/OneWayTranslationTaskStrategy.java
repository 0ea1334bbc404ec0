package com.gt.vocab.task.type;

import com.gt.vocab.evaluation.AnswerNormalizer;
import com.gt.vocab.exception.EvaluationUnavailableException;
import com.gt.vocab.external.AnswerJudge;
import com.gt.vocab.external.CallOutcome;
import com.gt.vocab.external.ExternalCallRunner;
import com.gt.vocab.mastery.MasteryScores;
import com.gt.vocab.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * The learner translates the prompt, written in the template's target language, into its starting language.
 * The reference translation is synthesized once per prompt when the task is generated.
 */
@Component
public class OneWayTranslationTaskStrategy implements TaskTypeStrategy {

    private static final Logger log = LoggerFactory.getLogger(OneWayTranslationTaskStrategy.class);

    private final AnswerJudge answerJudge;
    private final ExternalCallRunner externalCallRunner;
    private final Duration judgeTimeout;

    @Autowired
    public OneWayTranslationTaskStrategy(ObjectProvider<AnswerJudge> answerJudge,
                                         ExternalCallRunner externalCallRunner,
                                         @Value("${vocab.evaluation.judgeTimeoutMs:10000}") long judgeTimeoutMs) {
        this(answerJudge.getIfAvailable(), externalCallRunner, Duration.ofMillis(judgeTimeoutMs));
    }

    // answerJudge may be null, grading then uses exact comparison only
    OneWayTranslationTaskStrategy(AnswerJudge answerJudge, ExternalCallRunner externalCallRunner, Duration judgeTimeout) {
        this.answerJudge = answerJudge;
        this.externalCallRunner = externalCallRunner;
        this.judgeTimeout = judgeTimeout;
    }

    @Override
    public TaskType taskType() {
        return TaskType.ONE_WAY_TRANSLATION;
    }

    @Override
    public void validateTemplate(TemplateDef templateDef) {
        // any parameter set works; every resource carries the target words
    }

    @Override
    public TaskBlueprint blueprint(TemplateDef templateDef, Random random) {
        Map<String, TaskBlueprint.ResourceSpec> resourceSpecs = new LinkedHashMap<>();
        for (TemplateParameter parameter : templateDef.parameters()) {
            resourceSpecs.put(parameter.name(), new TaskBlueprint.ResourceSpec(
                    parameter.description() + " Write it in " + templateDef.targetLanguage().getDisplayName() + " using the target words.",
                    true));
        }

        String answerRequest = "The correct " + templateDef.startingLanguage().getDisplayName()
                + " translation of the " + templateDef.targetLanguage().getDisplayName()
                + " text in this exercise. Reply with the translation only. Exercise:";

        return new TaskBlueprint(resourceSpecs, null, answerRequest);
    }

    @Override
    public List<WordScore> grade(Task task, String submittedAnswer) {
        int score = judgeScore(task, submittedAnswer);

        return task.targetWords().stream()
                .map(word -> new WordScore(word, score))
                .toList();
    }

    private int judgeScore(Task task, String submittedAnswer) {
        boolean hasAnswer = task.answer() != null && !task.answer().isBlank();

        if (answerJudge != null && hasAnswer) {
            CallOutcome<Integer> outcome = externalCallRunner.call(
                    "judge task " + task.id(),
                    () -> answerJudge.judge(task.answer(), submittedAnswer == null ? "" : submittedAnswer, task.prompt()),
                    judgeTimeout);

            if (outcome.isSuccess() && outcome.value() != null) {
                return MasteryScores.clamp(outcome.value());
            }
            log.warn("Answer judge {} for task {}, falling back to exact comparison", outcome.status(), task.id());
        }

        if (!hasAnswer) {
            throw new EvaluationUnavailableException("Task " + task.id() + " has no reference translation to grade against");
        }

        return AnswerNormalizer.matches(task.answer(), submittedAnswer) ? MasteryScores.MAX_SCORE : MasteryScores.MIN_SCORE;
    }
}
