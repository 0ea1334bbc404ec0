package com.gt.vocab.evaluation;

import com.gt.vocab.mastery.MasteryScores;
import com.gt.vocab.model.Task;
import com.gt.vocab.model.Word;
import com.gt.vocab.model.WordScore;
import com.gt.vocab.task.type.TaskTypeStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Grades a submitted answer with the rules of the task's type. The result always holds exactly one
 * score in [0, 10] per target word of the task, in target word order.
 */
@Component
public class EvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(EvaluationEngine.class);

    private final TaskTypeStrategies taskTypeStrategies;

    @Autowired
    public EvaluationEngine(TaskTypeStrategies taskTypeStrategies) {
        this.taskTypeStrategies = taskTypeStrategies;
    }

    public List<WordScore> evaluate(Task task, String submittedAnswer) {
        List<WordScore> graded = taskTypeStrategies.get(task.taskType()).grade(task, submittedAnswer);

        Map<Long, Integer> scoreByWord = new HashMap<>();
        for (WordScore wordScore : graded) {
            if (scoreByWord.put(wordScore.wordId(), wordScore.score()) != null) {
                throw new IllegalStateException("Task " + task.id() + " graded word " + wordScore.word().word() + " twice");
            }
        }

        List<WordScore> scores = new ArrayList<>();
        for (Word word : task.targetWords()) {
            Integer score = scoreByWord.remove(word.id());
            if (score == null) {
                throw new IllegalStateException("Task " + task.id() + " has no score for target word " + word.word());
            }
            scores.add(new WordScore(word, MasteryScores.clamp(score)));
        }

        if (!scoreByWord.isEmpty()) {
            throw new IllegalStateException("Task " + task.id() + " scored words it does not target: " + scoreByWord.keySet());
        }

        log.debug("Task {} graded {}", task.id(), scores);
        return scores;
    }
}
