package com.gt.vocab.evaluation;

import com.gt.vocab.model.Task;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.WordScore;
import com.gt.vocab.task.type.FourChoiceTaskStrategy;
import com.gt.vocab.task.type.TaskTypeStrategies;
import com.gt.vocab.task.type.TaskTypeStrategy;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class EvaluationEngineTests {

    @Test
    public void testEvaluate_FourChoice() {
        EvaluationEngine evaluationEngine = new EvaluationEngine(new TaskTypeStrategies(List.of(new FourChoiceTaskStrategy(2))));
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL, HAUS));

        assertEquals(List.of(new WordScore(APFEL, 10), new WordScore(HAUS, 10)), evaluationEngine.evaluate(task, "a"));
        assertEquals(List.of(new WordScore(APFEL, 2), new WordScore(HAUS, 2)), evaluationEngine.evaluate(task, "B"));
    }

    @Test
    public void testEvaluate_ClampsAndOrdersScores() {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL, HAUS));
        EvaluationEngine evaluationEngine = new EvaluationEngine(new TaskTypeStrategies(List.of(
                gradingStrategy(List.of(new WordScore(HAUS, -3), new WordScore(APFEL, 14))))));

        assertEquals(List.of(new WordScore(APFEL, 10), new WordScore(HAUS, 0)), evaluationEngine.evaluate(task, "A"));
    }

    @Test
    public void testEvaluate_MissingWordScore() {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL, HAUS));
        EvaluationEngine evaluationEngine = new EvaluationEngine(new TaskTypeStrategies(List.of(
                gradingStrategy(List.of(new WordScore(APFEL, 10))))));

        assertThrows(IllegalStateException.class, () -> evaluationEngine.evaluate(task, "A"));
    }

    @Test
    public void testEvaluate_DuplicateOrForeignWordScore() {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL));

        EvaluationEngine duplicate = new EvaluationEngine(new TaskTypeStrategies(List.of(
                gradingStrategy(List.of(new WordScore(APFEL, 10), new WordScore(APFEL, 5))))));
        EvaluationEngine foreign = new EvaluationEngine(new TaskTypeStrategies(List.of(
                gradingStrategy(List.of(new WordScore(APFEL, 10), new WordScore(GEHEN, 5))))));

        assertThrows(IllegalStateException.class, () -> duplicate.evaluate(task, "A"));
        assertThrows(IllegalStateException.class, () -> foreign.evaluate(task, "A"));
    }

    private static TaskTypeStrategy gradingStrategy(List<WordScore> scores) {
        TaskTypeStrategy strategy = mock(TaskTypeStrategy.class);
        when(strategy.taskType()).thenReturn(TaskType.FOUR_CHOICE);
        when(strategy.grade(any(), any())).thenReturn(scores);
        return strategy;
    }
}
