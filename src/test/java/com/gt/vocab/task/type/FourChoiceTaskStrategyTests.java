package com.gt.vocab.task.type;

import com.gt.vocab.model.Task;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.WordScore;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static com.gt.vocab.util.TestUtils.APFEL;
import static com.gt.vocab.util.TestUtils.HAUS;
import static org.junit.jupiter.api.Assertions.*;

public class FourChoiceTaskStrategyTests {

    private final FourChoiceTaskStrategy fourChoiceTaskStrategy = new FourChoiceTaskStrategy(2);

    @ParameterizedTest
    @ValueSource(strings = {"A", "a", " a ", "A\n"})
    public void testGrade_Correct(String answer) {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL));

        assertEquals(List.of(new WordScore(APFEL, 10)), fourChoiceTaskStrategy.grade(task, answer));
    }

    @ParameterizedTest
    @ValueSource(strings = {"B", "D", "E", "", "apfel", "AB"})
    public void testGrade_Wrong(String answer) {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL, HAUS));

        assertEquals(List.of(new WordScore(APFEL, 2), new WordScore(HAUS, 2)), fourChoiceTaskStrategy.grade(task, answer));
    }

    @Test
    public void testGrade_NullAnswer() {
        Task task = TestUtils.getFourChoiceTask(1, "C", List.of(APFEL));

        assertEquals(List.of(new WordScore(APFEL, 2)), fourChoiceTaskStrategy.grade(task, null));
    }

    @Test
    public void testGrade_PenaltyIsClamped() {
        Task task = TestUtils.getFourChoiceTask(1, "A", List.of(APFEL));

        assertEquals(List.of(new WordScore(APFEL, 0)), new FourChoiceTaskStrategy(-5).grade(task, "B"));
        assertEquals(List.of(new WordScore(APFEL, 10)), new FourChoiceTaskStrategy(15).grade(task, "B"));
    }

    @Test
    public void testBlueprint() {
        TemplateDef templateDef = TestUtils.getFourChoiceTemplate(1);

        TaskBlueprint blueprint = fourChoiceTaskStrategy.blueprint(templateDef, new Random(7));

        assertTrue(FourChoiceTaskStrategy.OPTIONS.contains(blueprint.fixedAnswer()));
        assertEquals(templateDef.parameterNames(), List.copyOf(blueprint.resourceSpecs().keySet()));
        for (String option : FourChoiceTaskStrategy.OPTIONS) {
            assertEquals(option.equals(blueprint.fixedAnswer()), blueprint.resourceSpecs().get(option).linksTargetWords());
        }
    }

    @Test
    public void testBlueprint_SameSeedSameAnswer() {
        TemplateDef templateDef = TestUtils.getFourChoiceTemplate(1);

        assertEquals(fourChoiceTaskStrategy.blueprint(templateDef, new Random(99)).fixedAnswer(),
                fourChoiceTaskStrategy.blueprint(templateDef, new Random(99)).fixedAnswer());
    }
}
