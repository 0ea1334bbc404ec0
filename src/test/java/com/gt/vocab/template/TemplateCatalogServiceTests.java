package com.gt.vocab.template;

import com.gt.vocab.exception.InvalidTemplateException;
import com.gt.vocab.external.AnswerJudge;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.TemplateParameter;
import com.gt.vocab.task.type.FourChoiceTaskStrategy;
import com.gt.vocab.task.type.OneWayTranslationTaskStrategy;
import com.gt.vocab.task.type.TaskTypeStrategies;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class TemplateCatalogServiceTests {

    @Mock private TemplateDao templateDao;
    @Mock private PlatformTransactionManager transactionManager;
    @Mock private ObjectProvider<AnswerJudge> answerJudgeProvider;

    private TemplateCatalogService templateCatalogService;

    @BeforeEach
    public void setup() {
        TaskTypeStrategies taskTypeStrategies = new TaskTypeStrategies(List.of(
                new FourChoiceTaskStrategy(2),
                new OneWayTranslationTaskStrategy(answerJudgeProvider, null, 1000)));

        templateCatalogService = new TemplateCatalogService(templateDao, taskTypeStrategies, transactionManager);
    }

    @Test
    public void testRegisterTemplate() {
        TemplateDef templateDef = TestUtils.getFourChoiceTemplate(0);
        when(templateDao.templateExists(templateDef.template())).thenReturn(false);
        when(templateDao.createTemplate(templateDef)).thenReturn(42L);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());

        TemplateDef registered = templateCatalogService.registerTemplate(templateDef);

        assertEquals(42L, registered.id());
        assertEquals(templateDef.parameters(), registered.parameters());
        verify(transactionManager).commit(any());
    }

    @Test
    public void testRegisterTemplate_Duplicate() {
        TemplateDef templateDef = TestUtils.getTranslationTemplate(0);
        when(templateDao.templateExists(templateDef.template())).thenReturn(true);

        assertThrows(InvalidTemplateException.class, () -> templateCatalogService.registerTemplate(templateDef));
        verify(templateDao, never()).createTemplate(any());
    }

    @Test
    public void testValidateTemplate_PlaceholderWithoutParameter() {
        TemplateDef base = TestUtils.getTranslationTemplate(0);
        TemplateDef templateDef = new TemplateDef(0, base.taskType(), "Translate: ${sentence} ${hint}", base.description(),
                base.examples(), base.parameters(), base.startingLanguage(), base.targetLanguage());

        assertThrows(InvalidTemplateException.class, () -> templateCatalogService.validateTemplate(templateDef));
    }

    @Test
    public void testValidateTemplate_ParameterWithoutPlaceholder() {
        TemplateDef base = TestUtils.getTranslationTemplate(0);
        TemplateDef templateDef = new TemplateDef(0, base.taskType(), base.template(), base.description(), base.examples(),
                List.of(base.parameters().get(0), new TemplateParameter(0, "hint", "A hint")),
                base.startingLanguage(), base.targetLanguage());

        assertThrows(InvalidTemplateException.class, () -> templateCatalogService.validateTemplate(templateDef));
    }

    @Test
    public void testValidateTemplate_FourChoiceWithoutOptions() {
        TemplateDef templateDef = new TemplateDef(0,
                TaskType.FOUR_CHOICE,
                "Pick one: ${A} ${B}",
                "Two options only",
                List.of("Pick one: Haus Maus"),
                List.of(new TemplateParameter(0, "A", "First option"), new TemplateParameter(0, "B", "Second option")),
                Language.English,
                Language.German);

        assertThrows(InvalidTemplateException.class, () -> templateCatalogService.validateTemplate(templateDef));
    }

    @Test
    public void testValidateTemplate_NoExamples() {
        TemplateDef base = TestUtils.getTranslationTemplate(0);
        TemplateDef templateDef = new TemplateDef(0, base.taskType(), base.template(), base.description(), List.of(),
                base.parameters(), base.startingLanguage(), base.targetLanguage());

        assertThrows(InvalidTemplateException.class, () -> templateCatalogService.validateTemplate(templateDef));
    }

    @Test
    public void testLoadTemplate_Missing() {
        when(templateDao.loadTemplate(7)).thenReturn(null);

        assertThrows(NotFoundException.class, () -> templateCatalogService.loadTemplate(7));
    }
}
