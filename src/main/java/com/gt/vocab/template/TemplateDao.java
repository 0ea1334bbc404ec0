package com.gt.vocab.template;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;

import java.util.List;

public interface TemplateDao {

    List<TemplateDef> loadTemplates(TaskType taskType, Language startingLanguage, Language targetLanguage);

    TemplateDef loadTemplate(long templateId);

    boolean templateExists(String template);

    long createTemplate(TemplateDef templateDef);
}
