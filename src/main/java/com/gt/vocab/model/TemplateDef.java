package com.gt.vocab.model;

import java.util.Collections;
import java.util.List;

public record TemplateDef(long id,
                          TaskType taskType,
                          String template,
                          String description,
                          List<String> examples,
                          List<TemplateParameter> parameters,
                          Language startingLanguage,
                          Language targetLanguage) {

    public TemplateDef {
        examples = Collections.unmodifiableList(examples);
        parameters = Collections.unmodifiableList(parameters);
    }

    public List<String> parameterNames() {
        return parameters.stream().map(TemplateParameter::name).toList();
    }

    public TemplateDef withId(long newId) {
        return new TemplateDef(newId, taskType, template, description, examples, parameters, startingLanguage, targetLanguage);
    }
}
