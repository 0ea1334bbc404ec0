package com.gt.vocab.template;

import com.gt.vocab.conf.CachingConfig;
import com.gt.vocab.exception.InvalidTemplateException;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.TemplateParameter;
import com.gt.vocab.task.type.TaskTypeStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

@Component
public class TemplateCatalogService {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalogService.class);

    private final TemplateDao templateDao;
    private final TaskTypeStrategies taskTypeStrategies;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public TemplateCatalogService(TemplateDao templateDao, TaskTypeStrategies taskTypeStrategies, PlatformTransactionManager transactionManager) {
        this.templateDao = templateDao;
        this.taskTypeStrategies = taskTypeStrategies;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // A null task type matches templates of every type
    @Cacheable(CachingConfig.TEMPLATES)
    public List<TemplateDef> getTemplates(TaskType taskType, Language startingLanguage, Language targetLanguage) {
        return templateDao.loadTemplates(taskType, startingLanguage, targetLanguage);
    }

    public TemplateDef loadTemplate(long templateId) {
        TemplateDef templateDef = templateDao.loadTemplate(templateId);

        if (templateDef == null) {
            throw new NotFoundException("Template " + templateId + " does not exist");
        }

        return templateDef;
    }

    @CacheEvict(value = CachingConfig.TEMPLATES, allEntries = true)
    public TemplateDef registerTemplate(TemplateDef templateDef) {
        validateTemplate(templateDef);

        if (templateDao.templateExists(templateDef.template())) {
            throw new InvalidTemplateException("Template already exists: " + templateDef.template());
        }

        // Template row and its parameters are written together
        long templateId = transactionTemplate.execute(status -> templateDao.createTemplate(templateDef));
        log.info("Registered {} template {}", templateDef.taskType(), templateId);

        return templateDef.withId(templateId);
    }

    void validateTemplate(TemplateDef templateDef) {
        if (templateDef.template() == null || templateDef.template().isBlank()) {
            throw new InvalidTemplateException("Template string is empty");
        }
        if (templateDef.description() == null || templateDef.description().isBlank()) {
            throw new InvalidTemplateException("Template description is empty");
        }
        if (templateDef.examples().isEmpty() || templateDef.examples().stream().anyMatch(example -> example == null || example.isBlank())) {
            throw new InvalidTemplateException("Template needs at least one non-empty example");
        }
        if (templateDef.startingLanguage() == null || templateDef.targetLanguage() == null || templateDef.startingLanguage() == templateDef.targetLanguage()) {
            throw new InvalidTemplateException("Template needs two different languages");
        }

        List<String> parameterNames = templateDef.parameterNames();
        if (parameterNames.isEmpty()) {
            throw new InvalidTemplateException("Template declares no parameters");
        }
        if (new HashSet<>(parameterNames).size() != parameterNames.size()) {
            throw new InvalidTemplateException("Template declares duplicate parameters: " + parameterNames);
        }
        for (TemplateParameter parameter : templateDef.parameters()) {
            if (parameter.description() == null || parameter.description().isBlank()) {
                throw new InvalidTemplateException("Parameter " + parameter.name() + " has no description");
            }
        }

        Set<String> placeholders = new TemplateString(templateDef.template()).getPlaceholders();
        if (!placeholders.equals(new HashSet<>(parameterNames))) {
            throw new InvalidTemplateException("Template placeholders " + placeholders + " do not match parameters " + parameterNames);
        }

        taskTypeStrategies.get(templateDef.taskType()).validateTemplate(templateDef);
    }
}
