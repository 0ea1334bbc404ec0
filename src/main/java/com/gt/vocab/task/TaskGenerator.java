package com.gt.vocab.task;

import com.gt.vocab.exception.GenerationUnavailableException;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.external.CallOutcome;
import com.gt.vocab.external.ContentGenerator;
import com.gt.vocab.external.ExternalCallRunner;
import com.gt.vocab.model.*;
import com.gt.vocab.task.type.TaskBlueprint;
import com.gt.vocab.task.type.TaskTypeStrategies;
import com.gt.vocab.template.TemplateCatalogService;
import com.gt.vocab.template.TemplateString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.*;

/**
 * Turns target words and a template into a persisted {@link Task}. Generated text is cached by content
 * address, so the same request never reaches the {@link ContentGenerator} twice. A task, its new
 * resources and its links are written in one transaction only after every piece was generated.
 */
@Component
public class TaskGenerator {

    private static final Logger log = LoggerFactory.getLogger(TaskGenerator.class);

    static final String ANSWER_KEY = "answer";

    private final TemplateCatalogService templateCatalogService;
    private final TaskTypeStrategies taskTypeStrategies;
    private final ContentGenerator contentGenerator;
    private final ExternalCallRunner externalCallRunner;
    private final ResourceDao resourceDao;
    private final TaskDao taskDao;
    private final TransactionTemplate transactionTemplate;
    private final Duration generationTimeout;
    private final int maxAttempts;
    private final Random random;

    @Autowired
    public TaskGenerator(TemplateCatalogService templateCatalogService,
                         TaskTypeStrategies taskTypeStrategies,
                         ContentGenerator contentGenerator,
                         ExternalCallRunner externalCallRunner,
                         ResourceDao resourceDao,
                         TaskDao taskDao,
                         PlatformTransactionManager transactionManager,
                         @Value("${vocab.generation.timeoutMs:20000}") long generationTimeoutMs,
                         @Value("${vocab.generation.maxAttempts:2}") int maxAttempts,
                         @Value("${vocab.generation.seed:}") String seed) {
        this(templateCatalogService, taskTypeStrategies, contentGenerator, externalCallRunner, resourceDao, taskDao,
                transactionManager, Duration.ofMillis(generationTimeoutMs), maxAttempts,
                seed == null || seed.isBlank() ? new Random() : new Random(Long.parseLong(seed.trim())));
    }

    TaskGenerator(TemplateCatalogService templateCatalogService,
                  TaskTypeStrategies taskTypeStrategies,
                  ContentGenerator contentGenerator,
                  ExternalCallRunner externalCallRunner,
                  ResourceDao resourceDao,
                  TaskDao taskDao,
                  PlatformTransactionManager transactionManager,
                  Duration generationTimeout,
                  int maxAttempts,
                  Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Generation needs at least one attempt, got " + maxAttempts);
        }

        this.templateCatalogService = templateCatalogService;
        this.taskTypeStrategies = taskTypeStrategies;
        this.contentGenerator = contentGenerator;
        this.externalCallRunner = externalCallRunner;
        this.resourceDao = resourceDao;
        this.taskDao = taskDao;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.generationTimeout = generationTimeout;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * Single attempt with a template chosen at random among those matching the user's language pair.
     *
     * @param preferredTaskType null for any task type
     */
    public Task generate(LocalUser user, List<Word> targetWords, TaskType preferredTaskType) {
        List<TemplateDef> candidates = candidateTemplates(user, preferredTaskType);
        return generateFromTemplate(chooseTemplate(candidates), targetWords);
    }

    // Failed attempts move to another template of the same task type when one exists
    public Task generateWithRetry(LocalUser user, List<Word> targetWords, TaskType preferredTaskType) {
        List<TemplateDef> candidates = candidateTemplates(user, preferredTaskType);
        TemplateDef templateDef = chooseTemplate(candidates);

        GenerationUnavailableException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return generateFromTemplate(templateDef, targetWords);
            } catch (GenerationUnavailableException ex) {
                lastFailure = ex;
                log.warn("Generation attempt {} of {} with template {} failed: {}", attempt, maxAttempts, templateDef.id(), ex.getMessage());
                templateDef = alternateTemplate(candidates, templateDef);
            }
        }

        throw lastFailure;
    }

    public Task generateFromTemplate(TemplateDef templateDef, List<Word> targetWords) {
        if (targetWords.isEmpty()) {
            throw new IllegalArgumentException("Cannot generate a task without target words");
        }

        TaskBlueprint blueprint = taskTypeStrategies.get(templateDef.taskType()).blueprint(templateDef, random);

        Map<String, PendingResource> pendingResources = new LinkedHashMap<>();
        for (TemplateParameter parameter : templateDef.parameters()) {
            TaskBlueprint.ResourceSpec spec = blueprint.resourceSpecs().get(parameter.name());
            List<Word> resourceWords = spec.linksTargetWords() ? targetWords : List.of();

            pendingResources.put(parameter.name(), resolveResource(
                    templateDef,
                    parameter.name(),
                    spec.description(),
                    targetWords,
                    resourceWords));
        }

        Map<String, String> values = new HashMap<>();
        pendingResources.forEach((name, pending) -> values.put(name, pending.text()));

        String prompt;
        try {
            prompt = new TemplateString(templateDef.template()).render(values);
        } catch (IllegalArgumentException ex) {
            throw new GenerationUnavailableException("Template " + templateDef.id() + " could not be rendered", ex);
        }

        PendingResource answerResource = null;
        String answer = blueprint.fixedAnswer();
        if (answer == null) {
            answerResource = resolveResource(templateDef, ANSWER_KEY, blueprint.answerRequest() + "\n" + prompt, targetWords, targetWords);
            answer = answerResource.text();
        }

        List<Word> taskWords = taskTargetWords(pendingResources.values(), targetWords);
        if (taskWords.isEmpty()) {
            throw new GenerationUnavailableException("Template " + templateDef.id() + " produced a task without target words");
        }

        PendingResource pendingAnswer = answerResource;
        String taskAnswer = answer;
        return transactionTemplate.execute(status -> {
            Map<String, Resource> resources = new LinkedHashMap<>();
            pendingResources.forEach((name, pending) -> resources.put(name, store(pending)));
            if (pendingAnswer != null) {
                store(pendingAnswer);
            }

            long taskId = taskDao.createTask(templateDef, prompt, taskAnswer, resources, taskWords);
            log.debug("Created {} task {} from template {}", templateDef.taskType(), taskId, templateDef.id());

            return new Task(taskId, templateDef, resources, prompt, taskAnswer, taskWords);
        });
    }

    private List<TemplateDef> candidateTemplates(LocalUser user, TaskType preferredTaskType) {
        List<TemplateDef> candidates = templateCatalogService.getTemplates(preferredTaskType, user.sourceLanguage(), user.targetLanguage());

        if (candidates.isEmpty()) {
            throw new NotFoundException("No " + (preferredTaskType == null ? "" : preferredTaskType + " ") + "templates for "
                    + user.sourceLanguage().getDisplayName() + " to " + user.targetLanguage().getDisplayName());
        }

        return candidates;
    }

    private TemplateDef chooseTemplate(List<TemplateDef> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }

    private TemplateDef alternateTemplate(List<TemplateDef> candidates, TemplateDef failed) {
        List<TemplateDef> alternatives = candidates.stream()
                .filter(candidate -> candidate.taskType() == failed.taskType() && candidate.id() != failed.id())
                .toList();

        return alternatives.isEmpty() ? failed : chooseTemplate(alternatives);
    }

    private PendingResource resolveResource(TemplateDef templateDef,
                                            String parameterName,
                                            String description,
                                            List<Word> targetWords,
                                            List<Word> resourceWords) {
        String cacheKey = ResourceKeys.resourceKey(templateDef.id(), parameterName, description, targetWords);

        Resource cached = resourceDao.findByCacheKey(cacheKey);
        if (cached != null) {
            return new PendingResource(cached, cached.text(), cacheKey, cached.words());
        }

        return new PendingResource(null, synthesize(templateDef, parameterName, description, targetWords), cacheKey, resourceWords);
    }

    private String synthesize(TemplateDef templateDef, String parameterName, String description, List<Word> targetWords) {
        CallOutcome<String> outcome = externalCallRunner.call(
                "synthesize " + parameterName + " of template " + templateDef.id(),
                () -> contentGenerator.synthesize(templateDef.description(), description, targetWords, templateDef.examples()),
                generationTimeout);

        if (!outcome.isSuccess()) {
            throw new GenerationUnavailableException(
                    "Content for " + parameterName + " of template " + templateDef.id() + " unavailable: " + outcome.status(),
                    outcome.error());
        }

        String text = outcome.value();
        if (text == null || text.isBlank() || TemplateString.containsPlaceholder(text)) {
            throw new GenerationUnavailableException("Generated content for " + parameterName + " of template " + templateDef.id() + " is invalid");
        }

        return text.trim();
    }

    private Resource store(PendingResource pending) {
        if (pending.stored() != null) {
            return pending.stored();
        }

        return resourceDao.createResource(pending.text(), pending.cacheKey(), pending.words());
    }

    // Union of the resource words in the order of the requested target words
    private static List<Word> taskTargetWords(Collection<PendingResource> resources, List<Word> targetWords) {
        Set<Long> linkedWordIds = new HashSet<>();
        for (PendingResource resource : resources) {
            resource.words().forEach(word -> linkedWordIds.add(word.id()));
        }

        Map<Long, Word> ordered = new LinkedHashMap<>();
        for (Word word : targetWords) {
            if (linkedWordIds.contains(word.id())) {
                ordered.putIfAbsent(word.id(), word);
            }
        }

        return new ArrayList<>(ordered.values());
    }

    private record PendingResource(Resource stored, String text, String cacheKey, List<Word> words) { }
}
