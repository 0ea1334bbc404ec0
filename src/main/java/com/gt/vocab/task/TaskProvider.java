package com.gt.vocab.task;

import com.gt.vocab.model.LocalUser;
import com.gt.vocab.model.Task;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.Word;
import com.gt.vocab.template.TemplateCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Supplies the task for one lesson word. A stored task targeting only that word is reused when one fits
 * the user's history: a review word gets a task the user has answered before, a new word gets one the
 * user has never seen. Generation is the fallback.
 */
@Component
public class TaskProvider {

    private static final Logger log = LoggerFactory.getLogger(TaskProvider.class);

    private final TemplateCatalogService templateCatalogService;
    private final TaskDao taskDao;
    private final TaskService taskService;
    private final TaskGenerator taskGenerator;
    private final boolean reuseEnabled;
    private final int reuseCandidates;
    private final Random random;

    @Autowired
    public TaskProvider(TemplateCatalogService templateCatalogService,
                        TaskDao taskDao,
                        TaskService taskService,
                        TaskGenerator taskGenerator,
                        @Value("${vocab.tasks.reuse:true}") boolean reuseEnabled,
                        @Value("${vocab.tasks.reuseCandidates:10}") int reuseCandidates,
                        @Value("${vocab.generation.seed:}") String seed) {
        this(templateCatalogService, taskDao, taskService, taskGenerator, reuseEnabled, reuseCandidates,
                seed == null || seed.isBlank() ? new Random() : new Random(Long.parseLong(seed.trim())));
    }

    TaskProvider(TemplateCatalogService templateCatalogService,
                 TaskDao taskDao,
                 TaskService taskService,
                 TaskGenerator taskGenerator,
                 boolean reuseEnabled,
                 int reuseCandidates,
                 Random random) {
        if (reuseCandidates < 1) {
            throw new IllegalArgumentException("Task reuse needs at least one candidate, got " + reuseCandidates);
        }

        this.templateCatalogService = templateCatalogService;
        this.taskDao = taskDao;
        this.taskService = taskService;
        this.taskGenerator = taskGenerator;
        this.reuseEnabled = reuseEnabled;
        this.reuseCandidates = reuseCandidates;
        this.random = random;
    }

    public Task provideTask(LocalUser user, Word word, boolean review) {
        if (reuseEnabled) {
            List<Long> templateIds = templateCatalogService.getTemplates(null, user.sourceLanguage(), user.targetLanguage())
                    .stream()
                    .map(TemplateDef::id)
                    .toList();

            List<Long> candidates = taskDao.findSingleWordTaskIds(user.id(), word.id(), templateIds, review, reuseCandidates);
            if (!candidates.isEmpty()) {
                long taskId = candidates.get(random.nextInt(candidates.size()));
                log.debug("Reusing task {} for word {} of user {}", taskId, word.id(), user.username());

                return taskService.loadTask(taskId);
            }
        }

        return taskGenerator.generateWithRetry(user, List.of(word), null);
    }
}
