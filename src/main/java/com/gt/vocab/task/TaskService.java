package com.gt.vocab.task;

import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Resource;
import com.gt.vocab.model.Task;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.task.model.DBTask;
import com.gt.vocab.template.TemplateCatalogService;
import com.gt.vocab.word.WordCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskDao taskDao;
    private final ResourceDao resourceDao;
    private final TemplateCatalogService templateCatalogService;
    private final WordCatalogService wordCatalogService;

    @Autowired
    public TaskService(TaskDao taskDao,
                       ResourceDao resourceDao,
                       TemplateCatalogService templateCatalogService,
                       WordCatalogService wordCatalogService) {
        this.taskDao = taskDao;
        this.resourceDao = resourceDao;
        this.templateCatalogService = templateCatalogService;
        this.wordCatalogService = wordCatalogService;
    }

    public Task loadTask(long taskId) {
        DBTask dbTask = taskDao.loadTask(taskId);
        if (dbTask == null) {
            throw new NotFoundException("Task " + taskId + " does not exist");
        }

        TemplateDef templateDef = templateCatalogService.loadTemplate(dbTask.templateId());
        Map<Long, Resource> resourcesById = resourceDao.loadResources(dbTask.resourceIdByParameter().values())
                .stream()
                .collect(Collectors.toMap(Resource::id, Function.identity()));

        Map<String, Resource> resources = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : dbTask.resourceIdByParameter().entrySet()) {
            Resource resource = resourcesById.get(entry.getValue());
            if (resource == null) {
                log.error("Task {} references missing resource {}", taskId, entry.getValue());
                throw new NotFoundException("Resource " + entry.getValue() + " of task " + taskId + " does not exist");
            }
            resources.put(entry.getKey(), resource);
        }

        return new Task(dbTask.id(),
                templateDef,
                resources,
                dbTask.prompt(),
                dbTask.answer(),
                wordCatalogService.loadWords(dbTask.targetWordIds()));
    }
}
