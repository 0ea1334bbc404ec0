package com.gt.vocab.template;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.TemplateParameter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/rest/templates")
public class TemplateController {

    private final TemplateCatalogService templateCatalogService;

    public TemplateController(TemplateCatalogService templateCatalogService) {
        this.templateCatalogService = templateCatalogService;
    }

    @GetMapping(produces = "application/json")
    public List<TemplateDef> getTemplates(@RequestParam(value = "taskType") Optional<TaskType> taskType,
                                          @RequestParam(value = "startingLanguage", defaultValue = "English") Language startingLanguage,
                                          @RequestParam(value = "targetLanguage", defaultValue = "German") Language targetLanguage) {
        return templateCatalogService.getTemplates(taskType.orElse(null), startingLanguage, targetLanguage);
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public TemplateDef registerTemplate(@RequestBody RegisterTemplateRequest request) {
        return templateCatalogService.registerTemplate(new TemplateDef(
                0,
                request.taskType(),
                request.template(),
                request.description(),
                request.examples() == null ? List.of() : request.examples(),
                request.parameters() == null ? List.of() : request.parameters().stream()
                        .map(parameter -> new TemplateParameter(0, parameter.name(), parameter.description()))
                        .toList(),
                request.startingLanguage(),
                request.targetLanguage()));
    }

    private record RegisterTemplateRequest(TaskType taskType,
                                           String template,
                                           String description,
                                           List<String> examples,
                                           List<ParameterRequest> parameters,
                                           Language startingLanguage,
                                           Language targetLanguage) { }

    private record ParameterRequest(String name, String description) { }
}
