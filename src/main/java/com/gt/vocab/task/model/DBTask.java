package com.gt.vocab.task.model;

import java.util.List;
import java.util.Map;

public record DBTask(long id,
                     long templateId,
                     String prompt,
                     String answer,
                     Map<String, Long> resourceIdByParameter,
                     List<Long> targetWordIds) { }
