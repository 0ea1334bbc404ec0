package com.gt.vocab.task;

import com.gt.vocab.model.Resource;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.Word;
import com.gt.vocab.task.model.DBTask;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface TaskDao {

    long createTask(TemplateDef templateDef, String prompt, String answer, Map<String, Resource> resources, Collection<Word> targetWords);

    DBTask loadTask(long taskId);

    /**
     * Ids of stored tasks that target exactly the given word and use one of the given templates.
     *
     * @param doneByUser true for tasks the user has already answered, false for tasks the user has never answered
     */
    List<Long> findSingleWordTaskIds(long userId, long wordId, Collection<Long> templateIds, boolean doneByUser, int limit);
}
