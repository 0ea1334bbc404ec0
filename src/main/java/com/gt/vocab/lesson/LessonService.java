package com.gt.vocab.lesson;

import com.gt.vocab.evaluation.EvaluationEngine;
import com.gt.vocab.exception.LessonInProgressException;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.exception.StaleSubmissionException;
import com.gt.vocab.lesson.model.*;
import com.gt.vocab.mastery.MasteryService;
import com.gt.vocab.model.*;
import com.gt.vocab.task.TaskProvider;
import com.gt.vocab.task.TaskService;
import com.gt.vocab.user.UserService;
import com.gt.vocab.word.WordCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

/**
 * Lesson lifecycle. A lesson has at most one outstanding task at a time, identified by its sequence
 * number and task id on the lesson row; every state change is a conditional update against that pair.
 */
@Component
public class LessonService {

    private static final Logger log = LoggerFactory.getLogger(LessonService.class);

    private final UserService userService;
    private final LessonScheduler lessonScheduler;
    private final TaskProvider taskProvider;
    private final TaskService taskService;
    private final EvaluationEngine evaluationEngine;
    private final MasteryService masteryService;
    private final WordCatalogService wordCatalogService;
    private final LessonDao lessonDao;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public LessonService(UserService userService,
                         LessonScheduler lessonScheduler,
                         TaskProvider taskProvider,
                         TaskService taskService,
                         EvaluationEngine evaluationEngine,
                         MasteryService masteryService,
                         WordCatalogService wordCatalogService,
                         LessonDao lessonDao,
                         PlatformTransactionManager transactionManager) {
        this.userService = userService;
        this.lessonScheduler = lessonScheduler;
        this.taskProvider = taskProvider;
        this.taskService = taskService;
        this.evaluationEngine = evaluationEngine;
        this.masteryService = masteryService;
        this.wordCatalogService = wordCatalogService;
        this.lessonDao = lessonDao;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public LessonStart startLesson(String username) {
        LocalUser user = userService.getUser(username);

        Lesson unfinished = lessonDao.loadUnfinishedLesson(user.id());
        if (unfinished != null) {
            throw new LessonInProgressException(unfinished.id());
        }

        List<ScheduledWord> plan = lessonScheduler.planLesson(user);
        if (plan.isEmpty()) {
            long lessonId = transactionTemplate.execute(status -> lessonDao.createLesson(user.id(), LessonStatus.FINISHED, 0, null));
            log.info("Nothing due for user {}, lesson {} created finished", username, lessonId);

            return new LessonStart(lessonId, null, null);
        }

        // Obtained before anything is written so a failure leaves no lesson behind
        ScheduledWord firstWord = plan.get(0);
        Task firstTask = taskProvider.provideTask(user, firstWord.word(), firstWord.review());

        long lessonId = transactionTemplate.execute(status -> {
            long createdId = lessonDao.createLesson(user.id(), LessonStatus.IN_PROGRESS, 1, firstTask.id());
            lessonDao.createSlots(createdId, plan);
            return createdId;
        });
        log.info("Started lesson {} for user {} with {} words", lessonId, username, plan.size());

        return new LessonStart(lessonId, firstTask, 1);
    }

    public SubmissionResult submitAnswer(String username, long lessonId, long taskId, int order, String answer) {
        LocalUser user = userService.getUser(username);
        Lesson lesson = loadOwnedLesson(user, lessonId);

        if (lesson.status() != LessonStatus.IN_PROGRESS
                || lesson.currentSequenceNumber() != order
                || lesson.currentTaskId() == null
                || lesson.currentTaskId() != taskId) {
            throw new StaleSubmissionException("Lesson " + lessonId + " is not waiting on task " + taskId + " at position " + order);
        }

        List<LessonSlot> slots = lessonDao.loadSlots(lessonId);
        LessonSlot slot = findSlot(slots, lessonId, order);

        Task task = taskService.loadTask(taskId);
        List<WordScore> scores = evaluationEngine.evaluate(task, answer);

        boolean lastSlot = order >= slots.size();
        LessonStatus nextStatus = lastSlot ? LessonStatus.FINISHED : LessonStatus.IN_PROGRESS;
        int nextSequenceNumber = lastSlot ? order : order + 1;

        transactionTemplate.executeWithoutResult(status -> {
            if (lessonDao.completeSlot(lessonId, order, taskId, nextSequenceNumber, nextStatus) != 1) {
                throw new StaleSubmissionException("Task " + taskId + " of lesson " + lessonId + " was already answered");
            }

            masteryService.recordScores(user, scores);
            long historyEntryId = lessonDao.createHistoryEntry(slot.evaluationId(), taskId, answer);
            lessonDao.createEntryScores(historyEntryId, scores);
        });

        if (lastSlot) {
            log.info("Lesson {} of user {} finished after {} words", lessonId, username, slots.size());
            return new SubmissionResult(scores, null, null, summarize(lessonId));
        }

        Task nextTask = generateOutstandingTask(user, lessonId, findSlot(slots, lessonId, nextSequenceNumber));
        return new SubmissionResult(scores, nextTask, nextSequenceNumber, null);
    }

    // Remaining slots are left unscored; finishing twice returns the same summary
    public LessonSummary finishLesson(String username, long lessonId) {
        LocalUser user = userService.getUser(username);
        loadOwnedLesson(user, lessonId);

        if (lessonDao.finishLesson(lessonId) > 0) {
            log.info("Lesson {} of user {} finished early", lessonId, username);
        }

        return summarize(lessonId);
    }

    /**
     * Current state of a lesson. An in-progress lesson whose next task could not be generated earlier
     * gets it generated now.
     */
    public LessonView getLesson(String username, long lessonId) {
        LocalUser user = userService.getUser(username);
        Lesson lesson = loadOwnedLesson(user, lessonId);
        List<LessonSlot> slots = lessonDao.loadSlots(lessonId);

        if (lesson.status() != LessonStatus.IN_PROGRESS) {
            return new LessonView(lesson, null, slots.size());
        }

        Task currentTask = lesson.currentTaskId() != null
                ? taskService.loadTask(lesson.currentTaskId())
                : generateOutstandingTask(user, lessonId, findSlot(slots, lessonId, lesson.currentSequenceNumber()));

        return new LessonView(lessonDao.loadLesson(lessonId), currentTask, slots.size());
    }

    LessonSummary summarize(long lessonId) {
        Map<Long, Integer> latestScoreByWord = new LinkedHashMap<>();
        for (EntryScore entryScore : lessonDao.loadEntryScores(lessonId)) {
            latestScoreByWord.put(entryScore.wordId(), entryScore.score());
        }

        List<Word> words = wordCatalogService.loadWords(new ArrayList<>(latestScoreByWord.keySet()));
        List<WordScore> finalScores = words.stream()
                .map(word -> new WordScore(word, latestScoreByWord.get(word.id())))
                .toList();

        double meanScore = finalScores.stream().mapToInt(WordScore::score).average().orElse(0.0);

        return new LessonSummary(lessonId, finalScores, meanScore);
    }

    private Task generateOutstandingTask(LocalUser user, long lessonId, LessonSlot slot) {
        Word word = wordCatalogService.loadWords(List.of(slot.wordId())).get(0);
        Task task = taskProvider.provideTask(user, word, slot.review());

        if (lessonDao.setCurrentTask(lessonId, slot.sequenceNumber(), task.id()) == 1) {
            return task;
        }

        // A concurrent request filled the slot first
        Lesson lesson = lessonDao.loadLesson(lessonId);
        if (lesson == null || lesson.status() != LessonStatus.IN_PROGRESS || lesson.currentTaskId() == null) {
            throw new StaleSubmissionException("Lesson " + lessonId + " moved on while generating position " + slot.sequenceNumber());
        }

        return taskService.loadTask(lesson.currentTaskId());
    }

    private Lesson loadOwnedLesson(LocalUser user, long lessonId) {
        Lesson lesson = lessonDao.loadLesson(lessonId);

        // Lessons of other users are reported as missing
        if (lesson == null || lesson.userId() != user.id()) {
            throw new NotFoundException("Lesson " + lessonId + " does not exist for user " + user.username());
        }

        return lesson;
    }

    private static LessonSlot findSlot(List<LessonSlot> slots, long lessonId, int sequenceNumber) {
        return slots.stream()
                .filter(slot -> slot.sequenceNumber() == sequenceNumber)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Lesson " + lessonId + " has no slot " + sequenceNumber));
    }
}
