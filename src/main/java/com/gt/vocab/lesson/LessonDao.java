package com.gt.vocab.lesson;

import com.gt.vocab.lesson.model.EntryScore;
import com.gt.vocab.lesson.model.LessonSlot;
import com.gt.vocab.model.Lesson;
import com.gt.vocab.model.LessonStatus;
import com.gt.vocab.model.ScheduledWord;
import com.gt.vocab.model.WordScore;

import java.util.List;

public interface LessonDao {

    long createLesson(long userId, LessonStatus status, int currentSequenceNumber, Long currentTaskId);

    void createSlots(long lessonId, List<ScheduledWord> plan);

    Lesson loadLesson(long lessonId);

    // Most recent lesson of the user that is not finished, or null
    Lesson loadUnfinishedLesson(long userId);

    List<LessonSlot> loadSlots(long lessonId);

    /**
     * Compare-and-set of the outstanding slot. Only succeeds while the lesson is in progress and still
     * waits on exactly the given sequence number and task.
     *
     * @return the number of lessons updated, 0 when the expected state no longer holds
     */
    int completeSlot(long lessonId, int expectedSequenceNumber, long expectedTaskId, int nextSequenceNumber, LessonStatus nextStatus);

    // Only fills an empty outstanding task slot
    int setCurrentTask(long lessonId, int sequenceNumber, long taskId);

    int finishLesson(long lessonId);

    long createHistoryEntry(long evaluationId, long taskId, String response);

    void createEntryScores(long historyEntryId, List<WordScore> scores);

    // Ordered by sequence number
    List<EntryScore> loadEntryScores(long lessonId);
}
