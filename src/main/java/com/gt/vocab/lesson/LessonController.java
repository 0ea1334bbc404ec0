package com.gt.vocab.lesson;

import com.gt.vocab.lesson.model.*;
import com.gt.vocab.model.LessonStatus;
import com.gt.vocab.model.LessonSummary;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/users/{username}/lessons")
public class LessonController {

    private final LessonService lessonService;

    public LessonController(LessonService lessonService) {
        this.lessonService = lessonService;
    }

    @PostMapping(produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public LessonResponse startLesson(@PathVariable("username") String username) {
        LessonStart lessonStart = lessonService.startLesson(username);

        return new LessonResponse(
                lessonStart.lessonId(),
                lessonStart.firstTask() == null ? LessonStatus.FINISHED : LessonStatus.IN_PROGRESS,
                lessonStart.firstTask() == null ? null : ClientTask.from(lessonStart.firstTask(), lessonStart.order()),
                null);
    }

    @GetMapping(value = "/{lessonId}", produces = "application/json")
    public LessonResponse getLesson(@PathVariable("username") String username, @PathVariable("lessonId") long lessonId) {
        LessonView lessonView = lessonService.getLesson(username, lessonId);

        return new LessonResponse(
                lessonId,
                lessonView.lesson().status(),
                lessonView.currentTask() == null ? null : ClientTask.from(lessonView.currentTask(), lessonView.lesson().currentSequenceNumber()),
                lessonView.plannedWords());
    }

    @PostMapping(value = "/{lessonId}/submit", consumes = "application/json", produces = "application/json")
    public SubmissionResponse submitAnswer(@PathVariable("username") String username,
                                           @PathVariable("lessonId") long lessonId,
                                           @RequestBody SubmitAnswerRequest request) {
        SubmissionResult result = lessonService.submitAnswer(username, lessonId, request.taskId(), request.order(), request.answer());

        return new SubmissionResponse(
                result.scores().stream().map(wordScore -> new ClientWordScore(wordScore.word().word(), wordScore.score())).toList(),
                result.nextTask() == null ? null : ClientTask.from(result.nextTask(), result.nextOrder()),
                result.summary());
    }

    @PostMapping(value = "/{lessonId}/finish", produces = "application/json")
    public LessonSummary finishLesson(@PathVariable("username") String username, @PathVariable("lessonId") long lessonId) {
        return lessonService.finishLesson(username, lessonId);
    }

    public record LessonResponse(long lessonId, LessonStatus status, ClientTask task, Integer plannedWords) { }

    public record SubmissionResponse(List<ClientWordScore> scores, ClientTask nextTask, LessonSummary summary) { }

    public record ClientWordScore(String word, int score) { }

    private record SubmitAnswerRequest(long taskId, int order, String answer) { }
}
