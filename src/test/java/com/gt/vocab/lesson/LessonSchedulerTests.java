package com.gt.vocab.lesson;

import com.gt.vocab.mastery.MasteryService;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.model.ScheduledWord;
import com.gt.vocab.model.Word;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class LessonSchedulerTests {

    private static final LocalUser TEST_USER = TestUtils.getTestUser();

    @Mock private MasteryService masteryService;

    @Test
    public void testPlanLesson_AllNew() {
        when(masteryService.wordsDueForReview(TEST_USER, 7)).thenReturn(List.of());
        when(masteryService.wordsNeverSeen(TEST_USER, 5)).thenReturn(List.of(HAUS, APFEL, GEHEN));

        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, 2, 1, 5, 10).planLesson(TEST_USER);

        assertEquals(List.of(
                new ScheduledWord(1, HAUS, false),
                new ScheduledWord(2, APFEL, false),
                new ScheduledWord(3, GEHEN, false)), plan);
    }

    @Test
    public void testPlanLesson_ReviewBeforeNew() {
        when(masteryService.wordsDueForReview(TEST_USER, 7)).thenReturn(List.of(APFEL));
        when(masteryService.wordsNeverSeen(TEST_USER, 5)).thenReturn(List.of(HAUS, GEHEN));

        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, 2, 1, 5, 10).planLesson(TEST_USER);

        assertEquals(List.of(
                new ScheduledWord(1, APFEL, true),
                new ScheduledWord(2, HAUS, false),
                new ScheduledWord(3, GEHEN, false)), plan);
    }

    @Test
    public void testPlanLesson_NothingDue() {
        when(masteryService.wordsDueForReview(TEST_USER, 7)).thenReturn(List.of());
        when(masteryService.wordsNeverSeen(TEST_USER, 5)).thenReturn(List.of());

        assertEquals(List.of(), new LessonScheduler(masteryService, 7, 2, 1, 5, 10).planLesson(TEST_USER));
    }

    @Test
    public void testInterleave_TwoToOne() {
        List<Word> review = words("r", 4);
        List<Word> fresh = words("n", 3);

        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, 2, 1, 5, 10).interleave(review, fresh);

        assertEquals(List.of("r1", "r2", "n1", "r3", "r4", "n2", "n3"), plan.stream().map(sw -> sw.word().word()).toList());
        assertEquals(List.of(true, true, false, true, true, false, false), plan.stream().map(ScheduledWord::review).toList());
    }

    @Test
    public void testInterleave_DrainsReviewWhenNewRunsOut() {
        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, 2, 1, 5, 10).interleave(words("r", 5), words("n", 1));

        assertEquals(List.of("r1", "r2", "n1", "r3", "r4", "r5"), plan.stream().map(sw -> sw.word().word()).toList());
    }

    @Test
    public void testInterleave_StopsAtMaxLength() {
        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, 2, 1, 5, 4).interleave(words("r", 5), words("n", 5));

        assertEquals(List.of("r1", "r2", "n1", "r3"), plan.stream().map(sw -> sw.word().word()).toList());
    }

    @ParameterizedTest
    @CsvSource({"1,1", "2,1", "3,2", "1,3"})
    public void testInterleave_GaplessSequenceNumbers(int reviewRatio, int newRatio) {
        List<ScheduledWord> plan = new LessonScheduler(masteryService, 7, reviewRatio, newRatio, 5, 12)
                .interleave(words("r", 7), words("n", 4));

        assertEquals(11, plan.size());
        assertEquals(IntStream.rangeClosed(1, 11).boxed().toList(), plan.stream().map(ScheduledWord::sequenceNumber).toList());
        assertEquals(reviewRatio, plan.stream().limit(reviewRatio).filter(ScheduledWord::review).count());
    }

    @ParameterizedTest
    @CsvSource({"0,1,5,10", "1,0,5,10", "2,1,-1,10", "2,1,5,-1"})
    public void testConstructor_InvalidConfiguration(int reviewRatio, int newRatio, int maxNewWords, int maxLength) {
        assertThrows(IllegalArgumentException.class,
                () -> new LessonScheduler(masteryService, 7, reviewRatio, newRatio, maxNewWords, maxLength));
    }

    private static List<Word> words(String prefix, int count) {
        List<Word> words = new ArrayList<>();
        for (int index = 1; index <= count; index++) {
            words.add(new Word(prefix.hashCode() * 100L + index, prefix + index, "NOUN", Language.German, index));
        }
        return words;
    }
}
