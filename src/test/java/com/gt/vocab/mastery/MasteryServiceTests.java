package com.gt.vocab.mastery;

import com.gt.vocab.exception.InvalidScoreException;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.model.MasteryRecord;
import com.gt.vocab.model.WordScore;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class MasteryServiceTests {

    private static final LocalUser TEST_USER = TestUtils.getTestUser();

    @Mock private MasteryDao masteryDao;

    private MasteryService masteryService;

    @BeforeEach
    public void setup() {
        masteryService = new MasteryService(masteryDao, new NoScoreDecay());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 5, 10})
    public void testRecordScore_Boundaries(int score) {
        masteryService.recordScore(TEST_USER, HAUS, score);

        verify(masteryDao).upsertScores(TEST_USER.id(), List.of(new WordScore(HAUS, score)));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 11, 100})
    public void testRecordScore_OutOfRange(int score) {
        assertThrows(InvalidScoreException.class, () -> masteryService.recordScore(TEST_USER, HAUS, score));

        verifyNoInteractions(masteryDao);
    }

    @Test
    public void testRecordScores_OneInvalidWritesNothing() {
        assertThrows(InvalidScoreException.class, () -> masteryService.recordScores(TEST_USER,
                List.of(new WordScore(HAUS, 10), new WordScore(APFEL, 11))));

        verify(masteryDao, never()).upsertScores(anyLong(), anyList());
    }

    @Test
    public void testRecordScores_Empty() {
        masteryService.recordScores(TEST_USER, List.of());

        verifyNoInteractions(masteryDao);
    }

    @Test
    public void testGetScore_UnseenIsDistinctFromZero() {
        when(masteryDao.loadRecord(TEST_USER.id(), HAUS.id())).thenReturn(null);
        when(masteryDao.loadRecord(TEST_USER.id(), APFEL.id())).thenReturn(new MasteryRecord(TEST_USER.id(), APFEL, 0, Instant.now()));

        assertEquals(OptionalInt.empty(), masteryService.getScore(TEST_USER, HAUS));
        assertEquals(OptionalInt.of(0), masteryService.getScore(TEST_USER, APFEL));
    }

    @Test
    public void testWordsDueForReview() {
        Instant now = Instant.now();
        when(masteryDao.loadSeenRecords(TEST_USER.id())).thenReturn(List.of(
                new MasteryRecord(TEST_USER.id(), HAUS, 9, now.minusSeconds(500)),
                new MasteryRecord(TEST_USER.id(), APFEL, 6, now.minusSeconds(100)),
                new MasteryRecord(TEST_USER.id(), GEHEN, 2, now.minusSeconds(100)),
                new MasteryRecord(TEST_USER.id(), SCHNELL, 7, now.minusSeconds(900))));

        assertEquals(List.of(GEHEN, APFEL), masteryService.wordsDueForReview(TEST_USER, 7));
    }

    @Test
    public void testWordsDueForReview_StalestFirst() {
        Instant now = Instant.now();
        when(masteryDao.loadSeenRecords(TEST_USER.id())).thenReturn(List.of(
                new MasteryRecord(TEST_USER.id(), APFEL, 1, now.minusSeconds(10)),
                new MasteryRecord(TEST_USER.id(), HAUS, 5, now.minusSeconds(1000))));

        assertEquals(List.of(HAUS, APFEL), masteryService.wordsDueForReview(TEST_USER, 7));
    }

    @Test
    public void testWordsNeverSeen() {
        when(masteryDao.loadUnseenWords(TEST_USER.id(), TEST_USER.targetLanguage(), 2)).thenReturn(List.of(HAUS, APFEL));

        assertEquals(List.of(HAUS, APFEL), masteryService.wordsNeverSeen(TEST_USER, 2));
        assertEquals(List.of(), masteryService.wordsNeverSeen(TEST_USER, 0));

        verify(masteryDao, times(1)).loadUnseenWords(anyLong(), any(), anyInt());
    }
}
