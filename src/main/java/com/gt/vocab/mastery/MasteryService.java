package com.gt.vocab.mastery;

import com.gt.vocab.exception.InvalidScoreException;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.model.MasteryRecord;
import com.gt.vocab.model.Word;
import com.gt.vocab.model.WordScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Per-user, per-word mastery scores. A word without a record is unseen, which is distinct from a score
 * of 0. Records are created on first graded exposure and never deleted.
 */
@Component
public class MasteryService {

    private static final Logger log = LoggerFactory.getLogger(MasteryService.class);

    private final MasteryDao masteryDao;
    private final ScoreDecayPolicy scoreDecayPolicy;

    @Autowired
    public MasteryService(MasteryDao masteryDao, ScoreDecayPolicy scoreDecayPolicy) {
        this.masteryDao = masteryDao;
        this.scoreDecayPolicy = scoreDecayPolicy;
    }

    public OptionalInt getScore(LocalUser user, Word word) {
        MasteryRecord masteryRecord = masteryDao.loadRecord(user.id(), word.id());

        if (masteryRecord == null) {
            return OptionalInt.empty();
        }

        return OptionalInt.of(MasteryScores.clamp(scoreDecayPolicy.effectiveScore(masteryRecord, Instant.now())));
    }

    public void recordScore(LocalUser user, Word word, int score) {
        recordScores(user, List.of(new WordScore(word, score)));
    }

    // All scores are validated before any is written
    public void recordScores(LocalUser user, List<WordScore> scores) {
        for (WordScore wordScore : scores) {
            if (!MasteryScores.isValid(wordScore.score())) {
                String errMsg = "Score " + wordScore.score() + " for word " + wordScore.word().word() + " is outside ["
                        + MasteryScores.MIN_SCORE + ", " + MasteryScores.MAX_SCORE + "]";

                log.error(errMsg);
                throw new InvalidScoreException(errMsg);
            }
        }

        if (!scores.isEmpty()) {
            masteryDao.upsertScores(user.id(), scores);
        }
    }

    /**
     * Seen words whose effective score is below the threshold, stalest first and then lowest score.
     */
    public List<Word> wordsDueForReview(LocalUser user, int threshold) {
        Instant now = Instant.now();

        return masteryDao.loadSeenRecords(user.id())
                .stream()
                .filter(masteryRecord -> scoreDecayPolicy.effectiveScore(masteryRecord, now) < threshold)
                .sorted(Comparator.comparing(MasteryRecord::updateInstant, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparingInt(MasteryRecord::score))
                .map(MasteryRecord::word)
                .toList();
    }

    public List<Word> wordsNeverSeen(LocalUser user, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        return masteryDao.loadUnseenWords(user.id(), user.targetLanguage(), limit);
    }
}
