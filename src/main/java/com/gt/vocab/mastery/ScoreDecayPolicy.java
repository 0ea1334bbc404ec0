package com.gt.vocab.mastery;

import com.gt.vocab.model.MasteryRecord;

import java.time.Instant;

/**
 * Converts a stored mastery score into the score used for scheduling. Implementations may lower the
 * score as time passes since the last review; the result must stay within [0, 10].
 */
public interface ScoreDecayPolicy {

    int effectiveScore(MasteryRecord masteryRecord, Instant now);
}
