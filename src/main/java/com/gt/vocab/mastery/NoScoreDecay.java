package com.gt.vocab.mastery;

import com.gt.vocab.model.MasteryRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;

// Scores only change when an answer is graded
@Component
public class NoScoreDecay implements ScoreDecayPolicy {

    @Override
    public int effectiveScore(MasteryRecord masteryRecord, Instant now) {
        return masteryRecord.score();
    }
}
