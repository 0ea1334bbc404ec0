package com.gt.vocab.external.impl;

import com.gt.vocab.evaluation.AnswerNormalizer;
import com.gt.vocab.external.AnswerJudge;
import com.gt.vocab.fuzzy.LevenshteinMatcher;
import com.gt.vocab.mastery.MasteryScores;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline judge scoring by edit distance between the normalized answers.
 */
@Component
@ConditionalOnProperty(name = "vocab.evaluation.judge", havingValue = "similarity")
public class SimilarityAnswerJudge implements AnswerJudge {

    @Override
    public int judge(String correctAnswer, String submittedAnswer, String context) {
        double similarity = new LevenshteinMatcher().similarity(
                AnswerNormalizer.normalize(correctAnswer),
                AnswerNormalizer.normalize(submittedAnswer));

        return MasteryScores.clamp(Math.round(similarity * MasteryScores.MAX_SCORE));
    }
}
