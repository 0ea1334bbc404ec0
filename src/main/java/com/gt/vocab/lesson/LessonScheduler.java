package com.gt.vocab.lesson;

import com.gt.vocab.mastery.MasteryService;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.model.ScheduledWord;
import com.gt.vocab.model.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Plans the word order of a lesson. Review words (seen, score below the threshold) and new words
 * (never seen, most frequent first) are interleaved in blocks of {@code reviewRatio} and {@code newRatio};
 * when one pool runs out the other is drained, up to {@code maxLength} words numbered from 1.
 */
@Component
public class LessonScheduler {

    private static final Logger log = LoggerFactory.getLogger(LessonScheduler.class);

    private final MasteryService masteryService;
    private final int reviewThreshold;
    private final int reviewRatio;
    private final int newRatio;
    private final int maxNewWords;
    private final int maxLength;

    @Autowired
    public LessonScheduler(MasteryService masteryService,
                           @Value("${vocab.lesson.reviewThreshold:7}") int reviewThreshold,
                           @Value("${vocab.lesson.reviewRatio:2}") int reviewRatio,
                           @Value("${vocab.lesson.newRatio:1}") int newRatio,
                           @Value("${vocab.lesson.maxNewWords:5}") int maxNewWords,
                           @Value("${vocab.lesson.maxLength:10}") int maxLength) {
        if (reviewRatio < 1 || newRatio < 1) {
            throw new IllegalArgumentException("Lesson ratios must be at least 1, got " + reviewRatio + ":" + newRatio);
        }
        if (maxNewWords < 0 || maxLength < 0) {
            throw new IllegalArgumentException("Lesson caps must not be negative, got " + maxNewWords + " and " + maxLength);
        }

        this.masteryService = masteryService;
        this.reviewThreshold = reviewThreshold;
        this.reviewRatio = reviewRatio;
        this.newRatio = newRatio;
        this.maxNewWords = maxNewWords;
        this.maxLength = maxLength;
    }

    public List<ScheduledWord> planLesson(LocalUser user) {
        List<Word> reviewWords = masteryService.wordsDueForReview(user, reviewThreshold);
        List<Word> newWords = masteryService.wordsNeverSeen(user, maxNewWords);

        List<ScheduledWord> plan = interleave(reviewWords, newWords);
        log.info("Planned {} words for user {} ({} due for review, {} new available)", plan.size(), user.username(), reviewWords.size(), newWords.size());

        return plan;
    }

    List<ScheduledWord> interleave(List<Word> reviewWords, List<Word> newWords) {
        List<ScheduledWord> plan = new ArrayList<>();
        Iterator<Word> reviewIter = reviewWords.iterator();
        Iterator<Word> newIter = newWords.iterator();

        while (plan.size() < maxLength && (reviewIter.hasNext() || newIter.hasNext())) {
            addBlock(plan, reviewIter, reviewRatio, true);
            addBlock(plan, newIter, newRatio, false);
        }

        return plan;
    }

    private void addBlock(List<ScheduledWord> plan, Iterator<Word> words, int blockSize, boolean review) {
        for (int added = 0; added < blockSize && words.hasNext() && plan.size() < maxLength; added++) {
            plan.add(new ScheduledWord(plan.size() + 1, words.next(), review));
        }
    }
}
