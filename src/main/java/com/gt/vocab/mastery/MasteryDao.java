package com.gt.vocab.mastery;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.MasteryRecord;
import com.gt.vocab.model.Word;
import com.gt.vocab.model.WordScore;

import java.util.List;

public interface MasteryDao {

    MasteryRecord loadRecord(long userId, long wordId);

    List<MasteryRecord> loadSeenRecords(long userId);

    List<Word> loadUnseenWords(long userId, Language language, int limit);

    void upsertScores(long userId, List<WordScore> scores);
}
