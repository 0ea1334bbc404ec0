package com.gt.vocab.word;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.Word;

import java.util.Collection;
import java.util.List;

public interface WordDao {

    Word lookupWord(Language language, String word, String pos);

    List<Word> loadWords(Collection<Long> wordIds);

    List<Word> loadWordsByFrequency(Language language);

    int createWords(List<Word> words);
}
