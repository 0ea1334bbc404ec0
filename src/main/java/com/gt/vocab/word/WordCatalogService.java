package com.gt.vocab.word;

import com.gt.vocab.conf.CachingConfig;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of the frequency ranked vocabulary. Words are loaded once by {@link WordListLoader}
 * and never mutated afterwards.
 */
@Component
public class WordCatalogService {

    private static final Logger log = LoggerFactory.getLogger(WordCatalogService.class);

    private final WordDao wordDao;

    @Autowired
    public WordCatalogService(WordDao wordDao) {
        this.wordDao = wordDao;
    }

    public Word lookup(Language language, String word, String pos) {
        Word found = wordDao.lookupWord(language, word.toLowerCase(Locale.ROOT), pos.toUpperCase(Locale.ROOT));

        if (found == null) {
            throw new NotFoundException("Word " + word + " [" + pos + "] is not in the " + language.getDisplayName() + " catalog");
        }

        return found;
    }

    /**
     * Returns the catalog of a language ordered by ascending frequency rank. Every call returns a fresh,
     * unmodifiable list so iteration can always be restarted from the most common word.
     */
    @Cacheable(CachingConfig.WORDS_BY_FREQUENCY)
    public List<Word> wordsByFrequency(Language language) {
        return List.copyOf(wordDao.loadWordsByFrequency(language));
    }

    // Result follows the order of the requested ids; unknown ids are an error
    public List<Word> loadWords(List<Long> wordIds) {
        Map<Long, Word> wordsById = wordDao.loadWords(new HashSet<>(wordIds))
                .stream()
                .collect(Collectors.toMap(Word::id, Function.identity()));

        List<Word> words = new ArrayList<>();
        for (Long wordId : wordIds) {
            Word word = wordsById.get(wordId);
            if (word == null) {
                log.error("Word {} referenced but not found in catalog", wordId);
                throw new NotFoundException("Word " + wordId + " does not exist");
            }
            words.add(word);
        }

        return words;
    }
}
