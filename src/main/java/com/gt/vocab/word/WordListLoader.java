package com.gt.vocab.word;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Loads the corpus derived frequency list into the word catalog at startup. The list is tab separated
 * (word, part of speech, occurrence count) with a header line and sorted by descending count, so the
 * rank of a word is its position among the accepted lines.
 */
@Component
@ConditionalOnProperty(name = "vocab.wordlist.load", havingValue = "true")
public class WordListLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(WordListLoader.class);

    static final Set<String> EXCLUDED_POS = Set.of("PUNCT", "NUM", "PROPN", "SPACE");

    private final WordDao wordDao;
    private final ResourceLoader resourceLoader;
    private final String location;
    private final Language language;

    @Autowired
    public WordListLoader(WordDao wordDao,
                          ResourceLoader resourceLoader,
                          @Value("${vocab.wordlist.location}") String location,
                          @Value("${vocab.wordlist.language}") Language language) {
        this.wordDao = wordDao;
        this.resourceLoader = resourceLoader;
        this.location = location;
        this.language = language;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Resource resource = resourceLoader.getResource(location);

        List<Word> words;
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            words = parseWordList(reader, language);
        }

        int created = wordDao.createWords(words);
        log.info("Loaded {} word list from {}: {} entries, {} new", language.getDisplayName(), location, words.size(), created);
    }

    static List<Word> parseWordList(Reader reader, Language language) {
        List<Word> words = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        try (BufferedReader bufferedReader = new BufferedReader(reader)) {
            String line = bufferedReader.readLine();   // header
            while ((line = bufferedReader.readLine()) != null) {
                String[] columns = line.split("\t");
                if (columns.length < 2 || columns[0].isBlank()) {
                    continue;
                }

                String word = columns[0].trim().toLowerCase(Locale.ROOT);
                String pos = columns[1].trim().toUpperCase(Locale.ROOT);
                if (EXCLUDED_POS.contains(pos) || !seen.add(word + "[" + pos + "]")) {
                    continue;
                }

                words.add(new Word(0, word, pos, language, words.size() + 1));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read word list", ex);
        }

        return words;
    }
}
