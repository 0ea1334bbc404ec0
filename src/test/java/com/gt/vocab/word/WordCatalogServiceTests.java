package com.gt.vocab.word;

import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class WordCatalogServiceTests {

    @Mock private WordDao wordDao;

    private WordCatalogService wordCatalogService;

    @BeforeEach
    public void setup() {
        wordCatalogService = new WordCatalogService(wordDao);

        when(wordDao.lookupWord(Language.German, "haus", "NOUN")).thenReturn(HAUS);
        when(wordDao.lookupWord(eq(Language.German), eq("tisch"), anyString())).thenReturn(null);
    }

    @Test
    public void testLookup() {
        assertEquals(HAUS, wordCatalogService.lookup(Language.German, "Haus", "noun"));
        verify(wordDao).lookupWord(Language.German, "haus", "NOUN");
    }

    @Test
    public void testLookup_NotFound() {
        assertThrows(NotFoundException.class, () -> wordCatalogService.lookup(Language.German, "Tisch", "NOUN"));
    }

    @Test
    public void testWordsByFrequency() {
        when(wordDao.loadWordsByFrequency(Language.German)).thenReturn(new ArrayList<>(List.of(HAUS, APFEL, GEHEN, SCHNELL)));

        List<Word> words = wordCatalogService.wordsByFrequency(Language.German);

        assertEquals(List.of(HAUS, APFEL, GEHEN, SCHNELL), words);
        for (int index = 1; index < words.size(); index++) {
            assertTrue(words.get(index - 1).frequencyRank() < words.get(index).frequencyRank());
        }
        assertThrows(UnsupportedOperationException.class, () -> words.remove(0));
    }

    @Test
    public void testWordsByFrequency_RestartsFromMostCommon() {
        when(wordDao.loadWordsByFrequency(Language.German)).thenReturn(List.of(HAUS, APFEL, GEHEN));

        Iterator<Word> first = wordCatalogService.wordsByFrequency(Language.German).iterator();
        first.next();
        first.next();

        Iterator<Word> second = wordCatalogService.wordsByFrequency(Language.German).iterator();

        assertEquals(HAUS, second.next());
        assertEquals(GEHEN, first.next());
    }

    @Test
    public void testLoadWords_FollowsRequestOrder() {
        when(wordDao.loadWords(any())).thenReturn(List.of(HAUS, APFEL, GEHEN));

        assertEquals(List.of(GEHEN, HAUS, APFEL), wordCatalogService.loadWords(List.of(GEHEN.id(), HAUS.id(), APFEL.id())));
    }

    @Test
    public void testLoadWords_UnknownId() {
        when(wordDao.loadWords(any())).thenReturn(List.of(HAUS));

        assertThrows(NotFoundException.class, () -> wordCatalogService.loadWords(List.of(HAUS.id(), 999L)));
    }
}
