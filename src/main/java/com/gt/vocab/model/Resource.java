package com.gt.vocab.model;

import java.util.List;

public record Resource(long id, String text, String cacheKey, List<Word> words) {

    public Resource {
        words = List.copyOf(words);
    }
}
