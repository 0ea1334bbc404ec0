package com.gt.vocab.model;

public record WordScore(Word word, int score) {

    public long wordId() {
        return word.id();
    }
}
