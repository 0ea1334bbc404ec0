package com.gt.vocab.model;

public record Word(long id, String word, String pos, Language language, int frequencyRank) { }
