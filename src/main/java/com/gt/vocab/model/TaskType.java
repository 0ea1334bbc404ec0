package com.gt.vocab.model;

public enum TaskType {
    ONE_WAY_TRANSLATION,
    FOUR_CHOICE
}
