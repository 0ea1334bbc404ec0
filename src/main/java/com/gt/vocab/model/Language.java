package com.gt.vocab.model;

public enum Language {

    English("English"),
    German("German");

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
