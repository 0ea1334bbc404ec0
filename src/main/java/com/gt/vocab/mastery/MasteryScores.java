package com.gt.vocab.mastery;

public final class MasteryScores {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    private MasteryScores() { }

    public static int clamp(long score) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static boolean isValid(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
