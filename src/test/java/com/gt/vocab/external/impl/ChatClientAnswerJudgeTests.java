package com.gt.vocab.external.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ChatClientAnswerJudgeTests {

    @Test
    public void testParseScore() {
        assertEquals(7, ChatClientAnswerJudge.parseScore("7"));
        assertEquals(10, ChatClientAnswerJudge.parseScore("Score: 10/10"));
        assertEquals(10, ChatClientAnswerJudge.parseScore("15"));
        assertEquals(0, ChatClientAnswerJudge.parseScore(" 0 "));
    }

    @Test
    public void testParseScore_NoNumber() {
        assertThrows(IllegalStateException.class, () -> ChatClientAnswerJudge.parseScore("excellent"));
        assertThrows(IllegalStateException.class, () -> ChatClientAnswerJudge.parseScore(null));
    }
}
