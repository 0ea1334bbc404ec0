package com.gt.vocab.external.impl;

import com.gt.vocab.external.AnswerJudge;
import com.gt.vocab.mastery.MasteryScores;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@ConditionalOnProperty(name = "vocab.evaluation.judge", havingValue = "ai", matchIfMissing = true)
public class ChatClientAnswerJudge implements AnswerJudge {

    private static final Pattern SCORE_PATTERN = Pattern.compile("\\d{1,9}");

    private static final String PROMPT = """
            You are part of a program that helps with language learning. Compare a learner's answer with
            the gold standard answer of an exercise. Score from 0 to 10 how well the learner's answer shows
            understanding of the exercise: 10 for a correct answer, 2 to 9 for a slightly incorrect but
            semantically similar answer, 0 for a wrong answer. Reply with the number only.

            Exercise: %s
            Gold standard answer: %s
            Learner's answer: %s
            """;

    private final ChatClient chatClient;

    @Autowired
    public ChatClientAnswerJudge(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public int judge(String correctAnswer, String submittedAnswer, String context) {
        ChatResponse response = chatClient.prompt()
                .user(String.format(PROMPT, context, correctAnswer, submittedAnswer))
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("No response received from chat model");
        }

        return parseScore(response.getResult().getOutput().getText());
    }

    static int parseScore(String text) {
        Matcher matcher = SCORE_PATTERN.matcher(text == null ? "" : text);

        if (!matcher.find()) {
            throw new IllegalStateException("Judge reply contains no score: " + text);
        }

        return MasteryScores.clamp(Long.parseLong(matcher.group()));
    }
}
