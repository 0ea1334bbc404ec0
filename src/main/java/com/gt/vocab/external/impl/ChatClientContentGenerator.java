package com.gt.vocab.external.impl;

import com.gt.vocab.external.ContentGenerator;
import com.gt.vocab.model.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "vocab.ai.enabled", havingValue = "true", matchIfMissing = true)
public class ChatClientContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatClientContentGenerator.class);

    private static final String PROMPT = """
            You are part of a program that helps with language learning by creating short exercises.
            An exercise is described by a template and is completed by filling in its parameters.
            Write the value of exactly one parameter. Reply with the value only, without quotes,
            labels or explanations.

            Template description: %s
            Parameter description: %s
            Target words: %s
            Examples of finished exercises:
            %s
            """;

    private final ChatClient chatClient;

    @Autowired
    public ChatClientContentGenerator(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String synthesize(String templateDescription, String parameterDescription, List<Word> targetWords, List<String> styleExamples) {
        String prompt = String.format(PROMPT,
                templateDescription,
                parameterDescription,
                targetWords.stream().map(Word::word).collect(Collectors.joining(", ")),
                styleExamples.stream().map(example -> "- " + example).collect(Collectors.joining("\n")));

        ChatResponse response = chatClient.prompt()
                .user(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("No response received from chat model");
        }

        String text = response.getResult().getOutput().getText();
        log.debug("Synthesized \"{}\" for parameter \"{}\"", text, parameterDescription);

        return text == null ? "" : text.trim();
    }
}
