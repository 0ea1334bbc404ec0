package com.gt.vocab.task;

import com.gt.vocab.model.Word;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Content addresses of generated text. Two requests with the same template, parameter, description and
 * target word set share a key regardless of the order the words were given in.
 */
public final class ResourceKeys {

    private ResourceKeys() { }

    public static String resourceKey(long templateId, String parameterName, String description, Collection<Word> targetWords) {
        String wordIds = targetWords.stream()
                .map(Word::id)
                .distinct()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));

        return sha256(templateId + "|" + parameterName + "|" + description + "|" + wordIds);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
