package com.gt.vocab.external;

import com.gt.vocab.model.Word;

import java.util.List;

/**
 * Produces the text of one template parameter. Implementations may call remote services and are
 * always invoked through {@link ExternalCallRunner}, which bounds their latency.
 */
public interface ContentGenerator {

    String synthesize(String templateDescription, String parameterDescription, List<Word> targetWords, List<String> styleExamples);
}
