package com.gt.vocab.model;

import java.time.Instant;

public record LocalUser(long id,
                        String username,
                        Language sourceLanguage,
                        Language targetLanguage,
                        Instant createInstant) { }
