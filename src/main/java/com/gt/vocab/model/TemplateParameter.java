package com.gt.vocab.model;

public record TemplateParameter(long id, String name, String description) { }
