package com.gt.vocab.template;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A template string with {@code ${name}} placeholders. Every placeholder must be filled on render.
 */
public class TemplateString {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final String template;
    private final Set<String> placeholders;

    public TemplateString(String template) {
        this.template = template;

        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        this.placeholders = Collections.unmodifiableSet(names);
    }

    public Set<String> getPlaceholders() {
        return placeholders;
    }

    public String render(Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();

        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            if (value == null) {
                throw new IllegalArgumentException("No value for placeholder " + matcher.group(1));
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);

        return rendered.toString();
    }

    public static boolean containsPlaceholder(String text) {
        return PLACEHOLDER.matcher(text).find();
    }
}
