package com.mythosmud.core.msg;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Subscription pattern over dot-separated subjects.
 * <p>
 * {@code *} matches exactly one token, {@code >} (only as the last token) matches one or
 * more remaining tokens. Everything else matches literally.
 * </p>
 * <pre>
 * room.*.northside   matches room.arkhamcity.northside
 * room.>             matches room.arkhamcity.northside and room.lobby
 * global             matches global only
 * </pre>
 */
@EqualsAndHashCode(of = "pattern")
public final class SubjectPattern {
    private static final Splitter TOKENS = Splitter.on('.');

    private final String pattern;
    private final List<String> tokens;

    private SubjectPattern(String pattern) {
        this.pattern = pattern;
        this.tokens = TOKENS.splitToList(pattern);
    }

    public static SubjectPattern compile(String pattern) {
        if (Strings.isNullOrEmpty(pattern)) {
            throw new IllegalArgumentException("Subject pattern must not be empty");
        }
        List<String> tokens = TOKENS.splitToList(pattern);
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.isEmpty()) {
                throw new IllegalArgumentException("Empty token in subject pattern: " + pattern);
            }
            if (token.equals(">") && i != tokens.size() - 1) {
                throw new IllegalArgumentException("'>' must be the last token: " + pattern);
            }
        }
        return new SubjectPattern(pattern);
    }

    public boolean matches(String subject) {
        if (Strings.isNullOrEmpty(subject)) {
            return false;
        }
        List<String> subjectTokens = TOKENS.splitToList(subject);
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.equals(">")) {
                return subjectTokens.size() > i;
            }
            if (i >= subjectTokens.size()) {
                return false;
            }
            if (!token.equals("*") && !token.equals(subjectTokens.get(i))) {
                return false;
            }
        }
        return subjectTokens.size() == tokens.size();
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
