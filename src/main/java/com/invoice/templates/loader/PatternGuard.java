package com.invoice.templates.loader;

import com.invoice.templates.exception.TemplateValidationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles template patterns and rejects the ones that can backtrack
 * catastrophically: a repeated group whose body is itself repeated, such as
 * {@code (a+)+} or {@code (\d{1,3})*}.
 */
public class PatternGuard {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.UNICODE_CASE;

    private final int maxLength;

    public PatternGuard(int maxLength) {
        this.maxLength = maxLength;
    }

    public Pattern compile(String regex) {
        if (regex == null || regex.isBlank()) {
            throw new TemplateValidationException("empty pattern");
        }
        if (regex.length() > maxLength) {
            throw new TemplateValidationException(
                    "pattern longer than " + maxLength + " characters");
        }
        if (hasNestedQuantifier(regex)) {
            throw new TemplateValidationException("nested quantifier in pattern: " + regex);
        }
        try {
            return Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException e) {
            throw new TemplateValidationException("invalid pattern: " + e.getDescription(), e);
        }
    }

    static boolean hasNestedQuantifier(String regex) {
        // One entry per open group: does its body contain a repetition?
        Deque<boolean[]> groups = new ArrayDeque<>();
        groups.push(new boolean[]{false});
        boolean inClass = false;

        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);

            if (c == '\\') {
                i++;
                continue;
            }
            if (inClass) {
                if (c == ']') inClass = false;
                continue;
            }

            switch (c) {
                case '[' -> inClass = true;
                case '(' -> groups.push(new boolean[]{false});
                case ')' -> {
                    if (groups.size() == 1) {
                        continue;   // unbalanced; Pattern.compile reports it
                    }
                    boolean bodyRepeats = groups.pop()[0];
                    boolean groupRepeats = isRepetition(regex, i + 1);
                    if (bodyRepeats && groupRepeats) {
                        return true;
                    }
                    if (bodyRepeats || groupRepeats) {
                        groups.peek()[0] = true;
                    }
                }
                case '*', '+' -> groups.peek()[0] = true;
                case '{' -> {
                    if (isRepetition(regex, i)) groups.peek()[0] = true;
                }
                default -> { }
            }
        }
        return false;
    }

    private static boolean isRepetition(String regex, int index) {
        if (index >= regex.length()) {
            return false;
        }
        char next = regex.charAt(index);
        if (next == '*' || next == '+') {
            return true;
        }
        if (next != '{') {
            return false;
        }
        int close = regex.indexOf('}', index);
        if (close < 0) {
            return false;
        }
        String body = regex.substring(index + 1, close);
        // {n} is a fixed count; only open or ranged bounds repeat
        return body.matches("\\d+,\\d*") && !body.matches("(\\d+),\\1");
    }
}
