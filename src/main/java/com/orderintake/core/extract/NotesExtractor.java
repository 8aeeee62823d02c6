package com.orderintake.core.extract;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a free-text customer note. Rules are tried in {@link #NOTE_RULES} order and the first
 * rule whose pattern matches decides the result; a blank capture means no note.
 */
public class NotesExtractor {

    // "notes" must start a word, so "denotes" or "footnote" are not notes
    public static final List<NoteRule> NOTE_RULES = List.of(
        new NoteRule("notes", Pattern.compile("\\bnotes?[:\\-\\s]*(.*)", Pattern.CASE_INSENSITIVE)),
        new NoteRule("let-me-know", Pattern.compile("let me know[:\\-\\s]*(.*)", Pattern.CASE_INSENSITIVE)),
        new NoteRule("better-alternatives",
            Pattern.compile("if there are better alternatives for any item, (.*)", Pattern.CASE_INSENSITIVE)),
        new NoteRule("sign-off", Pattern.compile("sincerely,\\s*(.*)", Pattern.CASE_INSENSITIVE))
    );

    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (NoteRule rule : NOTE_RULES) {
            Optional<String> captured = rule.match(text);
            if (captured.isPresent()) {
                return captured.map(String::trim).filter(note -> !note.isEmpty());
            }
        }
        return Optional.empty();
    }

    public record NoteRule(String name, Pattern pattern) {

        /**
         * @return the raw capture of the first match, possibly blank, or empty when the
         * pattern does not match
         */
        public Optional<String> match(String text) {
            Matcher m = pattern.matcher(text);
            return m.find() ? Optional.of(m.group(1)) : Optional.empty();
        }
    }
}
