package com.questrail.testkit.expectation;

import com.questrail.testkit.api.MessageKind;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inflects report text to suit a message kind.
 *
 * <p>Placeholders such as {@code <message>} and {@code <produced>} are
 * replaced with the words for the kind, in either lower or upper case. The
 * result is then corrected for articles and plurals, so "a &lt;message&gt;"
 * becomes "an event" and "1 commands" becomes "1 command".</p>
 */
final class Inflect {

    private static final Map<MessageKind, Map<String, String>> SUBSTITUTIONS = Map.of(
            MessageKind.COMMAND, words("command", "commands", "execute", "executed", "executing", "CommandExecutor"),
            MessageKind.EVENT, words("event", "events", "record", "recorded", "recording", "EventRecorder"),
            MessageKind.TIMEOUT, words("timeout", "timeouts", "schedule", "scheduled", "scheduling", null)
    );

    private static final Map<Pattern, String> CORRECTIONS = new LinkedHashMap<>();

    static {
        correction("an command", "a command");
        correction("a event", "an event");
        correction("an timeout", "a timeout");
        correction("1 commands", "1 command");
        correction("1 events", "1 event");
        correction("1 timeouts", "1 timeout");
    }

    private Inflect() {
    }

    static String sprint(MessageKind kind, String s) {
        for (Map.Entry<String, String> e : SUBSTITUTIONS.get(kind).entrySet()) {
            s = s.replace(e.getKey(), e.getValue());
            s = s.replace(e.getKey().toUpperCase(Locale.ROOT), e.getValue().toUpperCase(Locale.ROOT));
        }

        for (Map.Entry<Pattern, String> e : CORRECTIONS.entrySet()) {
            s = e.getKey().matcher(s).replaceAll(Matcher.quoteReplacement(e.getValue()));
        }

        return s;
    }

    static String sprintf(MessageKind kind, String format, Object... args) {
        return sprint(kind, String.format(format, args));
    }

    private static Map<String, String> words(
            String message,
            String messages,
            String produce,
            String produced,
            String producing,
            String dispatcher
    ) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("<message>", message);
        m.put("<messages>", messages);
        m.put("<produce>", produce);
        m.put("<produced>", produced);
        m.put("<producing>", producing);
        if (dispatcher != null) {
            m.put("<dispatcher>", dispatcher);
        }
        return m;
    }

    private static void correction(String from, String to) {
        CORRECTIONS.put(Pattern.compile("\\b" + Pattern.quote(from) + "\\b"), to);
        CORRECTIONS.put(
                Pattern.compile("\\b" + Pattern.quote(from.toUpperCase(Locale.ROOT)) + "\\b"),
                to.toUpperCase(Locale.ROOT));
    }
}
