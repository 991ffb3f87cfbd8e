package com.valyxo.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into logical lines: trimmed, without blanks or '#' comment lines,
 * each keeping its original 1-based line number for diagnostics.
 */
public final class StatementSplitter {

    public static final String COMMENT_MARKER = "#";

    private StatementSplitter() {}

    public static List<SourceLine> split(String source) {
        List<SourceLine> out = new ArrayList<>();
        if (source == null || source.isEmpty()) return out;

        // split(-1) keeps trailing empties so numbering never drifts
        String[] raw = source.split("\r\n|\r|\n", -1);
        for (int i = 0; i < raw.length; i++) {
            String text = raw[i].trim();
            if (isBlankOrComment(text)) continue;
            out.add(new SourceLine(i + 1, text));
        }
        return out;
    }

    public static boolean isBlankOrComment(String trimmed) {
        return trimmed.isEmpty() || trimmed.startsWith(COMMENT_MARKER);
    }
}
