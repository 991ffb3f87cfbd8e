package com.valyxo.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the lines of a multi-line block until its braces balance.
 * Braces are counted on lexer tokens, so a '{' inside a string literal never opens a block.
 */
public final class BlockBuffer {
    private final List<SourceLine> lines = new ArrayList<>();
    private int depth = 0;

    public boolean isOpen() {
        return !lines.isEmpty();
    }

    /** Brace depth after the lines fed so far. */
    public int depth() {
        return depth;
    }

    /** Line where the buffered block started, 0 if nothing is buffered. */
    public int openedAt() {
        return lines.isEmpty() ? 0 : lines.get(0).number;
    }

    public String openedText() {
        return lines.isEmpty() ? null : lines.get(0).text;
    }

    /**
     * Adds one line.
     *
     * @param holdForElse keep the chunk open even when braces balance, because the next line continues it
     * @return the complete chunk, or null while the block is still open
     */
    public List<SourceLine> feed(SourceLine line, boolean holdForElse) {
        int d = depth;
        for (Token t : new Lexer(line.text, line.number).tokenize()) {
            if (t.type == TokenType.LEFT_BRACE) {
                d++;
            } else if (t.type == TokenType.RIGHT_BRACE) {
                d--;
                if (d < 0) {
                    clear();
                    throw new ScriptError(ErrorKind.SYNTAX_ERROR, line.number, line.text,
                            "Unexpected closing brace '}'", "Check that all blocks are properly opened");
                }
            }
        }

        depth = d;
        lines.add(line);
        if (depth > 0 || holdForElse) return null;

        List<SourceLine> chunk = new ArrayList<>(lines);
        clear();
        return chunk;
    }

    public List<SourceLine> pending() {
        return Collections.unmodifiableList(lines);
    }

    /** Hands back whatever is buffered and empties the buffer. */
    public List<SourceLine> drain() {
        List<SourceLine> chunk = new ArrayList<>(lines);
        clear();
        return chunk;
    }

    public void clear() {
        lines.clear();
        depth = 0;
    }
}
