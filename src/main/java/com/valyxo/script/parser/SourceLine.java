package com.valyxo.script.parser;

/** One retained line of script source, numbered as in the user's original text. */
public final class SourceLine {
    public final int number;
    public final String text;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
