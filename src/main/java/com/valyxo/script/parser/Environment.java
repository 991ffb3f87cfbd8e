package com.valyxo.script.parser;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable frames: the global frame at the bottom, one frame per active function call above it.
 *
 * Lookup only ever sees the innermost frame and the global frame, so a function body can read its
 * own parameters and globals but never a caller's locals.
 */
public class Environment {

    // LIFO of frames; the last element is the global frame
    private final Deque<Map<String, Value>> frames = new ArrayDeque<>();
    private final Map<String, Value> global = new LinkedHashMap<>();

    public Environment() {
        frames.push(global);
    }

    // -------------------------
    // Frames
    // -------------------------

    public void pushFrame() {
        frames.push(new LinkedHashMap<>());
    }

    public void popFrame() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the global frame");
        }
        frames.pop();
    }

    /** Number of active frames, the global frame included. */
    public int depth() {
        return frames.size();
    }

    public boolean inGlobalFrame() {
        return frames.size() == 1;
    }

    private Map<String, Value> innermost() {
        return frames.peek();
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in the innermost frame, shadowing any global of the same name. */
    public void define(String name, Value value) {
        innermost().put(name, value);
    }

    /** Updates the nearest existing binding, or creates one in the innermost frame. */
    public void assign(String name, Value value) {
        Map<String, Value> top = innermost();
        if (top.containsKey(name)) {
            top.put(name, value);
        } else if (global.containsKey(name)) {
            global.put(name, value);
        } else {
            top.put(name, value);
        }
    }

    public boolean exists(String name) {
        return innermost().containsKey(name) || global.containsKey(name);
    }

    public Value lookup(String name) {
        Value v = innermost().get(name);
        if (v != null) return v;
        v = global.get(name);
        if (v != null) return v;

        String close = NameSuggester.closest(name, visible().keySet());
        String hint = (close != null)
                ? "did you mean '" + close + "'?"
                : "Did you mean to set '" + name + "' first? Use: set " + name + " = value";
        throw new ScriptError(ErrorKind.UNDEFINED_VARIABLE, 0, null, "Unknown variable: '" + name + "'", hint);
    }

    // -------------------------
    // Snapshots
    // -------------------------

    /** Read-only live view of the global frame, in definition order. */
    public Map<String, Value> globals() {
        return Collections.unmodifiableMap(global);
    }

    public Map<String, Value> snapshotGlobals() {
        return new LinkedHashMap<>(global);
    }

    /** Everything a statement could read right now: globals, overlaid by the innermost frame. */
    public Map<String, Value> visible() {
        Map<String, Value> out = new LinkedHashMap<>(global);
        if (!inGlobalFrame()) out.putAll(innermost());
        return out;
    }

    /** Drops every frame and binding; the (now empty) global frame survives. */
    public void clear() {
        while (frames.size() > 1) frames.pop();
        global.clear();
    }
}
