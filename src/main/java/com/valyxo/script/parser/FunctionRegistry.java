package com.valyxo.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.valyxo.debug.Debug;

/** name -> function. One definition per name; a later definition replaces an earlier one. */
public class FunctionRegistry {
    private static final String TAG = "Functions";

    private final Map<String, UserFunction> functions = new LinkedHashMap<>();

    /** @return true if an existing definition was replaced */
    public boolean define(UserFunction fn) {
        UserFunction previous = functions.put(fn.name, fn);
        if (previous != null) {
            Debug.get().w(TAG, "Function '" + fn.name + "' redefined at line " + fn.line
                    + " (previous definition at line " + previous.line + ")");
            return true;
        }
        Debug.get().d(TAG, "Registered " + fn.signature() + " at line " + fn.line);
        return false;
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public UserFunction lookup(String name) {
        UserFunction fn = functions.get(name);
        if (fn != null) return fn;

        String close = NameSuggester.closest(name, functions.keySet());
        String hint = (close != null)
                ? "did you mean '" + close + "'?"
                : "Define it first: func " + name + "(...) { ... }";
        throw new ScriptError(ErrorKind.UNDEFINED_FUNCTION, 0, null, "Unknown function: '" + name + "'", hint);
    }

    /** Read-only view in definition order. */
    public Map<String, UserFunction> all() {
        return Collections.unmodifiableMap(functions);
    }

    public int size() {
        return functions.size();
    }

    public void clear() {
        functions.clear();
    }
}
