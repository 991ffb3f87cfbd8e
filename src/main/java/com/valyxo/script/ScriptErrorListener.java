package com.valyxo.script;

import com.valyxo.script.parser.RuntimeState;
import com.valyxo.script.parser.ScriptError;

/**
 * Host hook notified of every fatal script error.
 * The error is still thrown to the caller afterwards; listeners observe, they never suppress.
 */
@FunctionalInterface
public interface ScriptErrorListener {
    void onError(ScriptError error, RuntimeState state);
}
