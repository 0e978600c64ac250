package com.nikl.script.parser;

import java.util.List;

/**
 * Host-provided callable exposed to scripts as an ordinary value.
 * Implementations check their own arity and argument kinds and report
 * failures by throwing {@link RuntimeError}.
 */
public interface BuiltinFunction {
    Value call(List<Value> args);
}
