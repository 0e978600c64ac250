package com.nikl.script.modules;

import static com.nikl.script.modules.Args.requireArgs;
import static com.nikl.script.modules.Args.str;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.nikl.script.parser.BuiltinFunction;
import com.nikl.script.parser.RuntimeError;
import com.nikl.script.parser.Value;

/** The {@code "regex"} import, backed by {@link java.util.regex}. */
public final class RegexModule {

    private RegexModule() {}

    public static Value create() {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        // Array of the whole match and every group, Null for groups that did not take part
        fns.put("match", args -> {
            requireArgs("match", args, 2);
            Matcher m = compile(str("match", args, 0)).matcher(str("match", args, 1));
            if (!m.find()) return Value.nil();
            List<Value> groups = new ArrayList<>(m.groupCount() + 1);
            for (int i = 0; i <= m.groupCount(); i++) {
                String g = m.group(i);
                groups.add(g == null ? Value.nil() : Value.string(g));
            }
            return Value.array(Collections.unmodifiableList(groups));
        });

        fns.put("is_match", args -> {
            requireArgs("is_match", args, 2);
            return Value.bool(compile(str("is_match", args, 0)).matcher(str("is_match", args, 1)).find());
        });

        fns.put("find_all", args -> {
            requireArgs("find_all", args, 2);
            Matcher m = compile(str("find_all", args, 0)).matcher(str("find_all", args, 1));
            List<Value> found = new ArrayList<>();
            while (m.find()) found.add(Value.string(m.group()));
            return Value.array(Collections.unmodifiableList(found));
        });

        fns.put("replace", args -> {
            requireArgs("replace", args, 3);
            Pattern p = compile(str("replace", args, 0));
            String replacement = str("replace", args, 1);
            String text = str("replace", args, 2);
            try {
                return Value.string(p.matcher(text).replaceAll(replacement));
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new RuntimeError("regex error: invalid replacement '" + replacement + "': " + e.getMessage(), e);
            }
        });

        return Args.module(fns);
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new RuntimeError("regex error: " + e.getDescription() + " in pattern '" + pattern + "'", e);
        }
    }
}
