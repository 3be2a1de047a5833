package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Assigns small positive IDs to the macros tested by conditional directives, in
 * discovery order starting at 1. Every later reference to the same name resolves to
 * the same ID.
 */
public final class MacroIdTable {

    /** Default number of distinct conditional macros accepted per file. */
    public static final int DEFAULT_MAX_MACROS = 128;

    private final Map<String, Integer> ids = new LinkedHashMap<>();
    private final int maxMacros;

    /**
     * @param maxMacros The maximum number of distinct macros; must be positive.
     */
    public MacroIdTable(int maxMacros) {
        if (maxMacros <= 0) {
            throw new IllegalArgumentException("maxMacros must be positive, got " + maxMacros);
        }
        this.maxMacros = maxMacros;
    }

    /**
     * Returns the ID of the macro named by the token, assigning the next free ID if the
     * name has not been seen before.
     * @param macroName The macro name token.
     * @return The macro ID.
     * @throws MacroLimitExceededException if a new ID would exceed the limit.
     */
    public int resolveOrAssign(Token macroName) {
        Integer existing = ids.get(macroName.text());
        if (existing != null) {
            return existing;
        }
        if (ids.size() >= maxMacros) {
            throw new MacroLimitExceededException(macroName, maxMacros);
        }
        int id = ids.size() + 1;
        ids.put(macroName.text(), id);
        return id;
    }

    /**
     * Looks up an already assigned ID.
     * @param name The macro name.
     * @return The ID, or empty if the name was never assigned.
     */
    public OptionalInt idOf(String name) {
        Integer id = ids.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public int size() {
        return ids.size();
    }

    /**
     * @return Name to ID, in discovery order.
     */
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(ids);
    }
}
