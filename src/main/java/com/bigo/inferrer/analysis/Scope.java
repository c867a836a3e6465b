package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.VariableState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical region whose variable states are tracked together: a function body
 * or a loop body. A loop-body scope starts empty, so the states tracked in it
 * describe what one iteration does to each variable.
 */
public final class Scope {

    private final String name;
    private final Scope parent;
    private final Map<String, VariableState> entryStates;

    private Scope(String name, Scope parent, Map<String, VariableState> entryStates) {
        this.name = name;
        this.parent = parent;
        this.entryStates = Collections.unmodifiableMap(new LinkedHashMap<>(entryStates));
    }

    public static Scope function(String name) {
        return new Scope(name, null, Map.of());
    }

    /**
     * A scope entered with the given states already known.
     */
    public Scope withStates(Map<String, VariableState> states) {
        return new Scope(name, parent, states);
    }

    /**
     * A nested loop-body scope, starting with no known states.
     */
    public Scope loopBody(String loopName) {
        return new Scope(name + "/" + loopName, this, Map.of());
    }

    public String getName() {
        return name;
    }

    public Optional<Scope> getParent() {
        return Optional.ofNullable(parent);
    }

    public Map<String, VariableState> getEntryStates() {
        return entryStates;
    }

    public boolean isLoopBody() {
        return parent != null;
    }

    @Override
    public String toString() {
        return "Scope{" + name + ", " + entryStates + "}";
    }
}
