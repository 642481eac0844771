package org.cinder.compiler.frontend.semantics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The variables visible while one function body or one file's top level is lowered.
 * <p>
 * Slots are handed out densely in declaration order and never reused. A declaration shadows any
 * existing binding of the same name; every block keeps an undo log of what it shadowed and puts
 * it back when the block is left.
 */
public class SlotScope {

    private record Shadowed(String name, Integer previousSlot) {}

    private final Map<String, Integer> bindings = new HashMap<>();
    private final Deque<List<Shadowed>> blocks = new ArrayDeque<>();
    private int slotCount = 0;

    /**
     * Creates a scope with its outermost block open.
     */
    public SlotScope() {
        blocks.push(new ArrayList<>());
    }

    /**
     * Binds {@code name} to a fresh slot in the innermost block.
     * @param name The variable name.
     * @return The new slot.
     */
    public int declare(String name) {
        int slot = slotCount++;
        Integer previous = bindings.put(name, slot);
        blocks.peek().add(new Shadowed(name, previous));
        return slot;
    }

    /**
     * @param name The variable name.
     * @return The slot currently bound to {@code name}, or null if there is none.
     */
    public Integer lookup(String name) {
        return bindings.get(name);
    }

    /**
     * Opens a nested block.
     */
    public void enterBlock() {
        blocks.push(new ArrayList<>());
    }

    /**
     * Closes the innermost block and restores every binding it shadowed.
     * @throws IllegalStateException if only the outermost block is open.
     */
    public void leaveBlock() {
        if (blocks.size() == 1) {
            throw new IllegalStateException("The outermost block cannot be left");
        }
        List<Shadowed> log = blocks.pop();
        for (int i = log.size() - 1; i >= 0; i--) {
            Shadowed shadowed = log.get(i);
            if (shadowed.previousSlot() == null) {
                bindings.remove(shadowed.name());
            } else {
                bindings.put(shadowed.name(), shadowed.previousSlot());
            }
        }
    }

    /**
     * @return true while no nested block is open.
     */
    public boolean isOutermost() {
        return blocks.size() == 1;
    }

    /**
     * @return The number of slots handed out so far.
     */
    public int slotCount() {
        return slotCount;
    }

    /**
     * @return The bindings visible right now.
     */
    public Map<String, Integer> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
