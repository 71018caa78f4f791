package com.bashnorm.normalize;

import com.bashnorm.grammar.ArgSlot;
import com.bashnorm.grammar.ArgType;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.EnumSet;
import java.util.Set;

/**
 * Positional argument slots of one command being normalized. Singleton slots
 * are filled by the first argument classified as their type; list slots never fill.
 */
final class ArgumentSlots {
    private final ImmutableList<ArgSlot> slots;
    private final boolean[] filled;

    ArgumentSlots(ImmutableList<ArgSlot> slots) {
        this.slots = slots;
        this.filled = new boolean[slots.size()];
    }

    Set<ArgType> openTypes() {
        Set<ArgType> open = EnumSet.noneOf(ArgType.class);
        for (int i = 0; i < slots.size(); i++) {
            if (isOpen(i)) {
                open.add(slots.get(i).type());
            }
        }
        return open;
    }

    boolean expecting(ArgType type) {
        for (int i = 0; i < slots.size(); i++) {
            if (isOpen(i) && slots.get(i).type() == type) {
                return true;
            }
        }
        return false;
    }

    void fill(ArgType type) {
        for (int i = 0; i < slots.size(); i++) {
            ArgSlot slot = slots.get(i);
            if (slot.type() == type && !slot.list() && !filled[i]) {
                filled[i] = true;
                return;
            }
        }
    }

    private boolean isOpen(int index) {
        return slots.get(index).list() || !filled[index];
    }
}
