package com.ttennebkram.filtergraph.render;

import com.ttennebkram.filtergraph.document.NodeHandle;

import java.util.Objects;

/**
 * Slot marker under the pointer.
 */
public final class SlotHit {
    private final NodeHandle node;
    private final int position;
    private final int slot;

    public SlotHit(NodeHandle node, int position, int slot) {
        this.node = node;
        this.position = position;
        this.slot = slot;
    }

    public NodeHandle getNode() {
        return node;
    }

    public int getPosition() {
        return position;
    }

    public int getSlot() {
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotHit)) return false;
        SlotHit other = (SlotHit) o;
        return position == other.position && slot == other.slot && Objects.equals(node, other.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, position, slot);
    }

    @Override
    public String toString() {
        return "SlotHit(" + node + " @" + position + " slot " + slot + ")";
    }
}
