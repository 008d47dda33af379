package com.vidnyan.playscan.domain.raw;

import com.vidnyan.playscan.domain.model.Location;

import java.util.List;

/**
 * Sequence node.
 */
public record RawSequence(
    List<RawNode> items,
    Location location
) implements RawNode {

    public RawSequence {
        items = List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Object toPlainValue() {
        return items.stream().map(RawNode::toPlainValue).toList();
    }
}
