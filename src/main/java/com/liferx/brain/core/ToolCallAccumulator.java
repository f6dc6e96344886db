package com.liferx.brain.core;

import com.liferx.brain.model.ToolCallFragment;
import com.liferx.brain.model.ToolCallRef;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reassembles tool calls from indexed stream fragments.
 *
 * The first fragment seen for an index opens the call; later fragments for
 * the same index append whatever id, name or argument text they carry.
 * Calls come out in index order.
 */
public class ToolCallAccumulator {

    private final Map<Integer, Partial> partials = new TreeMap<>();

    public void accept(ToolCallFragment fragment) {
        Partial partial = partials.computeIfAbsent(fragment.index(), i -> new Partial());
        if (fragment.id() != null) partial.id.append(fragment.id());
        if (fragment.name() != null) partial.name.append(fragment.name());
        if (fragment.arguments() != null) partial.arguments.append(fragment.arguments());
    }

    public boolean isEmpty() {
        return partials.isEmpty();
    }

    /** Every buffered call, valid or not, with its arguments finalized. */
    public List<ToolCallRef> drain() {
        List<ToolCallRef> refs = partials.values().stream()
                .map(p -> new ToolCallRef(p.id.toString(), p.name.toString(), p.arguments.toString()))
                .toList();
        partials.clear();
        return refs;
    }

    private static final class Partial {
        private final StringBuilder id = new StringBuilder();
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();
    }
}
