package com.liferx.brain.model;

/**
 * Partial tool call carried by one stream chunk. Fragments sharing an index
 * belong to the same call; any field may be null on a continuation fragment.
 */
public record ToolCallFragment(int index, String id, String name, String arguments) {
}
