package com.liferx.brain.tool;

/**
 * Bean whose only property points back at itself; Jackson refuses to
 * serialize it.
 */
public class SelfReferencingData {

    public String getName() {
        return "loop";
    }

    public SelfReferencingData getSelf() {
        return this;
    }
}
