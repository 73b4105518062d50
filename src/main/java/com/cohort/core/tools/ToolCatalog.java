package com.cohort.core.tools;

/**
 * Which agents may call a tool.
 */
public enum ToolCatalog {
    LEAD,
    SUBORDINATE,
    BOTH;

    public boolean allows(boolean isLead) {
        return this == BOTH || (isLead ? this == LEAD : this == SUBORDINATE);
    }
}
