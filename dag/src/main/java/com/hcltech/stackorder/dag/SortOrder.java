package com.hcltech.stackorder.dag;

public enum SortOrder {
    /** Dependencies first: the apply order. */
    FORWARD,
    /** Exact reverse of {@link #FORWARD}: the destroy order. */
    REVERSE
}
