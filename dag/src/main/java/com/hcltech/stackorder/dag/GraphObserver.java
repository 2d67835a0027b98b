package com.hcltech.stackorder.dag;

/**
 * Receives graph construction events, for example to draw the graph. Observers must not mutate the
 * graph; the graph behaves identically with or without one.
 */
public interface GraphObserver {

    GraphObserver NONE = new GraphObserver() {};

    default void onNodeCreated(StackNode node) {}

    default void onEdgeAdded(StackNode from, StackNode to) {}
}
