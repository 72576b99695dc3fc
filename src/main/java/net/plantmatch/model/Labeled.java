package net.plantmatch.model;

/**
 * Catalog vocabulary with a human-readable label for explanations and option lists.
 */
public interface Labeled {

    String getLabel();
}
