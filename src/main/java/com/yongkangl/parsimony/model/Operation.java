package com.yongkangl.parsimony.model;

/**
 * How the bottom-up pass combined the children of an internal node.
 */
public enum Operation {
    INTERSECT,
    UNION
}
