package org.Aayush.wfst.algorithm;

/**
 * Side kept by projection.
 */
public enum ProjectType {
    INPUT,
    OUTPUT
}
