package org.janelia.reduce.pipeline;

/**
 * Processing states for one layer unit.
 * Units move forward through the states in declaration order until they are
 * {@link #DONE}, or move to {@link #FAILED} from any earlier state.
 *
 * @author Eric Trautman
 */
public enum LayerState {
    PENDING,
    RESOLVING,
    CLASSIFYING,
    REWRITING,
    DONE,
    FAILED
}
