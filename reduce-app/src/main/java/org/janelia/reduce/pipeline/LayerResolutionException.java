package org.janelia.reduce.pipeline;

/**
 * Indicates that no acceptable version could be found for a layer.
 *
 * @author Eric Trautman
 */
public class LayerResolutionException
        extends Exception {

    public LayerResolutionException(final String message) {
        super(message);
    }
}
