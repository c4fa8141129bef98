package org.janelia.reduce.layout;

/**
 * Indicates that the output project folder could not be staged, so no layer can be processed.
 *
 * @author Eric Trautman
 */
public class StagingException
        extends Exception {

    public StagingException(final String message) {
        super(message);
    }

    public StagingException(final String message,
                            final Throwable cause) {
        super(message, cause);
    }
}
