package org.janelia.reduce.client;

import org.janelia.reduce.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Wraps a run with consistent log statements and exits the JVM with status 0 for success
     * or 1 for any failure.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * @return process exit status for the wrapped client.
     */
    public int runWithoutExit() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitStatus;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            exitStatus = 0;
        } catch (final ClientAbortException e) {
            LOG.warn("run: {}", e.getMessage());
            LOG.info("run: exit, processing aborted after {}", processTimer);
            exitStatus = 1;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitStatus = 1;
        }

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    /**
     * Expected condition that stops a client before it does any work (e.g. missing input data).
     * Logged as a warning instead of an error.
     */
    public static class ClientAbortException
            extends Exception {

        public ClientAbortException(final String message) {
            super(message);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
