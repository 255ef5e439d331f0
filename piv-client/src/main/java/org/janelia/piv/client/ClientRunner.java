package org.janelia.piv.client;

import org.janelia.piv.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Absence of the standard exit log message indicates that a client
 * was terminated abnormally (e.g. by a cluster scheduler).
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
     * Wraps a run with consistent log statements and exits with 0 on success or 1 on failure.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * @return process exit code (0 if the client completed successfully, 1 otherwise).
     */
    public int runWithoutExit() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitCode;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            exitCode = 0;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitCode = 1;
        }

        return exitCode;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception ;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
