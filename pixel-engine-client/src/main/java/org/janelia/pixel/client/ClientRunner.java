package org.janelia.pixel.client;

import org.janelia.pixel.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 * Invalid input (an {@link IllegalArgumentException} from the client) exits with
 * {@link #INVALID_INPUT_STATUS} so that scripts can tell bad specifications apart from processing failures.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;
    public static final int INVALID_INPUT_STATUS = 2;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting status.
     */
    public void run() {
        System.exit(runForStatus());
    }

    /**
     * Wraps a run with consistent log statements.
     *
     * @return {@link #SUCCESS_STATUS}, {@link #INVALID_INPUT_STATUS} or {@link #FAILURE_STATUS}.
     */
    public int runForStatus() {

        LOG.info("runForStatus: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status;
        try {
            runClient(args);
            status = SUCCESS_STATUS;
        } catch (final IllegalArgumentException e) {
            LOG.error("runForStatus: invalid input", e);
            status = INVALID_INPUT_STATUS;
        } catch (final Throwable t) {
            LOG.error("runForStatus: caught exception", t);
            status = FAILURE_STATUS;
        }

        LOG.info("runForStatus: exit, status {} after {}", status, processTimer);

        return status;
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

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
