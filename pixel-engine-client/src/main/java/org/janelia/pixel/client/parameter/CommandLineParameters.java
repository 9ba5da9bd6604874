package org.janelia.pixel.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.pixel.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all command line tools.
 *
 * Subclasses declare their JCommander options as public fields and may override {@link #validate()}
 * to reject option combinations that JCommander cannot check on its own.
 *
 * @author Eric Trautman
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses the arguments and exits the JVM if they are invalid or help was requested.
     */
    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                 command line arguments.
     * @param  programClass         class named in the usage message (null for this class).
     * @param  exitOnHelpOrFailure  if true, exit the JVM after printing usage.
     *
     * @return true if the arguments were parsed and validated and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        final JCommander jCommander = new JCommander(this);
        final Class<?> namedClass = programClass == null ? getClass() : programClass;
        jCommander.setProgramName("java -cp pixel-engine-client-standalone.jar " + namedClass.getName());

        String failureMessage = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException | IllegalArgumentException e) {
            failureMessage = e.getMessage();
        } catch (final Throwable t) {
            LOG.error("failed to parse command line arguments", t);
            failureMessage = String.valueOf(t.getMessage());
        }

        final boolean parseFailed = failureMessage != null;
        if (help || parseFailed) {
            if (parseFailed) {
                jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + failureMessage);
            }
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return ! (help || parseFailed);
    }

    /**
     * Checks parsed option values.
     *
     * @throws IllegalArgumentException
     *   if any value is invalid.
     */
    protected void validate() throws IllegalArgumentException {
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Prints usage for the specified parameters (without exiting), for tests.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
