package io.tock.standards.command;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.tock.spi.CommandExecutionException;
import io.tock.spi.CommandExecutor;
import io.tock.spi.CommandRequest;
import io.tock.spi.CommandStatus;
import io.tock.spi.CommandTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs commands as local processes.
 *
 * stdout and stderr are merged and copied line by line to the log. The
 * calling thread blocks until the process exits or the request's timeout
 * passes, in which case the process is killed.
 */
public class ProcessCommandExecutor
        implements CommandExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    private static final long OUTPUT_DRAIN_WAIT_SECONDS = 5;

    private final ExecutorService outputCopier;

    @Inject
    public ProcessCommandExecutor()
    {
        this.outputCopier = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("command-output-%d")
                .build()
                );
    }

    @Override
    public CommandStatus run(CommandRequest request)
        throws CommandExecutionException
    {
        String executable = request.getCommandLine().get(0);

        ProcessBuilder pb = new ProcessBuilder(request.getCommandLine());
        pb.redirectErrorStream(true);

        final Process p;
        try {
            p = pb.start();
        }
        catch (IOException ex) {
            throw new CommandExecutionException("Failed to start command '" + executable + "'", ex);
        }
        logger.debug("Started command {} of job {}", request.getCommandLine(), request.getJobName());

        Future<?> output = outputCopier.submit(() -> copyOutput(request.getJobName(), p));

        try {
            if (request.getTimeout().isPresent()) {
                Duration timeout = request.getTimeout().get();
                if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    p.destroyForcibly();
                    throw new CommandTimeoutException(
                            String.format("Command '%s' didn't finish within %s", executable, timeout),
                            timeout);
                }
            }
            else {
                p.waitFor();
            }
        }
        catch (InterruptedException ex) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Interrupted while waiting for command '" + executable + "'", ex);
        }

        awaitOutput(request.getJobName(), output);
        return CommandStatus.of(p.exitValue());
    }

    private static void copyOutput(String jobName, Process p)
    {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(p.getInputStream(), UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.info("{}: {}", jobName, line);
            }
        }
        catch (IOException ex) {
            // the stream is closed when a killed process goes away
            logger.debug("Stopped reading output of job {}", jobName, ex);
        }
    }

    private static void awaitOutput(String jobName, Future<?> output)
    {
        try {
            output.get(OUTPUT_DRAIN_WAIT_SECONDS, TimeUnit.SECONDS);
        }
        catch (TimeoutException ex) {
            // a child process may still hold the pipe open
            logger.warn("Output of job {} is still open after the command exited. Not waiting for it", jobName);
        }
        catch (ExecutionException ex) {
            logger.warn("Failed to copy output of job {}", jobName, ex.getCause());
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
