package io.tock.core.agent;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.tock.client.api.RestJob;
import io.tock.core.ErrorReporter;
import io.tock.core.job.Job;
import io.tock.core.job.JobDefinition;
import io.tock.core.store.MemoryJobStore;
import io.tock.spi.CommandExecutionException;
import io.tock.spi.CommandExecutor;
import io.tock.spi.CommandRequest;
import io.tock.spi.CommandStatus;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.Silent.class)
public class JobRunnerTest
{
    @Mock CommandExecutor executor;
    @Mock DependencyPropagator propagator;

    private MemoryJobStore store;
    private JobWorkerPool workerPool;
    private JobRunner runner;

    @Before
    public void setUp()
    {
        ExecutorConfig config = ExecutorConfig.defaultBuilder()
            .commandTimeoutSeconds(60)
            .build();
        store = new MemoryJobStore();
        workerPool = new JobWorkerPool(config, ErrorReporter.empty());
        runner = new JobRunner(executor, workerPool, propagator, store, config);
    }

    @After
    public void tearDown()
            throws Exception
    {
        workerPool.shutdown(Optional.of(Duration.ofSeconds(5)));
    }

    private static Job job(int retries)
    {
        return Job.of("job-1", JobDefinition.builder()
                .name("report")
                .command("bash  /path/to/script.sh --verbose")
                .retries(retries)
                .build());
    }

    @Test
    public void successfulRun()
            throws Exception
    {
        when(executor.run(any(CommandRequest.class))).thenReturn(CommandStatus.of(0));
        Job job = job(0);

        assertThat(runner.run(job, RunTrigger.MANUAL), is(true));

        ArgumentCaptor<CommandRequest> request = ArgumentCaptor.forClass(CommandRequest.class);
        verify(executor).run(request.capture());
        assertThat(request.getValue().getCommandLine(), is(ImmutableList.of("bash", "/path/to/script.sh", "--verbose")));
        assertThat(request.getValue().getJobId(), is("job-1"));
        assertThat(request.getValue().getTimeout(), is(Optional.of(Duration.ofSeconds(60))));

        assertThat(job.getSuccessCount(), is(1L));
        assertThat(job.getErrorCount(), is(0L));
        assertThat(job.getLastSuccess().isPresent(), is(true));
        assertThat(job.getLastAttemptedRun().isPresent(), is(true));
        verify(propagator).propagate(job);

        RestJob saved = store.getJobs().get(0);
        assertThat(saved.getSuccessCount(), is(1L));
    }

    @Test
    public void failedRunIsRetriedThenCountedOnce()
            throws Exception
    {
        when(executor.run(any(CommandRequest.class))).thenReturn(CommandStatus.of(1));
        Job job = job(2);

        assertThat(runner.run(job, RunTrigger.SCHEDULE), is(false));

        verify(executor, times(3)).run(any(CommandRequest.class));
        assertThat(job.getErrorCount(), is(1L));
        assertThat(job.getSuccessCount(), is(0L));
        assertThat(job.getLastError().isPresent(), is(true));
        assertThat(job.getLastSuccess().isPresent(), is(false));
        verify(propagator, never()).propagate(any(Job.class));

        assertThat(store.getJobs().get(0).getErrorCount(), is(1L));
    }

    @Test
    public void executionExceptionIsAFailure()
            throws Exception
    {
        when(executor.run(any(CommandRequest.class)))
            .thenThrow(new CommandExecutionException("No such file"))
            .thenReturn(CommandStatus.of(0));
        Job job = job(1);

        assertThat(runner.run(job, RunTrigger.ONE_OFF), is(true));

        verify(executor, times(2)).run(any(CommandRequest.class));
        assertThat(job.getSuccessCount(), is(1L));
        assertThat(job.getErrorCount(), is(0L));
        assertThat(job.getLastError().isPresent(), is(true));
        verify(propagator).propagate(job);
    }

    @Test
    public void disabledJobDoesNotRun()
            throws Exception
    {
        Job job = job(0);
        job.disable();

        assertThat(runner.run(job, RunTrigger.DEPENDENCY), is(false));

        verifyNoInteractions(executor);
        verifyNoInteractions(propagator);
        assertThat(job.getLastAttemptedRun().isPresent(), is(false));
        assertThat(store.getJobs().isEmpty(), is(true));
    }

    @Test
    public void submitRunsOnWorkerPool()
            throws Exception
    {
        when(executor.run(any(CommandRequest.class))).thenReturn(CommandStatus.of(0));
        Job job = job(0);

        assertThat(runner.submit(job, RunTrigger.MANUAL), is(true));
        verify(propagator, timeout(5000)).propagate(job);
        assertThat(job.getSuccessCount(), is(1L));
    }

    @Test
    public void runtimeExceptionCountsAsFailedAttempt()
            throws Exception
    {
        when(executor.run(any(CommandRequest.class)))
            .thenThrow(new IllegalStateException("plugin bug"));
        Job job = job(1);

        assertThat(runner.run(job, RunTrigger.SCHEDULE), is(false));

        verify(executor, times(2)).run(any(CommandRequest.class));
        assertThat(job.getErrorCount(), is(1L));
        assertThat(job.getSuccessCount(), is(0L));
        assertThat(job.getLastError().isPresent(), is(true));
        verify(propagator, never()).propagate(any(Job.class));
        assertThat(store.getJobs().get(0).getErrorCount(), is(1L));
    }

    @Test
    public void resultOfDeletedJobIsDropped()
            throws Exception
    {
        Job job = job(0);
        when(executor.run(any(CommandRequest.class))).thenAnswer((invocation) -> {
            job.deleteFrom(store);
            return CommandStatus.of(0);
        });

        assertThat(runner.run(job, RunTrigger.MANUAL), is(false));

        assertThat(store.getJobs().isEmpty(), is(true));
        verifyNoInteractions(propagator);
    }

    @Test
    public void overlappingSubmitsAreMerged()
            throws Exception
    {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(executor.run(any(CommandRequest.class))).thenAnswer((invocation) -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return CommandStatus.of(0);
        });
        Job job = job(0);

        assertThat(runner.submit(job, RunTrigger.SCHEDULE), is(true));
        assertThat(started.await(10, TimeUnit.SECONDS), is(true));

        // one waits behind the running occurrence, the rest merge into it
        assertThat(runner.submit(job, RunTrigger.SCHEDULE), is(true));
        assertThat(runner.submit(job, RunTrigger.MANUAL), is(true));
        assertThat(runner.submit(job, RunTrigger.DEPENDENCY), is(true));
        release.countDown();

        verify(propagator, timeout(5000).times(2)).propagate(job);
        Thread.sleep(300);
        verify(executor, times(2)).run(any(CommandRequest.class));
        assertThat(job.getSuccessCount(), is(2L));
    }
}
