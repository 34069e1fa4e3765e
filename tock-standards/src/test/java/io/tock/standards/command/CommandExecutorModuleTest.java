package io.tock.standards.command;

import com.google.common.collect.ImmutableList;
import io.tock.core.TockEmbed;
import io.tock.core.job.Job;
import io.tock.core.job.JobDefinition;
import io.tock.spi.CommandExecutor;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class CommandExecutorModuleTest
{
    @Test
    public void runJobsAsProcesses()
            throws Exception
    {
        try (TockEmbed tock = new TockEmbed.Bootstrap()
                .addModules(new CommandExecutorModule())
                .initialize()) {
            assertThat(tock.getInjector().getInstance(CommandExecutor.class), instanceOf(ProcessCommandExecutor.class));

            Job ok = tock.getJobEngine().create(JobDefinition.builder()
                    .name("ok")
                    .command("true")
                    .build());
            Job ng = tock.getJobEngine().create(JobDefinition.builder()
                    .name("ng")
                    .command("false")
                    .retries(1)
                    .build());
            Job after = tock.getJobEngine().create(JobDefinition.builder()
                    .name("after")
                    .command("sh -c exit")
                    .parentJobs(ImmutableList.of(ok.getId()))
                    .build());

            long deadline = System.currentTimeMillis() + 10000;
            while (ng.getErrorCount() == 0 || ok.getSuccessCount() == 0) {
                if (System.currentTimeMillis() > deadline) {
                    fail("Timed out");
                }
                Thread.sleep(50);
            }
            assertThat(ok.getSuccessCount(), is(1L));
            assertThat(ng.getErrorCount(), is(1L));
            assertThat(ng.getSuccessCount(), is(0L));
            assertThat(after.getParentJobs(), is(ImmutableList.of(ok.getId())));
        }
    }
}
