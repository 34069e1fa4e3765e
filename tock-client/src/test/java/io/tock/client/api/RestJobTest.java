package io.tock.client.api;

import java.time.Instant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class RestJobTest
{
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new GuavaModule())
        .registerModule(new JacksonTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Test
    public void serializeWithSnakeCaseNames()
            throws Exception
    {
        RestJob job = RestJob.builder()
            .id("a1")
            .name("report")
            .command("/bin/echo hi")
            .schedule("R/2030-01-01T00:00:00Z/PT1H")
            .retries(2)
            .addParentJobs("p1")
            .successCount(3)
            .lastSuccess(Instant.parse("2030-01-01T01:00:00Z"))
            .build();

        JsonNode node = mapper.valueToTree(job);
        assertThat(node.get("name").asText(), is("report"));
        assertThat(node.get("parent_jobs").get(0).asText(), is("p1"));
        assertThat(node.get("dependent_jobs").size(), is(0));
        assertThat(node.get("success_count").asLong(), is(3L));
        assertThat(node.get("last_success").asText(), is("2030-01-01T01:00:00Z"));
        assertThat(node.get("error_count").asLong(), is(0L));
        assertThat(node.get("disabled").asBoolean(), is(false));
    }

    @Test
    public void deserializeWithDefaults()
            throws Exception
    {
        String json = "{\"id\":\"a1\",\"name\":\"report\",\"command\":\"/bin/true\","
            + "\"dependent_jobs\":[\"b\"],\"parent_jobs\":[],"
            + "\"last_error\":\"2030-01-01T00:00:00+09:00\",\"unknown_field\":1}";

        RestJob job = mapper.readValue(json, RestJob.class);
        assertThat(job.getOwner(), is(""));
        assertThat(job.getSchedule(), is(""));
        assertThat(job.getRetries(), is(0));
        assertThat(job.getDependentJobs(), is(ImmutableList.of("b")));
        assertThat(job.getLastError(), is(Optional.of(Instant.parse("2029-12-31T15:00:00Z"))));
        assertThat(job.getLastSuccess(), is(Optional.<Instant>absent()));
    }

    @Test
    public void readBackWhatWasWritten()
            throws Exception
    {
        RestJob job = RestJob.builder()
            .id("x")
            .name("n")
            .command("c")
            .owner("ops@example.com")
            .disabled(true)
            .errorCount(5)
            .lastAttemptedRun(Instant.parse("2030-05-01T12:30:00Z"))
            .build();

        assertThat(mapper.readValue(mapper.writeValueAsString(job), RestJob.class), is(job));
    }
}
