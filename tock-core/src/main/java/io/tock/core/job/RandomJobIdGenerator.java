package io.tock.core.job;

import java.util.UUID;
import io.tock.spi.JobIdGenerator;

public class RandomJobIdGenerator
        implements JobIdGenerator
{
    @Override
    public String generate()
    {
        return UUID.randomUUID().toString();
    }
}
