package io.tock.spi;

public interface JobIdGenerator
{
    String generate();
}
