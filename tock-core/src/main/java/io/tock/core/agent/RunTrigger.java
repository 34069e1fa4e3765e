package io.tock.core.agent;

/**
 * Why a run started. Only {@link #SCHEDULE} runs consume schedule repeats.
 */
public enum RunTrigger
{
    SCHEDULE,
    ONE_OFF,
    DEPENDENCY,
    MANUAL;
}
