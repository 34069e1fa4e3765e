package io.tock.standards.command;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.tock.spi.CommandExecutor;

public class CommandExecutorModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(CommandExecutor.class).to(ProcessCommandExecutor.class).in(Scopes.SINGLETON);
    }
}
