package com.storyloop.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.io.UncheckedIOException;

/**
 * Runs the {@code storyloop} command tree once at startup and hands its exit code to Spring Boot.
 * Commands report expected failures through their own exit codes; anything that escapes a
 * command is printed as a one-line error instead of a picocli stack trace.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_IO_ERROR = 3;

    private final StoryloopCommand storyloopCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(StoryloopCommand storyloopCommand, IFactory factory) {
        this.storyloopCommand = storyloopCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(storyloopCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.debug("Command {} failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(String.valueOf(e.getMessage()));
                    return e instanceof UncheckedIOException ? EXIT_IO_ERROR : 1;
                });
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
