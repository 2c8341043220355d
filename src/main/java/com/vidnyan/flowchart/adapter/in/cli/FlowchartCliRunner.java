package com.vidnyan.flowchart.adapter.in.cli;

import com.vidnyan.flowchart.domain.select.SelectionException;
import com.vidnyan.flowchart.domain.syntax.SourceSyntaxException;
import com.vidnyan.flowchart.domain.translate.ScopeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Runs {@link FlowchartCommand} with the process arguments and keeps its exit code
 * for {@code SpringApplication.exit}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowchartCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_SELECTION = 3;
    static final int EXIT_SCOPE = 4;
    static final int EXIT_SYNTAX = 5;

    private static final Pattern SPRING_PROPERTY = Pattern.compile("--[\\w-]+(\\.[\\w-]+)+=.*");

    private final FlowchartCommand command;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(commandArguments(args));
        log.debug("Finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            String message = ex instanceof NoSuchFileException ? "no such file: " + ex.getMessage() : ex.getMessage();
            cmd.getErr().println("error: " + message);
            log.debug("Translation failed", ex);
            return exitCodeOf(ex);
        });
        return commandLine;
    }

    /** Drops {@code --some.property=value} arguments, which Spring has already bound. */
    static String[] commandArguments(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !SPRING_PROPERTY.matcher(arg).matches())
                .toArray(String[]::new);
    }

    static int exitCodeOf(Throwable error) {
        if (error instanceof SelectionException) {
            return EXIT_SELECTION;
        }
        if (error instanceof ScopeException) {
            return EXIT_SCOPE;
        }
        if (error instanceof SourceSyntaxException) {
            return EXIT_SYNTAX;
        }
        return EXIT_FAILURE;
    }
}
