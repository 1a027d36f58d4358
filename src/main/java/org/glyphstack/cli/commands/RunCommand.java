package org.glyphstack.cli.commands;

import com.typesafe.config.ConfigException;
import org.glyphstack.assembler.Assembler;
import org.glyphstack.assembler.AssemblyException;
import org.glyphstack.cli.CommandLineInterface;
import org.glyphstack.runtime.RunResult;
import org.glyphstack.runtime.RuntimeOptions;
import org.glyphstack.runtime.VirtualMachine;
import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.io.StreamIoAdapter;
import org.glyphstack.runtime.isa.Program;
import org.glyphstack.runtime.model.FaultKind;
import org.glyphstack.runtime.model.RationalBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Assembles a program listing and runs it.")
public class RunCommand implements Callable<Integer> {

    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_LOAD_ERROR = 1;
    public static final int EXIT_ABORTED = 2;
    public static final int EXIT_STEP_LIMIT = 3;
    public static final int EXIT_IO_ERROR = 4;

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "The program listing to run.")
    private File file;

    @Option(names = {"-b", "--backend"}, description = "Numeric backend: bounded or arbitrary-precision (default from config).")
    private String backend;

    @Option(names = "--max-steps", description = "Stop after this many instructions; 0 means no limit (default from config).")
    private Long maxSteps;

    @Option(names = "--trace", description = "Log every executed instruction at DEBUG.")
    private boolean trace;

    @Option(names = {"-i", "--input"}, description = "Read program input from this file instead of stdin.")
    private File input;

    @Option(names = {"-q", "--quiet"}, description = "Do not report the run result on stderr.")
    private boolean quiet;

    @Override
    public Integer call() throws IOException {
        final PrintWriter err = spec.commandLine().getErr();

        final RuntimeOptions options;
        try {
            options = resolveOptions();
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            return EXIT_LOAD_ERROR;
        }

        final Program program;
        try {
            final Assembler assembler = new Assembler();
            program = assembler.assemble(file.toPath());
            assembler.getDiagnostics().getDiagnostics().forEach(err::println);
        } catch (AssemblyException e) {
            LOG.error("Failed to load program {}", file);
            err.println(e.getMessage());
            return EXIT_LOAD_ERROR;
        }

        if (input != null && !input.isFile()) {
            err.println("error: input file not found: " + input);
            return EXIT_LOAD_ERROR;
        }

        final PrintWriter out = spec.commandLine().getOut();
        try (Reader in = openInput()) {
            final StreamIoAdapter io = new StreamIoAdapter(in, out);
            final ExecutionContext context = new ExecutionContext(options.backend(), io);
            final VirtualMachine vm = new VirtualMachine(program, context);
            vm.setTraceEnabled(options.traceEnabled());

            final Optional<RunResult> result = execute(vm, options.maxSteps());
            io.flush();
            checkOutput(out);
            return report(result, vm, err);
        } catch (UncheckedIOException e) {
            LOG.error("I/O failure while running {}", file, e);
            err.println("error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    /**
     * A {@link PrintWriter} records write failures instead of throwing them.
     * @throws UncheckedIOException if any write to {@code out} failed.
     */
    private static void checkOutput(final PrintWriter out) {
        if (out.checkError()) {
            throw new UncheckedIOException(new IOException("Failed to write program output"));
        }
    }

    private RuntimeOptions resolveOptions() {
        RuntimeOptions options = RuntimeOptions.fromConfig(parent.getConfig());
        if (backend != null) {
            options = options.withBackend(RationalBackend.fromConfigValue(backend));
        }
        if (maxSteps != null) {
            options = options.withMaxSteps(maxSteps);
        }
        if (trace) {
            options = options.withTraceEnabled(true);
        }
        return options;
    }

    private Reader openInput() throws IOException {
        if (input != null) {
            return Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8);
        }
        return new InputStreamReader(System.in, StandardCharsets.UTF_8) {
            @Override
            public void close() {
                // stdin is not ours to close
            }
        };
    }

    /**
     * Drives the machine until it finishes or the step limit is hit.
     * @return The run result, or empty if the step limit stopped the run.
     */
    private static Optional<RunResult> execute(final VirtualMachine vm, final long maxSteps) {
        if (maxSteps <= 0) {
            return Optional.of(vm.run());
        }
        while (vm.getStepsExecuted() < maxSteps) {
            final Optional<RunResult> result = vm.step();
            if (result.isPresent()) {
                return result;
            }
        }
        // running off the end exactly at the limit still counts as completion
        if (!vm.getProgram().isInRange(vm.getPointer())) {
            return vm.step();
        }
        return Optional.empty();
    }

    private int report(final Optional<RunResult> result, final VirtualMachine vm, final PrintWriter err) {
        final long curses = vm.getContext().getCurses().total();
        final Map<FaultKind, Long> breakdown = vm.getContext().getCurses().breakdown();
        if (result.isEmpty()) {
            LOG.warn("Step limit of {} reached at instruction {}", vm.getStepsExecuted(), vm.getPointer());
            if (!quiet) {
                err.printf("step limit reached after %d steps, curses: %d %s%n", vm.getStepsExecuted(), curses, breakdown);
            }
            return EXIT_STEP_LIMIT;
        }
        if (result.get() instanceof RunResult.Aborted aborted) {
            if (!quiet) {
                err.printf("aborted: instruction %d jumps to invalid target %d, curses: %d %s%n",
                        aborted.instructionIndex(), aborted.target(), aborted.curses(), breakdown);
            }
            return EXIT_ABORTED;
        }
        if (!quiet) {
            err.printf("completed after %d steps, curses: %d %s%n", vm.getStepsExecuted(), result.get().curses(), breakdown);
        }
        return EXIT_COMPLETED;
    }
}
