package org.glyphstack.cli.commands;

import org.glyphstack.assembler.Assembler;
import org.glyphstack.assembler.AssemblyException;
import org.glyphstack.assembler.diagnostics.Diagnostic;
import org.glyphstack.runtime.isa.Program;
import org.glyphstack.runtime.services.ProgramFormatter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Assembles a program listing and prints it with instruction indices.")
public class CheckCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "The program listing to check.")
    private File file;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Assembler assembler = new Assembler();
        try {
            final Program program = assembler.assemble(file.toPath());
            for (Diagnostic diagnostic : assembler.getDiagnostics().getDiagnostics()) {
                err.println(diagnostic);
            }
            out.print(new ProgramFormatter().format(program));
            out.flush();
            return RunCommand.EXIT_COMPLETED;
        } catch (AssemblyException e) {
            err.println(e.getMessage());
            return RunCommand.EXIT_LOAD_ERROR;
        }
    }
}
