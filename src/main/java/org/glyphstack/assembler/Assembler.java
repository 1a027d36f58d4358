package org.glyphstack.assembler;

import org.glyphstack.assembler.diagnostics.DiagnosticsEngine;
import org.glyphstack.assembler.lexer.Lexer;
import org.glyphstack.assembler.lexer.Token;
import org.glyphstack.assembler.lexer.TokenType;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.OpKind;
import org.glyphstack.runtime.isa.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a textual program listing into a {@link Program}.
 * <p>
 * Each non-empty line holds optional label definitions ({@code name:}) followed by at most one
 * instruction: a mnemonic and its numeric operands. Jump targets may be written as labels or
 * as absolute indices. Assembly runs in two passes: the first collects instructions and label
 * positions, the second resolves label references. All errors are collected and reported
 * together. This class is not thread-safe.
 */
public class Assembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

    private DiagnosticsEngine diagnostics;

    /**
     * An instruction whose jump target may still be an unresolved label.
     */
    private record Pending(OpKind opcode, long span, Long magnitude, Token targetLabel, int line) {}

    /**
     * Reads and assembles a listing file.
     * @param file The listing file, read as UTF-8.
     * @return The assembled program, named after the file.
     * @throws AssemblyException if the file cannot be read or contains errors.
     */
    public Program assemble(Path file) throws AssemblyException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssemblyException("Failed to read program listing " + file, e);
        }
        return assemble(source, file.toString());
    }

    /**
     * Assembles a listing held in memory.
     * @param source The listing text.
     * @param programName The name used in diagnostics and as the program name.
     * @return The assembled program.
     * @throws AssemblyException if the listing contains errors.
     */
    public Program assemble(String source, String programName) throws AssemblyException {
        diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, programName).scanTokens();

        List<Pending> pending = new ArrayList<>();
        Map<String, Integer> labels = new HashMap<>();
        int pos = 0;
        while (tokens.get(pos).type() != TokenType.END_OF_FILE) {
            pos = parseLine(tokens, pos, pending, labels, programName);
        }

        List<Instruction> instructions = new ArrayList<>();
        for (Pending p : pending) {
            resolve(p, labels, pending.size(), programName).ifPresent(instructions::add);
        }

        if (diagnostics.hasErrors()) {
            throw new AssemblyException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        Program program = new Program(programName, instructions);
        LOG.debug("Assembled '{}': {} instructions, {} labels", programName, program.size(), labels.size());
        return program;
    }

    /**
     * @return The diagnostics of the most recent assembly, including warnings.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private int parseLine(List<Token> tokens, int pos, List<Pending> pending, Map<String, Integer> labels,
                          String programName) {
        // label definitions
        while (tokens.get(pos).type() == TokenType.IDENTIFIER && tokens.get(pos + 1).type() == TokenType.COLON) {
            Token label = tokens.get(pos);
            Integer previous = labels.putIfAbsent(label.text(), pending.size());
            if (previous != null) {
                diagnostics.reportError("Duplicate label '" + label.text() + "'", programName, label.line());
            }
            pos += 2;
        }

        Token head = tokens.get(pos);
        if (head.type() == TokenType.NEWLINE) {
            return pos + 1;
        }
        if (head.type() == TokenType.END_OF_FILE) {
            return pos;
        }

        List<Token> operands = new ArrayList<>();
        int next = pos + 1;
        while (tokens.get(next).type() != TokenType.NEWLINE && tokens.get(next).type() != TokenType.END_OF_FILE) {
            operands.add(tokens.get(next));
            next++;
        }
        if (tokens.get(next).type() == TokenType.NEWLINE) {
            next++;
        }

        if (head.type() != TokenType.IDENTIFIER) {
            diagnostics.reportError("Expected a mnemonic but found '" + head.text() + "'", programName, head.line());
            return next;
        }
        Optional<OpKind> opcode = OpKind.byMnemonic(head.text());
        if (opcode.isEmpty()) {
            diagnostics.reportError("Unknown mnemonic '" + head.text() + "'", programName, head.line());
            return next;
        }
        parseInstruction(opcode.get(), operands, head.line(), pending, programName);
        return next;
    }

    private void parseInstruction(OpKind opcode, List<Token> operands, int line, List<Pending> pending,
                                  String programName) {
        OpKind.Operands shape = opcode.operands();
        if (operands.size() != shape.count()) {
            diagnostics.reportError(String.format("%s expects %d operand(s) but got %d",
                    opcode.mnemonic(), shape.count(), operands.size()), programName, line);
            return;
        }

        int index = 0;
        long span = 0L;
        if (shape.hasSpan()) {
            Token spanToken = operands.get(index++);
            if (spanToken.type() != TokenType.NUMBER) {
                diagnostics.reportError("Span of " + opcode.mnemonic() + " must be a number, got '"
                        + spanToken.text() + "'", programName, line);
                return;
            }
            span = (Long) spanToken.value();
        }

        Long magnitude = null;
        Token targetLabel = null;
        if (shape.hasMagnitude()) {
            Token magnitudeToken = operands.get(index);
            if (magnitudeToken.type() == TokenType.NUMBER) {
                magnitude = (Long) magnitudeToken.value();
            } else if (shape.isJumpTarget() && magnitudeToken.type() == TokenType.IDENTIFIER) {
                targetLabel = magnitudeToken;
            } else {
                diagnostics.reportError("Invalid operand '" + magnitudeToken.text() + "' for "
                        + opcode.mnemonic(), programName, line);
                return;
            }
        }
        pending.add(new Pending(opcode, span, magnitude, targetLabel, line));
    }

    private Optional<Instruction> resolve(Pending p, Map<String, Integer> labels, int programSize,
                                          String programName) {
        if (p.span() > Integer.MAX_VALUE) {
            diagnostics.reportError("Span " + p.span() + " is out of range", programName, p.line());
            return Optional.empty();
        }
        if (p.opcode().addressesSingleStack() && p.span() == 0) {
            diagnostics.reportError(p.opcode().mnemonic() + " addresses a single stack; span must be at least 1",
                    programName, p.line());
            return Optional.empty();
        }
        long magnitude = p.magnitude() == null ? 0L : p.magnitude();
        if (p.targetLabel() != null) {
            Integer target = labels.get(p.targetLabel().text());
            if (target == null) {
                diagnostics.reportError("Undefined label '" + p.targetLabel().text() + "'", programName, p.line());
                return Optional.empty();
            }
            magnitude = target;
        } else if (p.opcode().operands().isJumpTarget() && magnitude > programSize) {
            // legal to assemble, but the run will abort if the jump is ever taken
            diagnostics.reportWarning("Jump target " + magnitude + " lies outside the program [0, "
                    + programSize + "]", programName, p.line());
        }
        return Optional.of(new Instruction(p.opcode(), (int) p.span(), magnitude, p.line()));
    }
}
