package com.rlox.script;

import com.rlox.debug.Debug;
import com.rlox.script.parser.Diagnostic;
import com.rlox.script.parser.Environment;
import com.rlox.script.parser.Interpreter;
import com.rlox.script.parser.Lexer;
import com.rlox.script.parser.ParseResult;
import com.rlox.script.parser.Parser;
import com.rlox.script.parser.RunResult;
import com.rlox.script.parser.RuntimeError;
import com.rlox.script.parser.ScanResult;
import com.rlox.script.parser.Statement.Stmt;
import com.rlox.script.parser.Token;
import com.rlox.script.parser.Value;

import java.io.PrintStream;
import java.util.*;

/**
 * Core rlox engine.
 *
 * - Lox-style syntax: var declarations, print, expression statements
 * - Types: nil, bool, number (double), string
 * - Operators: ! - * / + - > >= < <= == != and grouping
 * - One flat global namespace per environment
 *
 * ERROR CONTRACT:
 *   - lexical and syntax errors are collected; the statements that did parse still run
 *   - the first runtime error stops the run
 *   - run(...) never throws for malformed input, everything comes back in RunResult
 */
public class RloxScript {

    private static final String TAG = "RloxScript";

    /** Host hook that sees every diagnostic, in report order. */
    public interface DiagnosticListener {
        void report(Diagnostic diagnostic);
    }

    // ===================== ENGINE PUBLIC API =====================

    private PrintStream out = System.out;
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;
    private DiagnosticListener diagnosticListener = null;

    public RloxScript() {
    }

    /** Where print statements write. Default System.out. */
    public void setOutput(PrintStream out) {
        this.out = (out == null) ? System.out : out;
    }

    public PrintStream getOutput() { return out; }

    public void setMaxNestingDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max nesting depth must be positive: " + depth);
        this.maxNestingDepth = depth;
    }

    public int getMaxNestingDepth() { return maxNestingDepth; }

    public void setDiagnosticListener(DiagnosticListener listener) {
        this.diagnosticListener = listener;
    }

    public ScanResult scan(String source) {
        requireSource(source);
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Debug.get().d(TAG, "scanned " + tokens.size() + " tokens, " + lexer.diagnostics().size() + " lexical errors");
        return new ScanResult(tokens, lexer.diagnostics());
    }

    public ParseResult parse(List<Token> tokens) {
        Parser parser = new Parser(tokens, maxNestingDepth);
        List<Stmt> program = parser.parse();
        Debug.get().d(TAG, "parsed " + program.size() + " statements, " + parser.diagnostics().size() + " syntax errors");
        return new ParseResult(program, parser.diagnostics());
    }

    /** Run with a fresh, empty environment. */
    public RunResult run(String source) {
        return run(source, new Environment());
    }

    /** Run with a fresh environment seeded from host globals. */
    public RunResult run(String source, Map<String, Value> initialEnv) {
        return run(source, new Environment(initialEnv));
    }

    /**
     * Run against a caller-owned environment. Bindings survive the call, which lets an
     * external read loop feed the engine one line at a time.
     */
    public RunResult run(String source, Environment env) {
        requireSource(source);
        if (env == null) throw new IllegalArgumentException("env must not be null");

        List<Diagnostic> diagnostics = new ArrayList<>();

        ScanResult scanned = scan(source);
        record(diagnostics, scanned.diagnostics());

        ParseResult parsed = parse(scanned.tokens());
        record(diagnostics, parsed.diagnostics());

        Interpreter interpreter = new Interpreter(env, out);
        RuntimeError failure = null;
        try {
            interpreter.execute(parsed.statements());
        } catch (RuntimeError e) {
            failure = e;
            record(diagnostics, Collections.singletonList(Diagnostic.runtime(e)));
        } finally {
            out.flush();
        }

        return new RunResult(diagnostics, failure, env.snapshot());
    }

    private void record(List<Diagnostic> into, List<Diagnostic> reported) {
        for (Diagnostic d : reported) {
            into.add(d);
            if (d.stage() == Diagnostic.Stage.RUNTIME) Debug.get().e(TAG, d.format());
            else Debug.get().w(TAG, d.format());
            if (diagnosticListener != null) {
                diagnosticListener.report(d);
            }
        }
    }

    private static void requireSource(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
    }
}
