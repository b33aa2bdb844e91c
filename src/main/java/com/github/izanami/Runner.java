package com.github.izanami;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.github.izanami.natives.Io;
import com.github.izanami.parser.Parser;
import com.github.izanami.runtime.Interpreter;
import com.github.izanami.runtime.RuntimeError;

import lombok.Setter;

public class Runner implements ConfigReader.ConfigTarget {

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final Interpreter interpreter;
    private final Reporter reporter;

    @Setter
    private List<String> lookupPath = new ArrayList<>();
    @Setter
    private String prompt = "> ";

    public Runner() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out, System.err);
    }

    public Runner(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.interpreter = new Interpreter(out);
        this.reporter = new Reporter(err);

        new Io(in).functions().forEach(interpreter::defineNative);
    }

    public static void main(String[] args) {
        var runner = new Runner();
        try {
            ConfigReader.readConfig().applyConfig(runner);
        } catch (IOException e) {
            System.err.println("Could not read " + ConfigReader.CONFIG_FILE + ": " + e.getMessage());
            System.exit(ExitCode.HOST_ERROR.code());
        }
        System.exit(runner.launch(args).code());
    }

    public ExitCode launch(String[] args) {
        if (args.length > 1) {
            err.println("Usage: izanami [script]");
            return ExitCode.USAGE;
        } else if (args.length == 1) {
            return runFile(args[0]);
        } else {
            return runPrompt();
        }
    }

    public ExitCode runFile(String file) {
        var path = resolve(file);
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Could not read " + path + ": " + e.getMessage());
            return ExitCode.HOST_ERROR;
        }
        return run(source);
    }

    public ExitCode runPrompt() {
        try {
            while (true) {
                out.print(prompt);
                out.flush();
                var line = in.readLine();
                if (line == null) {
                    out.println();
                    return ExitCode.OK;
                }
                run(line);
            }
        } catch (IOException e) {
            err.println("Could not read input: " + e.getMessage());
            return ExitCode.HOST_ERROR;
        }
    }

    /**
     * Runs one source unit. Lexical or parse errors keep the whole unit from executing.
     */
    public ExitCode run(String source) {
        var tokens = new Tokenizer().tokenize(source);
        if (tokens.hasErrors()) {
            tokens.errors().forEach(reporter::lexError);
            return ExitCode.LEXICAL_ERROR;
        }

        var compilationUnit = new Parser().parseCompilationUnit(tokens);
        if (compilationUnit.hasErrors()) {
            compilationUnit.errors().forEach(reporter::parseError);
            return ExitCode.PARSE_ERROR;
        }

        try {
            interpreter.interpret(compilationUnit.statements());
        } catch (RuntimeError e) {
            reporter.runtimeError(e);
            return ExitCode.RUNTIME_ERROR;
        } finally {
            out.flush();
        }
        return ExitCode.OK;
    }

    private Path resolve(String pathString) {
        var resolvedPath = Path.of(pathString);
        if (!resolvedPath.isAbsolute() && !Files.exists(resolvedPath)) {
            for (String lookupPathEntry : lookupPath) {
                var path = Path.of(lookupPathEntry, pathString);
                if (Files.isRegularFile(path)) {
                    return path;
                }
            }
        }
        return resolvedPath;
    }

}
