package com.github.izanami.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.izanami.Tokenizer;
import com.github.izanami.parser.CompilationUnit.Statement;
import com.github.izanami.parser.Parser;

public class InterpreterTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final Interpreter interpreter = new Interpreter(new PrintStream(output, true, StandardCharsets.UTF_8));

    private List<Statement> parse(String code) {
        var compilationUnit = new Parser().parseCompilationUnit(new Tokenizer().tokenize(code));
        assertEquals(List.of(), compilationUnit.errors());
        return compilationUnit.statements();
    }

    private String run(String code) {
        interpreter.interpret(parse(code));
        return output.toString(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @MethodSource("programs")
    public void testOutput(String code, String expected) {
        assertEquals(expected, run(code));
    }

    private static Object[][] programs() {
        return new Object[][] {
            { "print 1 + 2 * 3;", "7.00\n" },
            { "print (1 + 2) * 3;", "9.00\n" },
            { "print 10 - 4 - 3;", "3.00\n" },
            { "print 7 / 2;", "3.50\n" },
            { "print 1 / 0; print \"\" + 1 / 0;", "inf\ninf\n" },
            { "print -1 / 0;", "-inf\n" },
            { "print -(1 + 1);", "-2.00\n" },
            { "var a = 1; { var a = 2; print a; } print a;", "2.00\n1.00\n" },
            {
                "fun make(){ var i = 0; fun inc(){ i = i + 1; return i; } return inc; } var c = make(); print c(); print c();",
                "1.00\n2.00\n"
            },
            { "for (var i = 0; i < 3; i = i + 1) { if (i == 1) break; print i; }", "0.00\n" },
            { "print 1 + \"a\";", "1a\n" },
            { "print \"a\" + 2.5;", "a2.5\n" },
            { "print \"a\" + \"b\";", "ab\n" },
            { "print \"\" + -0;", "-0\n" },
            { "print \"a\" == 1;", "false\n" },
            { "print \"a\" == \"a\";", "true\n" },
            { "print nil == nil;", "true\n" },
            { "print nil == false;", "false\n" },
            { "print 1 != 2;", "true\n" },
            { "print 0.1 + 0.2 == 0.3;", "false\n" },
            { "print 1 < 2;", "true\n" },
            { "print 2 <= 1;", "false\n" },
            { "print 1, 2;", "2.00\n" },
            { "print true ? 1 : 2;", "1.00\n" },
            { "print nil ? 1 : false ? 2 : 3;", "3.00\n" },
            { "print 0 ? \"t\" : \"f\";", "t\n" },
            { "print \"\" ? \"t\" : \"f\";", "t\n" },
            { "print nil or \"x\";", "x\n" },
            { "print false and 1;", "false\n" },
            { "print 1 and 2;", "2.00\n" },
            { "print !nil;", "true\n" },
            { "print !0;", "false\n" },
            { "var a; a = 3; print a;", "3.00\n" },
            { "var a = 1; var b = a = 5; print a + b;", "10.00\n" },
            { "var a = \"outer\"; { a = \"changed\"; } print a;", "changed\n" },
            { "fun fib(n) { if (n < 2) return n; return fib(n - 1) + fib(n - 2); } print fib(10);", "55.00\n" },
            { "fun f() {} print f();", "nil\n" },
            { "fun f() { return; } print f();", "nil\n" },
            { "fun f() {} print f;", "<fn f>\n" },
            { "var x = 1; fun g() { return x; } x = 2; print g();", "2.00\n" },
            { "fun f() { while (true) { return 5; } } print f();", "5.00\n" },
            {
                "for (var i = 0; i < 2; i = i + 1) { for (var j = 0; j < 5; j = j + 1) { if (j == 1) break; print i + j; } }",
                "0.00\n1.00\n"
            },
            { "var i = 0; while (i < 3) i = i + 1; print i;", "3.00\n" },
            { "if (false) print 1; else print 2;", "2.00\n" },
            { "fun add(a, b) { return a + b; } print add(1, 2);", "3.00\n" },
            { "fun twice(f, x) { return f(f(x)); } fun inc(x) { return x + 1; } print twice(inc, 1);", "3.00\n" },
            {
                "fun outer() { var x = \"closed\"; fun inner() { print x; } return inner; } var x = \"global\"; outer()();",
                "closed\n"
            },
            {
                "var counter = 0; fun bump() { counter = counter + 1; } bump(); bump(); print counter;",
                "2.00\n"
            },
        };
    }

    @ParameterizedTest
    @MethodSource("runtimeErrors")
    public void testRuntimeErrors(String code, String message, String lexeme) {
        var statements = parse(code);
        var e = assertThrows(RuntimeError.class, () -> interpreter.interpret(statements));
        assertEquals(message, e.getMessage());
        assertEquals(lexeme, e.token().lexeme());
    }

    private static Object[][] runtimeErrors() {
        return new Object[][] {
            { "print -\"a\";", "Operand must be a number.", "-" },
            { "print 1 - \"a\";", "Operands must be numbers.", "-" },
            { "print nil < 1;", "Operands must be numbers.", "<" },
            { "print true + 1;", "Operands must be two numbers or two strings.", "+" },
            { "print \"a\" + nil;", "Operands must be two numbers or two strings.", "+" },
            { "print x;", "Undefined variable 'x'.", "x" },
            { "x = 1;", "Undefined variable 'x'.", "x" },
            { "var a; print a;", "Uninitialized variable 'a'.", "a" },
            { "{ var a = 1; } print a;", "Undefined variable 'a'.", "a" },
            { "\"a\"();", "Can only call functions and classes.", ")" },
            { "fun f(a) {} f();", "Expected 1 arguments but got 0.", ")" },
            { "fun f() {} f(1, 2);", "Expected 0 arguments but got 2.", ")" },
            { "while (true) { print x; }", "Undefined variable 'x'.", "x" },
            { "for (var i = 0; i < 3; i = i + 1) { i = i + nil; }", "Operands must be two numbers or two strings.", "+" },
        };
    }

    @Test
    public void testRuntimeErrorStopsExecution() {
        var statements = parse("print 1; print x; print 2;");
        assertThrows(RuntimeError.class, () -> interpreter.interpret(statements));
        assertEquals("1.00\n", output.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testRuntimeErrorEscapesLoop() {
        var statements = parse("var i = 0; while (i < 3) { print i; i = i + 1; if (i == 2) print x; } print \"after\";");

        var e = assertThrows(RuntimeError.class, () -> interpreter.interpret(statements));
        assertEquals("Undefined variable 'x'.", e.getMessage());
        assertEquals("0.00\n1.00\n", output.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testGlobalsPersistAcrossRuns() {
        run("var a = 1; fun get() { return a; }");
        assertEquals("1.00\n", run("print get();"));
    }

    @Test
    public void testNativeFunction() {
        interpreter.defineNative(new NativeFunction("answer", 0, arguments -> new NumberValue(42)));
        assertEquals("42.00\n<fn answer>\n", run("print answer(); print answer;"));
    }

    @Test
    public void testNativeFunctionFailureBecomesRuntimeError() {
        interpreter.defineNative(new NativeFunction("fail", 1, arguments -> {
            throw new NativeFunctionException("failed with " + arguments.get(0));
        }));
        var statements = parse("fail(\"x\");");

        var e = assertThrows(RuntimeError.class, () -> interpreter.interpret(statements));
        assertEquals("failed with x", e.getMessage());
        assertEquals(")", e.token().lexeme());
    }

    @Test
    public void testEvaluationIsDeterministic() {
        var expression = new Parser().parseExpression(new Tokenizer().tokenize("(1 + 2.5) * 4 - 6 / 3"));
        var frame = StackFrame.global(interpreter.globals());

        var first = interpreter.evaluate(expression, frame);
        var second = interpreter.evaluate(expression, frame);

        assertEquals(new NumberValue(12), first);
        assertEquals(first, second);
    }

    @Test
    public void testFunctionsAreNeverEqual() {
        assertEquals("false\nfalse\n", run("fun f() {} print f == f; var g = f; print g == f;"));
    }

}
