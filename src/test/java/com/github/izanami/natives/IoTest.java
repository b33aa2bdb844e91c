package com.github.izanami.natives;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.izanami.runtime.BooleanValue;
import com.github.izanami.runtime.NativeFunction;
import com.github.izanami.runtime.NativeFunctionException;
import com.github.izanami.runtime.NilValue;
import com.github.izanami.runtime.NumberValue;
import com.github.izanami.runtime.StringValue;
import com.github.izanami.runtime.Value;

public class IoTest {

    private static NativeFunction function(Io io, String name) {
        return io.functions().stream()
            .filter(f -> f.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @ParameterizedTest
    @MethodSource("printed")
    public void testStringify(Value value, String expected) {
        assertEquals(expected, Io.stringify(value));
    }

    private static Object[][] printed() {
        return new Object[][] {
            { new NumberValue(1), "1.00" },
            { new NumberValue(3.14159), "3.14" },
            { new NumberValue(-1.5), "-1.50" },
            { new NumberValue(1234567), "1234567.00" },
            { new NumberValue(2.675), "2.67" },
            { new NumberValue(0.125), "0.12" },
            { new NumberValue(0.005), "0.01" },
            { new NumberValue(-0.0), "-0.00" },
            { new NumberValue(-0.001), "-0.00" },
            { new NumberValue(Double.POSITIVE_INFINITY), "inf" },
            { new NumberValue(Double.NEGATIVE_INFINITY), "-inf" },
            { new NumberValue(Double.NaN), "NaN" },
            { new StringValue("plain"), "plain" },
            { BooleanValue.TRUE, "true" },
            { BooleanValue.FALSE, "false" },
            { NilValue.get(), "nil" },
            { new NativeFunction("clock", 0, arguments -> NilValue.get()), "<fn clock>" },
        };
    }

    @ParameterizedTest
    @MethodSource("concatenated")
    public void testConcatenationText(Value value, String expected) {
        assertEquals(expected, Io.concatenationText(value));
    }

    private static Object[][] concatenated() {
        return new Object[][] {
            { new NumberValue(1), "1" },
            { new NumberValue(100), "100" },
            { new NumberValue(2.5), "2.5" },
            { new NumberValue(0.1), "0.1" },
            { new NumberValue(-3), "-3" },
            { new NumberValue(1e21), "1000000000000000000000" },
            { new NumberValue(0), "0" },
            { new NumberValue(-0.0), "-0" },
            { new NumberValue(Double.NaN), "NaN" },
            { new NumberValue(Double.POSITIVE_INFINITY), "inf" },
            { new NumberValue(Double.NEGATIVE_INFINITY), "-inf" },
            { new StringValue("text"), "text" },
        };
    }

    @Test
    public void testReadInputReturnsOneLineAtATime() {
        var readInput = function(new Io(new StringReader("first\nsecond")), "read_input");

        assertEquals(0, readInput.arity());
        assertEquals(new StringValue("first\n"), readInput.handle().call(List.of()));
        assertEquals(new StringValue("second"), readInput.handle().call(List.of()));
        assertEquals(new StringValue(""), readInput.handle().call(List.of()));
    }

    @Test
    public void testReadInputFailure() {
        var broken = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void close() {
            }
        };
        var readInput = function(new Io(broken), "read_input");

        var e = assertThrows(NativeFunctionException.class, () -> readInput.handle().call(List.of()));
        assertEquals("Error reading from stdin.", e.getMessage());
    }

    @Test
    public void testClock() {
        var clock = function(new Io(new StringReader(""), () -> 12.5), "clock");

        assertEquals(0, clock.arity());
        assertEquals(new NumberValue(12.5), clock.handle().call(List.of()));
    }

    @Test
    public void testSystemClockIsInSeconds() {
        var clock = function(new Io(new StringReader("")), "clock");
        double seconds = ((NumberValue) clock.handle().call(List.of())).number();
        double millis = System.currentTimeMillis();

        assertEquals(millis / 1000.0, seconds, 60);
    }

}
