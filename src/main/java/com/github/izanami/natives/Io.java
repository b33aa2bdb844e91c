package com.github.izanami.natives;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleSupplier;

import com.github.izanami.runtime.BooleanValue;
import com.github.izanami.runtime.Callable;
import com.github.izanami.runtime.NativeFunction;
import com.github.izanami.runtime.NativeFunctionException;
import com.github.izanami.runtime.NilValue;
import com.github.izanami.runtime.NumberValue;
import com.github.izanami.runtime.StringValue;
import com.github.izanami.runtime.Value;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class Io {

    private final Reader in;
    private final DoubleSupplier clock;

    public Io(Reader in) {
        this(in, () -> System.currentTimeMillis() / 1000.0);
    }

    public List<NativeFunction> functions() {
        return List.of(
            new NativeFunction("clock", 0, arguments -> new NumberValue(clock.getAsDouble())),
            new NativeFunction("read_input", 0, arguments -> readInput()));
    }

    // one line including its terminator; an empty string once the input is exhausted
    private Value readInput() {
        var line = new StringBuilder();
        try {
            int c;
            while ((c = in.read()) != -1) {
                line.append((char) c);
                if (c == '\n') {
                    break;
                }
            }
        } catch (IOException e) {
            throw new NativeFunctionException("Error reading from stdin.", e);
        }
        return new StringValue(line.toString());
    }

    // print: two decimals, exact ties round to even, the sign survives rounding to zero
    public static String stringify(Value value) {
        if (value instanceof NumberValue nv) {
            double number = nv.number();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return nonFinite(number);
            }
            var digits = new BigDecimal(Math.abs(number)).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
            return isNegative(number) ? "-" + digits : digits;
        }
        if (value instanceof StringValue sv) {
            return sv.string();
        }
        if (value instanceof BooleanValue bv) {
            return String.valueOf(bv.value());
        }
        if (value instanceof NilValue) {
            return "nil";
        }
        if (value instanceof Callable callable) {
            return "<fn " + callable.name() + ">";
        }
        return value.toString();
    }

    // string concatenation: shortest plain decimal, never an exponent
    public static String concatenationText(Value value) {
        if (value instanceof NumberValue nv) {
            double number = nv.number();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return nonFinite(number);
            }
            if (number == 0) {
                return isNegative(number) ? "-0" : "0";
            }
            return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
        }
        return stringify(value);
    }

    private static String nonFinite(double number) {
        if (Double.isNaN(number)) {
            return "NaN";
        }
        return number > 0 ? "inf" : "-inf";
    }

    private static boolean isNegative(double number) {
        return number < 0 || (number == 0 && 1 / number < 0);
    }

}
