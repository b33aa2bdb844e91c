package com.github.izanami.runtime;

public sealed interface Value permits NumberValue, StringValue, BooleanValue, NilValue, Callable {

    default boolean isTruthy() {
        return true;
    }

    /**
     * Equality as the {@code ==} operator sees it: {@code nil} equals only {@code nil}, scalars of
     * the same kind compare by value, everything else is unequal.
     */
    static boolean isEqual(Value left, Value right) {
        if (left instanceof NilValue || right instanceof NilValue) {
            return left instanceof NilValue && right instanceof NilValue;
        }
        if (left instanceof NumberValue ln && right instanceof NumberValue rn) {
            return ln.number() == rn.number();
        }
        if (left instanceof StringValue ls && right instanceof StringValue rs) {
            return ls.string().equals(rs.string());
        }
        if (left instanceof BooleanValue lb && right instanceof BooleanValue rb) {
            return lb.value() == rb.value();
        }
        return false;
    }

}
