package com.github.izanami.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ScopeTest {

    @Test
    public void testLookupWalksParents() {
        var globals = new Scope();
        globals.define("a", new NumberValue(1));
        var inner = new Scope(new Scope(globals));

        assertEquals(Optional.of(new NumberValue(1)), inner.get("a"));
    }

    @Test
    public void testShadowingLeavesOuterBindingAlone() {
        var outer = new Scope();
        outer.define("a", new NumberValue(1));
        var inner = new Scope(outer);
        inner.define("a", new NumberValue(2));

        assertEquals(Optional.of(new NumberValue(2)), inner.get("a"));
        assertEquals(Optional.of(new NumberValue(1)), outer.get("a"));
    }

    @Test
    public void testAssignUpdatesNearestBinding() {
        var outer = new Scope();
        outer.define("a", new NumberValue(1));
        var inner = new Scope(outer);

        inner.assign("a", new StringValue("x"));

        assertEquals(Optional.of(new StringValue("x")), outer.get("a"));
    }

    @Test
    public void testDeclaredWithoutValue() {
        var scope = new Scope();
        scope.declare("a");

        assertEquals(Optional.empty(), scope.get("a"));

        scope.assign("a", NilValue.get());
        assertEquals(Optional.of(NilValue.get()), scope.get("a"));
    }

    @Test
    public void testRedefineInSameScope() {
        var scope = new Scope();
        scope.define("a", new NumberValue(1));
        scope.define("a", BooleanValue.TRUE);

        assertEquals(Optional.of(BooleanValue.TRUE), scope.get("a"));
    }

    @Test
    public void testUnknownName() {
        var scope = new Scope(new Scope());

        var e = assertThrows(SymbolNotFoundException.class, () -> scope.get("missing"));
        assertEquals("symbol missing not found", e.getMessage());
        assertThrows(SymbolNotFoundException.class, () -> scope.assign("missing", NilValue.get()));
    }

}
