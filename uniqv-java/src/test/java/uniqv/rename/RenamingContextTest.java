package uniqv.rename;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RenamingContextTest {

    @Test
    void starts_with_one_frame() {
        var ctx = new RenamingContext();
        assertEquals(1, ctx.scopeDepth());
        assertTrue(ctx.allocatedNames().isEmpty());
    }

    @Test
    void declare_generates_and_binds() {
        var ctx = new RenamingContext();
        assertEquals("x", ctx.declare("x"));
        ctx.enterScope();
        assertEquals("__uqVar1__x__", ctx.declare("x"));
        assertEquals(Optional.of("__uqVar1__x__"), ctx.resolve("x"));
        ctx.exitScope();
        assertEquals(Optional.of("x"), ctx.resolve("x"));
    }

    @Test
    void registry_outlives_the_frame_that_used_it() {
        var ctx = new RenamingContext();
        ctx.enterScope();
        ctx.declare("i");
        ctx.exitScope();
        ctx.enterScope();
        // sibling scope: still a fresh name
        assertEquals("__uqVar1__i__", ctx.declare("i"));
    }

    @Test
    void skip_flag_is_single_shot() {
        var ctx = new RenamingContext();
        assertFalse(ctx.consumeSkipScope());
        ctx.skipNextScope();
        assertTrue(ctx.consumeSkipScope());
        assertFalse(ctx.consumeSkipScope());
    }

    @Test
    void reset_restores_initial_state() {
        var ctx = new RenamingContext();
        ctx.declare("x");
        ctx.enterScope();
        ctx.enterScope();
        ctx.skipNextScope();

        ctx.reset();

        assertEquals(1, ctx.scopeDepth());
        assertTrue(ctx.allocatedNames().isEmpty());
        assertFalse(ctx.consumeSkipScope());
        assertEquals(Optional.empty(), ctx.resolve("x"));
    }

    @Test
    void unbalanced_exit_fails_fast() {
        var ctx = new RenamingContext();
        ctx.exitScope();
        assertThrows(IllegalStateException.class, ctx::exitScope);
        assertThrows(IllegalStateException.class, () -> ctx.declare("x"));
    }
}
