package org.abstractica.turnsync.impl.delta;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.impl.path.Path;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.state.StateValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DeltaApplicator}.
 */
class DeltaApplicatorTest
{
    private DeltaApplicator applicator;
    private StateValue state;

    @BeforeEach
    void setUp()
    {
        applicator = new DeltaApplicator();
        state = StateFixtures.game();
    }

    private Optional<StateValue> at(StateValue tree, String path)
    {
        return PathResolver.resolve(tree, Path.parse(path));
    }

    private ErrorCode failure(String target, String path, DeltaOp op, StateValue value)
    {
        Delta delta = Delta.of(1, target, path, op, value);
        TurnSyncException e = assertThrows(TurnSyncException.class, () -> applicator.apply(state, delta));
        return e.getCode();
    }

    @Test
    void numberOutOfRange_rejected()
    {
        assertEquals(ErrorCode.NUMBER_OUT_OF_RANGE,
                failure("player", "hp", DeltaOp.SET, StateValue.of(new BigDecimal("1E+2000"))));
        assertEquals(ErrorCode.NUMBER_OUT_OF_RANGE, failure("player", "stats", DeltaOp.SET,
                StateValue.emptyObject().with("luck", StateValue.of(new BigDecimal("1E-1001")))));

        StateValue huge = StateValue.of(new BigDecimal("9".repeat(1000)));
        StateValue grown = applicator.apply(state, Delta.of(1, "player", "hp", DeltaOp.SET, huge)).state();
        Delta overflow = Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(1));
        TurnSyncException e = assertThrows(TurnSyncException.class, () -> applicator.apply(grown, overflow));
        assertEquals(ErrorCode.NUMBER_OUT_OF_RANGE, e.getCode());
    }

    // ========== Operations ==========

    @Test
    void increment_negative_decrements()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(-3)));

        assertEquals(Optional.of(StateValue.of(7)), at(applied.state(), "player.hp"));
        assertEquals(StateValue.of(10), applied.effectiveDelta().previous().orElseThrow());
        assertEquals(Optional.of(StateValue.of(10)), at(state, "player.hp"));
    }

    @Test
    void increment_decimalAmount_exact()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "gold", DeltaOp.INCREMENT, StateValue.of(new BigDecimal("0.1"))));
        applied = applicator.apply(applied.state(),
                Delta.of(1, "player", "gold", DeltaOp.INCREMENT, StateValue.of(new BigDecimal("0.2"))));

        assertEquals(Optional.of(StateValue.of(new BigDecimal("5.3"))), at(applied.state(), "player.gold"));
    }

    @Test
    void set_existingKey_recordsPrevious()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "world", "weather", DeltaOp.SET, StateValue.of("rain")));

        assertEquals(Optional.of(StateValue.of("rain")), at(applied.state(), "world.weather"));
        assertEquals(StateValue.of("clear"), applied.effectiveDelta().previousValue());
    }

    @Test
    void set_newKey_previousAbsent()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "mana", DeltaOp.SET, StateValue.of(4)));

        assertEquals(Optional.of(StateValue.of(4)), at(applied.state(), "player.mana"));
        assertNull(applied.effectiveDelta().previousValue());
    }

    @Test
    void set_arrayElement()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "inventory[0]", DeltaOp.SET, StateValue.of("axe")));

        assertEquals(Optional.of(StateValue.of("axe")), at(applied.state(), "player.inventory[0]"));
        assertEquals(StateValue.of("sword"), applied.effectiveDelta().previousValue());
    }

    @Test
    void set_nullValue_storesJsonNull()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "scene", "location", DeltaOp.SET, StateValue.nullValue()));

        assertEquals(Optional.of(StateValue.nullValue()), at(applied.state(), "currentScene.location"));
    }

    @Test
    void delete_key()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "npc:guard", "mood", DeltaOp.DELETE, null));

        assertTrue(at(applied.state(), "npcs.guard.mood").isEmpty());
        assertEquals(StateValue.of("wary"), applied.effectiveDelta().previousValue());
    }

    @Test
    void delete_arrayElement_shiftsLaterElements()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "inventory[0]", DeltaOp.DELETE, null));

        assertEquals(Optional.of(StateValue.arrayOf(StateValue.of("rope"))), at(applied.state(), "player.inventory"));
    }

    @Test
    void push_wildcard_appends()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "inventory[*]", DeltaOp.PUSH, StateValue.of("torch")));

        assertEquals(Optional.of(StateValue.of("torch")), at(applied.state(), "player.inventory[2]"));
        assertNull(applied.effectiveDelta().previousValue());
    }

    @Test
    void push_arrayPath_appends()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "inventory", DeltaOp.PUSH, StateValue.of("torch")));

        assertEquals(Optional.of(StateValue.of("torch")), at(applied.state(), "player.inventory[2]"));
    }

    @Test
    void pull_removesFirstEqualElement()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "player", "inventory", DeltaOp.PULL, StateValue.of("sword")));

        assertEquals(Optional.of(StateValue.arrayOf(StateValue.of("rope"))), at(applied.state(), "player.inventory"));
    }

    @Test
    void npcTarget_addsNpc()
    {
        AppliedDelta applied = applicator.apply(state,
                Delta.of(1, "npc", "merchant", DeltaOp.SET, StateValue.emptyObject().with("hp", StateValue.of(5))));

        assertEquals(Optional.of(StateValue.of(5)), at(applied.state(), "npcs.merchant.hp"));
    }

    // ========== Failures ==========

    @Test
    void pull_missingElement_elementNotFound()
    {
        assertEquals(ErrorCode.ELEMENT_NOT_FOUND, failure("player", "inventory", DeltaOp.PULL, StateValue.of("torch")));
    }

    @Test
    void set_wildcard_invalidWildcardUsage()
    {
        assertEquals(ErrorCode.INVALID_WILDCARD_USAGE,
                failure("player", "inventory[*]", DeltaOp.SET, StateValue.of("torch")));
    }

    @Test
    void increment_nonNumber_typeMismatch()
    {
        assertEquals(ErrorCode.TYPE_MISMATCH, failure("player", "name", DeltaOp.INCREMENT, StateValue.of(1)));
        assertEquals(ErrorCode.TYPE_MISMATCH, failure("player", "hp", DeltaOp.INCREMENT, StateValue.of("1")));
    }

    @Test
    void increment_missingKey()
    {
        assertEquals(ErrorCode.MISSING_KEY, failure("player", "mana", DeltaOp.INCREMENT, StateValue.of(1)));
    }

    @Test
    void push_toNonArray_typeMismatch()
    {
        assertEquals(ErrorCode.TYPE_MISMATCH, failure("player", "stats", DeltaOp.PUSH, StateValue.of(1)));
    }

    @Test
    void push_toMissingArray_missingParent()
    {
        assertEquals(ErrorCode.MISSING_PARENT, failure("player", "spells", DeltaOp.PUSH, StateValue.of("fireball")));
        assertEquals(ErrorCode.MISSING_PARENT, failure("player", "spells[*]", DeltaOp.PUSH, StateValue.of("fireball")));
    }

    @Test
    void delete_missing_notFound()
    {
        assertEquals(ErrorCode.NOT_FOUND, failure("player", "mana", DeltaOp.DELETE, null));
    }

    @Test
    void unknownNpc_notFound()
    {
        assertEquals(ErrorCode.NOT_FOUND, failure("npc:dragon", "hp", DeltaOp.SET, StateValue.of(100)));
    }

    @Test
    void unknownTarget_invalidTarget()
    {
        assertEquals(ErrorCode.INVALID_TARGET, failure("monster", "hp", DeltaOp.SET, StateValue.of(1)));
    }

    @Test
    void malformedPath_invalidPath()
    {
        assertEquals(ErrorCode.INVALID_PATH, failure("player", "inventory[", DeltaOp.SET, StateValue.of(1)));
    }

    @Test
    void failedDelta_leavesStateUntouched()
    {
        StateValue before = state;
        failure("player", "equipment.helmet", DeltaOp.SET, StateValue.of("iron"));

        assertSame(before, state);
        assertEquals(StateFixtures.game(), state);
    }
}
