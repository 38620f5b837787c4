package com.opro.optimization.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptStateTest {

    @Test
    void testAllowedTransitions() {
        assertTrue(PromptState.PENDING.canTransitionTo(PromptState.SCORING));
        assertTrue(PromptState.SCORING.canTransitionTo(PromptState.SCORED));
        assertTrue(PromptState.SCORING.canTransitionTo(PromptState.PENDING));
    }

    @Test
    void testRejectedTransitions() {
        assertFalse(PromptState.PENDING.canTransitionTo(PromptState.SCORED));
        assertFalse(PromptState.PENDING.canTransitionTo(PromptState.PENDING));
        for (PromptState next : PromptState.values()) {
            assertFalse(PromptState.SCORED.canTransitionTo(next));
        }
    }

    @Test
    void testWireName() {
        assertEquals("scoring", PromptState.SCORING.wireName());
        assertEquals(PromptState.SCORED, PromptState.fromWireName(" scored "));
    }
}
