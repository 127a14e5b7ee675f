package io.github.budgetcore.background_tasks;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void terminalStates() {
        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.PROCESSING.isTerminal());
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());
    }

    @Test
    void wireNames_areLowerCase() {
        assertEquals("processing", TaskStatus.PROCESSING.wireName());
        assertEquals("cancelled", TaskStatus.CANCELLED.wireName());
    }
}
