package com.nightshade.sequence.edit;

import com.nightshade.sequence.model.Sequence;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceWorkspaceTest {

    @Test
    void update_rejectedWhileLeasedAndAllowedAfterRelease() {
        SequenceWorkspace workspace = new SequenceWorkspace(Sequence.empty("Night 1", Instant.EPOCH));

        try (SequenceWorkspace.RunLease lease = workspace.acquireRunLease("run-1")) {
            assertTrue(workspace.isLeased());
            assertSame(workspace.current(), lease.getSequence());
            assertThrows(SequenceLockedException.class, () -> workspace.update(s -> s.withName("Edited")));
            assertThrows(SequenceLockedException.class, () -> workspace.acquireRunLease("run-2"));
        }

        assertFalse(workspace.isLeased());
        assertEquals("Edited", workspace.update(s -> s.withName("Edited")).getName());
    }

    @Test
    void close_isIdempotentAndDoesNotReleaseNewerLease() {
        SequenceWorkspace workspace = new SequenceWorkspace(Sequence.empty("Night 2", Instant.EPOCH));
        SequenceWorkspace.RunLease first = workspace.acquireRunLease("run-1");
        first.close();
        SequenceWorkspace.RunLease second = workspace.acquireRunLease("run-2");

        first.close();

        assertTrue(workspace.isLeased());
        second.close();
        assertFalse(workspace.isLeased());
    }
}
