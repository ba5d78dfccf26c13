package rollingplan.distribution;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentTest {

    @Test
    void targetCannotMoveToAnotherPlatform() {
        Assignment assignment = new Assignment();
        assignment.assign("A", "t1");
        assertThrows(IllegalStateException.class, () -> assignment.assign("B", "t1"));
        assertEquals("A", assignment.getPlatformFor("t1"));
    }

    @Test
    void assigningClearsUnassignedMark() {
        Assignment assignment = new Assignment();
        assignment.markUnassigned("t1");
        assignment.assign("A", "t1");
        assertTrue(assignment.getUnassignedTargetIds().isEmpty());
        assertEquals(1, assignment.getAssignedCount());
    }

    @Test
    void platformsAreOrderedById() {
        Assignment assignment = new Assignment();
        assignment.assign("sat-3", "t1");
        assignment.assign("sat-1", "t2");
        assignment.assign("sat-2", "t3");
        assertEquals(Arrays.asList("sat-1", "sat-2", "sat-3"), Arrays.asList(assignment.getPlatformIds().toArray()));
    }

    @Test
    void unknownPlatformHasNoTargets() {
        assertEquals(Collections.emptySet(), Assignment.empty().getTargets("X"));
        assertTrue(Assignment.empty().isEmpty());
    }
}
