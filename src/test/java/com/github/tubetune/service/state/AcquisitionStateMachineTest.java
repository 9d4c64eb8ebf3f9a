package com.github.tubetune.service.state;

import com.github.tubetune.model.AcquisitionStatus;
import com.github.tubetune.model.AcquisitionTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AcquisitionStateMachine")
class AcquisitionStateMachineTest {

    private AcquisitionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new AcquisitionStateMachine();
    }

    private static AcquisitionTask task(AcquisitionStatus status) {
        return AcquisitionTask.builder().ownerId("1").status(status).build();
    }

    @Nested
    @DisplayName("isValidTransition")
    class IsValidTransitionTests {

        @Test
        @DisplayName("same state should always be valid (idempotent)")
        void sameStateShouldAlwaysBeValid() {
            for (AcquisitionStatus status : AcquisitionStatus.values()) {
                assertTrue(stateMachine.isValidTransition(status, status),
                        "Same state transition should be valid for " + status);
            }
        }

        @Test
        @DisplayName("the happy path should be valid step by step")
        void happyPathShouldBeValid() {
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.PENDING, AcquisitionStatus.PROBING));
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.PROBING, AcquisitionStatus.TRANSFERRING));
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.TRANSFERRING, AcquisitionStatus.TRANSCODING));
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.TRANSCODING, AcquisitionStatus.FINALIZING));
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.FINALIZING, AcquisitionStatus.SUCCEEDED));
        }

        @Test
        @DisplayName("PENDING can skip probing when a stream is known")
        void pendingCanSkipProbing() {
            assertTrue(stateMachine.isValidTransition(AcquisitionStatus.PENDING, AcquisitionStatus.TRANSFERRING));
        }

        @Test
        @DisplayName("TRANSFERRING cannot jump to SUCCEEDED")
        void transferringCannotJumpToSucceeded() {
            assertFalse(stateMachine.isValidTransition(AcquisitionStatus.TRANSFERRING, AcquisitionStatus.SUCCEEDED));
        }

        @ParameterizedTest
        @EnumSource(value = AcquisitionStatus.class, names = {"PENDING", "PROBING", "TRANSFERRING", "TRANSCODING", "FINALIZING"})
        @DisplayName("every non-terminal state can fail")
        void nonTerminalCanFail(AcquisitionStatus status) {
            assertTrue(stateMachine.isValidTransition(status, AcquisitionStatus.FAILED));
        }

        @ParameterizedTest
        @EnumSource(value = AcquisitionStatus.class, names = {"SUCCEEDED", "FAILED"})
        @DisplayName("terminal states allow no transition")
        void terminalStatesAllowNothing(AcquisitionStatus status) {
            assertTrue(stateMachine.isTerminalState(status));
            assertTrue(stateMachine.getValidNextStates(status).isEmpty());
        }
    }

    @Nested
    @DisplayName("transitionOrThrow")
    class TransitionOrThrowTests {

        @Test
        @DisplayName("should update the task status")
        void shouldUpdateStatus() {
            AcquisitionTask task = task(AcquisitionStatus.PENDING);

            stateMachine.transitionOrThrow(task, AcquisitionStatus.PROBING);

            assertEquals(AcquisitionStatus.PROBING, task.getStatus());
        }

        @Test
        @DisplayName("should reject an invalid transition and leave the status")
        void shouldRejectInvalid() {
            AcquisitionTask task = task(AcquisitionStatus.SUCCEEDED);

            assertThrows(IllegalStateException.class,
                    () -> stateMachine.transitionOrThrow(task, AcquisitionStatus.TRANSCODING));
            assertEquals(AcquisitionStatus.SUCCEEDED, task.getStatus());
        }
    }

    @Nested
    @DisplayName("fail")
    class FailTests {

        @Test
        @DisplayName("should fail a running task")
        void shouldFailRunningTask() {
            AcquisitionTask task = task(AcquisitionStatus.TRANSCODING);

            assertTrue(stateMachine.fail(task));
            assertEquals(AcquisitionStatus.FAILED, task.getStatus());
        }

        @Test
        @DisplayName("should not touch a finished task")
        void shouldNotTouchFinishedTask() {
            AcquisitionTask task = task(AcquisitionStatus.SUCCEEDED);

            assertFalse(stateMachine.fail(task));
            assertEquals(AcquisitionStatus.SUCCEEDED, task.getStatus());
        }
    }

    @Test
    @DisplayName("getValidNextStates should return a copy")
    void validNextStatesShouldBeCopy() {
        Set<AcquisitionStatus> next = stateMachine.getValidNextStates(AcquisitionStatus.PENDING);
        next.clear();

        assertEquals(3, stateMachine.getValidNextStates(AcquisitionStatus.PENDING).size());
    }
}
