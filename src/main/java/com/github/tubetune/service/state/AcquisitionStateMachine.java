package com.github.tubetune.service.state;

import com.github.tubetune.model.AcquisitionStatus;
import com.github.tubetune.model.AcquisitionTask;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for acquisition status transitions.
 *
 * Valid state flow:
 * <pre>
 * PENDING → PROBING → TRANSFERRING → TRANSCODING → FINALIZING → SUCCEEDED
 *    └──────────────────↗
 * any non-terminal state → FAILED
 * </pre>
 * A candidate that already carries a stream skips probing.
 */
@Slf4j
@Component
public class AcquisitionStateMachine {

    private final Map<AcquisitionStatus, Set<AcquisitionStatus>> validTransitions;

    public AcquisitionStateMachine() {
        validTransitions = new EnumMap<>(AcquisitionStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(AcquisitionStatus.PENDING,
            EnumSet.of(AcquisitionStatus.PROBING, AcquisitionStatus.TRANSFERRING, AcquisitionStatus.FAILED));

        validTransitions.put(AcquisitionStatus.PROBING,
            EnumSet.of(AcquisitionStatus.TRANSFERRING, AcquisitionStatus.FAILED));

        validTransitions.put(AcquisitionStatus.TRANSFERRING,
            EnumSet.of(AcquisitionStatus.TRANSCODING, AcquisitionStatus.FAILED));

        validTransitions.put(AcquisitionStatus.TRANSCODING,
            EnumSet.of(AcquisitionStatus.FINALIZING, AcquisitionStatus.FAILED));

        validTransitions.put(AcquisitionStatus.FINALIZING,
            EnumSet.of(AcquisitionStatus.SUCCEEDED, AcquisitionStatus.FAILED));

        // Terminal states
        validTransitions.put(AcquisitionStatus.SUCCEEDED, EnumSet.noneOf(AcquisitionStatus.class));
        validTransitions.put(AcquisitionStatus.FAILED, EnumSet.noneOf(AcquisitionStatus.class));
    }

    /**
     * Check if a state transition is valid. Staying in the same state is always valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull AcquisitionStatus currentState, @NonNull AcquisitionStatus newState) {
        if (currentState == newState) {
            return true;
        }

        Set<AcquisitionStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Move a task to a new state.
     *
     * @param task Task to update
     * @param newState Desired new state
     * @throws IllegalStateException if the transition is invalid
     */
    public void transitionOrThrow(@NonNull AcquisitionTask task, @NonNull AcquisitionStatus newState) {
        AcquisitionStatus currentState = task.getStatus();
        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for task %s: %s → %s",
                    task.getId(), currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Task {} state transition: {} → {}", task.getId(), currentState, newState);
        }
        task.setStatus(newState);
    }

    /**
     * Move a task to FAILED unless it already reached a terminal state.
     *
     * @param task Task to update
     * @return true if the task was moved to FAILED
     */
    public boolean fail(@NonNull AcquisitionTask task) {
        if (isTerminalState(task.getStatus())) {
            log.warn("Task {} already terminal ({}), not marking failed", task.getId(), task.getStatus());
            return false;
        }
        log.debug("Task {} state transition: {} → {}", task.getId(), task.getStatus(), AcquisitionStatus.FAILED);
        task.setStatus(AcquisitionStatus.FAILED);
        return true;
    }

    /**
     * Check if a state is terminal (no further transitions possible).
     *
     * @param state State to check
     * @return true if terminal state
     */
    public boolean isTerminalState(@NonNull AcquisitionStatus state) {
        Set<AcquisitionStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    /**
     * Get all valid next states from current state.
     *
     * @param currentState Current state
     * @return Set of valid next states
     */
    public Set<AcquisitionStatus> getValidNextStates(@NonNull AcquisitionStatus currentState) {
        Set<AcquisitionStatus> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(AcquisitionStatus.class);
    }
}
