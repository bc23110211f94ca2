package com.github.stormino.trackdl.service.state;

import com.github.stormino.trackdl.model.DownloadStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for UI task status transitions.
 *
 * Valid state flow:
 * <pre>
 * QUEUED → DOWNLOADING ⇄ EMBEDDING ⇄ UPLOADING → COMPLETED
 *    ↓                                       ↘ FAILED
 *    → COMPLETED | FAILED | CANCELLED          ↘ CANCELLED
 * </pre>
 * Phases may follow each other in any order; terminal states accept nothing.
 */
@Component
@Slf4j
public class DownloadStateMachine {

    private static final Set<DownloadStatus> TERMINAL =
            EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED, DownloadStatus.CANCELLED);

    private static final Set<DownloadStatus> PHASES =
            EnumSet.of(DownloadStatus.DOWNLOADING, DownloadStatus.EMBEDDING, DownloadStatus.UPLOADING);

    private final Map<DownloadStatus, Set<DownloadStatus>> validTransitions;

    public DownloadStateMachine() {
        validTransitions = new EnumMap<>(DownloadStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        Set<DownloadStatus> fromActive = EnumSet.copyOf(PHASES);
        fromActive.addAll(TERMINAL);

        // A task may finish before any progress was reported
        validTransitions.put(DownloadStatus.QUEUED, EnumSet.copyOf(fromActive));

        for (DownloadStatus phase : PHASES) {
            validTransitions.put(phase, EnumSet.copyOf(fromActive));
        }

        for (DownloadStatus terminal : TERMINAL) {
            validTransitions.put(terminal, EnumSet.noneOf(DownloadStatus.class));
        }
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull DownloadStatus currentState, @NonNull DownloadStatus newState) {
        if (currentState == newState) {
            // Same state is always valid (idempotent)
            return true;
        }

        Set<DownloadStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate and perform state transition.
     *
     * @param taskId Task ID for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return New state if valid, current state if invalid
     */
    public DownloadStatus transition(
            @NonNull String taskId,
            @NonNull DownloadStatus currentState,
            @NonNull DownloadStatus newState) {

        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Task {} state transition: {} → {}", taskId, currentState, newState);
            }
            return newState;
        }
        log.debug("Task {} ignoring transition {} → {}", taskId, currentState, newState);
        return currentState;
    }

    public boolean isTerminalState(@NonNull DownloadStatus state) {
        return TERMINAL.contains(state);
    }

    public Set<DownloadStatus> getValidNextStates(@NonNull DownloadStatus currentState) {
        Set<DownloadStatus> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(DownloadStatus.class);
    }

    public boolean canCancel(@NonNull DownloadStatus currentState) {
        return isValidTransition(currentState, DownloadStatus.CANCELLED);
    }
}
