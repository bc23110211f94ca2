package com.github.stormino.trackdl.service.state;

import com.github.stormino.trackdl.model.DownloadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadStateMachine")
class DownloadStateMachineTest {

    private DownloadStateMachine stateMachine;
    private static final String TASK_ID = "test-task-123";

    @BeforeEach
    void setUp() {
        stateMachine = new DownloadStateMachine();
    }

    @Nested
    @DisplayName("isValidTransition")
    class IsValidTransitionTests {

        @Test
        @DisplayName("same state should always be valid (idempotent)")
        void sameStateShouldAlwaysBeValid() {
            for (DownloadStatus status : DownloadStatus.values()) {
                assertTrue(stateMachine.isValidTransition(status, status),
                        "Same state transition should be valid for " + status);
            }
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "QUEUED, DOWNLOADING",
            "QUEUED, UPLOADING",
            "QUEUED, COMPLETED",
            "QUEUED, CANCELLED",
            "DOWNLOADING, EMBEDDING",
            "EMBEDDING, DOWNLOADING",
            "EMBEDDING, UPLOADING",
            "UPLOADING, COMPLETED",
            "DOWNLOADING, FAILED"
        })
        @DisplayName("phases may follow each other and finish at any time")
        void validTransitions(DownloadStatus from, DownloadStatus to) {
            assertTrue(stateMachine.isValidTransition(from, to));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "COMPLETED, DOWNLOADING",
            "FAILED, QUEUED",
            "CANCELLED, COMPLETED",
            "DOWNLOADING, QUEUED"
        })
        @DisplayName("terminal states accept nothing and nothing returns to QUEUED")
        void invalidTransitions(DownloadStatus from, DownloadStatus to) {
            assertFalse(stateMachine.isValidTransition(from, to));
        }
    }

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("should return new state for valid transition")
        void shouldReturnNewStateForValidTransition() {
            assertEquals(DownloadStatus.EMBEDDING,
                    stateMachine.transition(TASK_ID, DownloadStatus.DOWNLOADING, DownloadStatus.EMBEDDING));
        }

        @Test
        @DisplayName("should keep current state for invalid transition")
        void shouldKeepCurrentStateForInvalidTransition() {
            assertEquals(DownloadStatus.FAILED,
                    stateMachine.transition(TASK_ID, DownloadStatus.FAILED, DownloadStatus.COMPLETED));
        }

        @Test
        @DisplayName("should reject null states")
        void shouldRejectNulls() {
            assertThrows(NullPointerException.class,
                    () -> stateMachine.transition(TASK_ID, null, DownloadStatus.COMPLETED));
        }
    }

    @Nested
    @DisplayName("state queries")
    class QueryTests {

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal states are terminal and cannot be cancelled")
        void terminalStates(DownloadStatus status) {
            assertTrue(stateMachine.isTerminalState(status));
            assertFalse(stateMachine.canCancel(status));
            assertTrue(stateMachine.getValidNextStates(status).isEmpty());
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"QUEUED", "DOWNLOADING", "EMBEDDING", "UPLOADING"})
        @DisplayName("non-terminal states can be cancelled")
        void activeStates(DownloadStatus status) {
            assertFalse(stateMachine.isTerminalState(status));
            assertTrue(stateMachine.canCancel(status));
        }

        @Test
        @DisplayName("returned next states are a copy")
        void nextStatesCopy() {
            Set<DownloadStatus> next = stateMachine.getValidNextStates(DownloadStatus.QUEUED);
            next.clear();

            assertFalse(stateMachine.getValidNextStates(DownloadStatus.QUEUED).isEmpty());
        }
    }
}
