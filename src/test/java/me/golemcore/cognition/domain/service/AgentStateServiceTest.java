package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.model.AgentMode;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.AgentStateUpdate;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.testsupport.InMemoryStoragePort;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentStateServiceTest {

    private InMemoryStoragePort storage;
    private MutableClock clock;
    private AgentStateService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        JsonFileStore store = new JsonFileStore(storage, AutoConfiguration.objectMapper(), new BotProperties());
        service = new AgentStateService(store, clock);
    }

    @Test
    void shouldCreateInitialStateOnFirstBoot() {
        AgentState state = service.getState();

        assertEquals(AgentMode.AWAKE, state.getMode());
        assertEquals("curiosity", state.getMotivation());
        assertEquals(7, state.getMotivationIntensity());
        assertEquals(8, state.getAutonomyLevel());
        assertNotNull(storage.get(AgentStateService.DIRECTORY, AgentStateService.FILE));
    }

    @Test
    void shouldSleepAfterChangeStateDecisionMentioningSleep() {
        AgentState before = service.getState();
        assertEquals(AgentMode.AWAKE, before.getMode());
        assertEquals(7, before.getMotivationIntensity());

        AgentState after = service.applyDecision(Decision.builder()
                .kind(DecisionKind.CHANGE_STATE)
                .reasoning("It has been a long day")
                .action("go to sleep for a while")
                .build());

        assertEquals(AgentMode.SLEEPING, after.getMode());
        assertEquals("It has been a long day", after.getLastThought());

        service.reload();
        assertEquals(AgentMode.SLEEPING, service.getState().getMode());
    }

    @Test
    void shouldForceSleepingOnRest() {
        AgentState after = service.applyDecision(Decision.builder()
                .kind(DecisionKind.REST)
                .reasoning("Letting memories settle")
                .action("pause")
                .build());

        assertEquals(AgentMode.SLEEPING, after.getMode());
    }

    @Test
    void shouldKeepModeWhenChangeStateHasNoKeyword() {
        AgentState after = service.applyDecision(Decision.builder()
                .kind(DecisionKind.CHANGE_STATE)
                .reasoning("Unsure")
                .action("something different")
                .build());

        assertEquals(AgentMode.AWAKE, after.getMode());
    }

    @Test
    void shouldOnlyUpdateThoughtForOtherKinds() {
        AgentState after = service.applyDecision(Decision.builder()
                .kind(DecisionKind.EXPLORE_CONCEPT)
                .reasoning("x".repeat(500))
                .action("sleep science")
                .build());

        assertEquals(AgentMode.AWAKE, after.getMode());
        assertEquals(AgentStateService.MAX_THOUGHT_LENGTH, after.getLastThought().length());
    }

    @Test
    void shouldParseFirstMatchingKeyword() {
        assertEquals(Optional.of(AgentMode.THINKING), AgentStateService.parseTargetMode("Thinking, then sleep"));
        assertEquals(Optional.of(AgentMode.REFLECTING), AgentStateService.parseTargetMode("reflect quietly"));
        assertEquals(Optional.of(AgentMode.EXPLORING), AgentStateService.parseTargetMode("explore the garden"));
        assertEquals(Optional.of(AgentMode.SLEEPING), AgentStateService.parseTargetMode("time to rest"));
        assertEquals(Optional.of(AgentMode.AWAKE), AgentStateService.parseTargetMode("wake up"));
        assertEquals(Optional.empty(), AgentStateService.parseTargetMode("unthinkable"));
        assertEquals(Optional.empty(), AgentStateService.parseTargetMode(null));
    }

    @Test
    void shouldParseChineseModeKeywords() {
        assertEquals(Optional.of(AgentMode.SLEEPING), AgentStateService.parseTargetMode("进入休息状态，整合记忆"));
        assertEquals(Optional.of(AgentMode.THINKING), AgentStateService.parseTargetMode("开始思考这个问题"));
        assertEquals(Optional.of(AgentMode.REFLECTING), AgentStateService.parseTargetMode("反思今天的对话"));
        assertEquals(Optional.of(AgentMode.EXPLORING), AgentStateService.parseTargetMode("去探索新的概念"));
        assertEquals(Optional.of(AgentMode.AWAKE), AgentStateService.parseTargetMode("保持清醒"));
        assertEquals(Optional.of(AgentMode.THINKING), AgentStateService.parseTargetMode("思考之后再休息"));
    }

    @Test
    void shouldClampUpdatedLevels() {
        AgentState state = service.update(AgentStateUpdate.builder()
                .motivationIntensity(42)
                .autonomyLevel(-3)
                .build());

        assertEquals(10, state.getMotivationIntensity());
        assertEquals(1, state.getAutonomyLevel());
    }

    @Test
    void shouldReturnDegradedStateWithoutPersistingWhenReadFails() {
        storage.failReads(true);

        AgentState state = service.getState();

        assertEquals(AgentMode.THINKING, state.getMode());
        assertEquals(5, state.getMotivationIntensity());
        assertEquals(5, state.getAutonomyLevel());
        assertNull(storage.get(AgentStateService.DIRECTORY, AgentStateService.FILE));
    }

    @Test
    void shouldNotOverwriteStoredStateWhileDegraded() {
        service.update(AgentStateUpdate.builder().motivation("wonder").build());
        String stored = storage.get(AgentStateService.DIRECTORY, AgentStateService.FILE);
        service.reload();
        storage.failReads(true);

        service.applyDecision(Decision.builder()
                .kind(DecisionKind.REST)
                .reasoning("r")
                .action("a")
                .build());

        assertEquals(stored, storage.get(AgentStateService.DIRECTORY, AgentStateService.FILE));
    }

    @Test
    void shouldReturnMergedStateWhenWriteFails() {
        service.getState();
        storage.failWrites(true);

        AgentState state = service.update(AgentStateUpdate.builder().mode(AgentMode.EXPLORING).build());

        assertEquals(AgentMode.EXPLORING, state.getMode());
    }
}
