package com.hvacops.copilot.client.conversation;

import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;

import java.util.EnumSet;

/**
 * Builds the per-conversation turn state machine:
 * IDLE → SENDING → (STREAMING) → FINALIZING → IDLE, and SENDING or STREAMING → FAILED → IDLE.
 */
public final class TurnStateMachineConfig {

    private TurnStateMachineConfig() {
    }

    public static StateMachine<TurnState, TurnEvent> build(String machineId) {
        try {
            StateMachineBuilder.Builder<TurnState, TurnEvent> builder = StateMachineBuilder.builder();
            builder.configureConfiguration()
                    .withConfiguration()
                    .machineId(machineId)
                    .autoStartup(false);
            builder.configureStates()
                    .withStates()
                    .initial(TurnState.IDLE)
                    .states(EnumSet.allOf(TurnState.class));
            builder.configureTransitions()
                    .withExternal()
                        .source(TurnState.IDLE)
                        .target(TurnState.SENDING)
                        .event(TurnEvent.SEND)
                    .and()
                    .withExternal()
                        .source(TurnState.SENDING)
                        .target(TurnState.STREAMING)
                        .event(TurnEvent.DELTA)
                    .and()
                    .withExternal()
                        .source(TurnState.SENDING)
                        .target(TurnState.FINALIZING)
                        .event(TurnEvent.TERMINAL)
                    .and()
                    .withExternal()
                        .source(TurnState.STREAMING)
                        .target(TurnState.FINALIZING)
                        .event(TurnEvent.TERMINAL)
                    .and()
                    .withExternal()
                        .source(TurnState.SENDING)
                        .target(TurnState.FAILED)
                        .event(TurnEvent.ERROR)
                    .and()
                    .withExternal()
                        .source(TurnState.STREAMING)
                        .target(TurnState.FAILED)
                        .event(TurnEvent.ERROR)
                    .and()
                    .withExternal()
                        .source(TurnState.FINALIZING)
                        .target(TurnState.IDLE)
                        .event(TurnEvent.RESET)
                    .and()
                    .withExternal()
                        .source(TurnState.FAILED)
                        .target(TurnState.IDLE)
                        .event(TurnEvent.RESET);
            return builder.build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build turn state machine", e);
        }
    }
}
