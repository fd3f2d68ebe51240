package com.meddollina.assistant.service.pipeline;

import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

import java.util.EnumSet;

/**
 * Lifecycle of a single question. Terminal states have no outgoing transitions, so any
 * event sent after one is refused.
 */
@Configuration
@EnableStateMachineFactory
public class PipelineStateMachineConfig extends EnumStateMachineConfigurerAdapter<PipelineStates, PipelineEvents> {

    @Override
    public void configure(StateMachineConfigurationConfigurer<PipelineStates, PipelineEvents> config) throws Exception {
        config.withConfiguration()
                .autoStartup(false);
    }

    @Override
    public void configure(StateMachineStateConfigurer<PipelineStates, PipelineEvents> states) throws Exception {
        states.withStates()
                .initial(PipelineStates.VALIDATING)
                .states(EnumSet.allOf(PipelineStates.class));
    }

    @Override
    public void configure(StateMachineTransitionConfigurer<PipelineStates, PipelineEvents> transitions) throws Exception {
        transitions
                .withExternal()
                    .source(PipelineStates.VALIDATING)
                    .target(PipelineStates.REJECTED)
                    .event(PipelineEvents.VALIDATION_REJECTED)
                .and()
                .withExternal()
                    .source(PipelineStates.VALIDATING)
                    .target(PipelineStates.REJECTED)
                    .event(PipelineEvents.VALIDATION_ERROR)
                .and()
                .withExternal()
                    .source(PipelineStates.VALIDATING)
                    .target(PipelineStates.INTENT_DETECTING)
                    .event(PipelineEvents.VALIDATION_PASSED)
                .and()
                .withExternal()
                    .source(PipelineStates.INTENT_DETECTING)
                    .target(PipelineStates.MALICIOUS)
                    .event(PipelineEvents.INTENT_MALICIOUS)
                .and()
                .withExternal()
                    .source(PipelineStates.INTENT_DETECTING)
                    .target(PipelineStates.CLARIFICATION_NEEDED)
                    .event(PipelineEvents.INTENT_NEEDS_CLARIFICATION)
                .and()
                .withExternal()
                    .source(PipelineStates.INTENT_DETECTING)
                    .target(PipelineStates.RETRIEVING)
                    .event(PipelineEvents.INTENT_RESOLVED)
                .and()
                .withExternal()
                    .source(PipelineStates.RETRIEVING)
                    .target(PipelineStates.REASONING)
                    .event(PipelineEvents.DOCUMENTS_RETRIEVED)
                .and()
                .withExternal()
                    .source(PipelineStates.REASONING)
                    .target(PipelineStates.FINAL_GENERATION)
                    .event(PipelineEvents.REASONING_COMPLETED)
                .and()
                .withExternal()
                    .source(PipelineStates.FINAL_GENERATION)
                    .target(PipelineStates.DONE)
                    .event(PipelineEvents.ANSWER_GENERATED)
                .and()
                .withExternal()
                    .source(PipelineStates.FINAL_GENERATION)
                    .target(PipelineStates.FAILED)
                    .event(PipelineEvents.GENERATION_FAILED);
    }
}
