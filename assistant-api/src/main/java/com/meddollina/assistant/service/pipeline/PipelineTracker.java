package com.meddollina.assistant.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class PipelineTracker {

    private final StateMachineFactory<PipelineStates, PipelineEvents> stateMachineFactory;

    public PipelineTracker(StateMachineFactory<PipelineStates, PipelineEvents> stateMachineFactory) {
        this.stateMachineFactory = stateMachineFactory;
    }

    public Run start() {
        String id = UUID.randomUUID().toString();
        StateMachine<PipelineStates, PipelineEvents> machine = stateMachineFactory.getStateMachine(id);
        machine.start();
        return new Run(id, machine);
    }

    /**
     * One question's pass through the pipeline.
     */
    public static final class Run {

        private static final Logger log = LoggerFactory.getLogger(Run.class);

        private final String id;
        private final StateMachine<PipelineStates, PipelineEvents> machine;
        // a stopped machine no longer reports its state
        private volatile PipelineStates current;

        Run(String id, StateMachine<PipelineStates, PipelineEvents> machine) {
            this.id = id;
            this.machine = machine;
            this.current = machine.getState().getId();
        }

        public String id() {
            return id;
        }

        public PipelineStates state() {
            return current;
        }

        /**
         * @throws IllegalStateException if the event is not valid from the current state
         */
        public PipelineStates advance(PipelineEvents event) {
            PipelineStates from = current;
            if (from.terminal() || !machine.sendEvent(event)) {
                throw new IllegalStateException("Event " + event + " not accepted in state " + from);
            }
            PipelineStates to = machine.getState().getId();
            if (to == from) {
                throw new IllegalStateException("Event " + event + " has no transition from state " + from);
            }
            current = to;
            log.debug("Pipeline {}: {} -> {}", id, from, to);
            if (to.terminal()) {
                machine.stop();
            }
            return to;
        }
    }
}
