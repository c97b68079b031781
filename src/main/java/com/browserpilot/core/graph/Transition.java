package com.browserpilot.core.graph;

import com.browserpilot.core.model.Interrupt;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.state.StateUpdate;

import java.util.Objects;

/**
 * Result of one node invocation: a state delta plus the node's routing decision.
 */
public sealed interface Transition permits Transition.Continue, Transition.Suspend, Transition.Terminal {

    StateUpdate update();

    /** Run {@code nextNode} next. */
    record Continue(String nextNode, StateUpdate update) implements Transition {
        public Continue {
            Objects.requireNonNull(nextNode, "nextNode");
            update = update != null ? update : StateUpdate.empty();
        }
    }

    /** Stop and hand {@code interrupt} to the caller; resume at {@code resumeNode}. */
    record Suspend(Interrupt interrupt, String resumeNode, StateUpdate update) implements Transition {
        public Suspend {
            Objects.requireNonNull(interrupt, "interrupt");
            Objects.requireNonNull(resumeNode, "resumeNode");
            update = update != null ? update : StateUpdate.empty();
        }
    }

    /** Stop with a final outcome. */
    record Terminal(Outcome outcome, StateUpdate update) implements Transition {
        public Terminal {
            Objects.requireNonNull(outcome, "outcome");
            update = update != null ? update : StateUpdate.empty();
        }
    }

    static Transition next(String nodeId) {
        return new Continue(nodeId, StateUpdate.empty());
    }

    static Transition next(String nodeId, StateUpdate update) {
        return new Continue(nodeId, update);
    }

    static Transition terminal(Outcome outcome, StateUpdate update) {
        return new Terminal(outcome, update);
    }
}
