package com.questrail.transition.config;

import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.core.AbsentStatePolicy;
import com.questrail.transition.internal.time.SystemWallClock;
import com.questrail.transition.internal.time.WallClock;
import com.questrail.transition.observability.NullObservabilitySink;
import com.questrail.transition.observability.TransitionObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for a {@link com.questrail.transition.core.StateManager}.
 *
 * <p>The {@code stateType}, {@code changeType} and {@code eventType} classes
 * are the runtime side of the generic contract: values crossing the dispatch
 * boundary are checked against them. The state copier is not part of the
 * configuration; it is typed to the state and passed to the manager directly.</p>
 */
public record StateManagerConfig(
    String name,
    AbsentStatePolicy absentStatePolicy,
    TransitionObservabilitySink observabilitySink,
    WallClock clock,
    Class<? extends State> stateType,
    Class<? extends StateChange> changeType,
    Class<? extends Event> eventType
) {
    public StateManagerConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(absentStatePolicy, "absentStatePolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(stateType, "stateType");
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(eventType, "eventType");
    }

    public static StateManagerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "state-manager";
        private AbsentStatePolicy absentStatePolicy = AbsentStatePolicy.PASS_THROUGH;
        private TransitionObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private Class<? extends State> stateType = State.class;
        private Class<? extends StateChange> changeType = StateChange.class;
        private Class<? extends Event> eventType = Event.class;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withAbsentStatePolicy(AbsentStatePolicy policy) {
            this.absentStatePolicy = policy;
            return this;
        }

        public Builder withObservabilitySink(TransitionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Declares the closed variant types accepted at the dispatch boundary.
         */
        public Builder withTypes(Class<? extends State> stateType,
                                 Class<? extends StateChange> changeType,
                                 Class<? extends Event> eventType) {
            this.stateType = stateType;
            this.changeType = changeType;
            this.eventType = eventType;
            return this;
        }

        public StateManagerConfig build() {
            return new StateManagerConfig(name, absentStatePolicy, observabilitySink,
                clock, stateType, changeType, eventType);
        }
    }
}
