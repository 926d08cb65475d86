package com.myorg.mbus.contracts.core.context;

import lombok.Getter;

@Getter
public class ContextDoneException extends RuntimeException {

    private final BusContext.DoneReason reason;

    public ContextDoneException(BusContext.DoneReason reason) {
        super(reason == BusContext.DoneReason.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context canceled");
        this.reason = reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == BusContext.DoneReason.DEADLINE_EXCEEDED;
    }
}
