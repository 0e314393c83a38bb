package com.focusflow.backend.modules.mode.application;

import java.util.Objects;

import com.focusflow.backend.modules.mode.domain.TransitionReason;

/**
 * Why a session is being closed, and whether the user should hear about it.
 */
public record FinalizeOptions(TransitionReason reason, boolean notifyUser) {

    public FinalizeOptions {
        Objects.requireNonNull(reason, "reason is required");
    }

    public static FinalizeOptions notifying(TransitionReason reason) {
        return new FinalizeOptions(reason, true);
    }

    public static FinalizeOptions silent(TransitionReason reason) {
        return new FinalizeOptions(reason, false);
    }
}
