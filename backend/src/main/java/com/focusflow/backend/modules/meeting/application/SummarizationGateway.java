package com.focusflow.backend.modules.meeting.application;

/**
 * Turns a note transcript into a short natural-language summary.
 */
public interface SummarizationGateway {

    /**
     * @throws SummarizationException when no summary could be produced; the notes stay pending
     */
    String summarize(SummarizationRequest request);
}
