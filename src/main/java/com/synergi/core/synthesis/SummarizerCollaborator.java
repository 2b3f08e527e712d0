package com.synergi.core.synthesis;

import com.synergi.core.model.StepOutcome;

import java.util.List;

/**
 * External summarizer that merges step results into one answer.
 */
public interface SummarizerCollaborator {

    /**
     * @throws SynthesisFailureException on any failure
     */
    String summarize(String taskText, List<StepOutcome> outcomes);
}
