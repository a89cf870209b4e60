package com.essaycoach.judgment;

import com.essaycoach.errors.JudgmentUnavailableException;
import com.essaycoach.models.Dimension;
import com.essaycoach.models.PromptRecord;

/**
 * Semantic judgment of an essay along one rubric dimension.
 *
 * <p>Implementations may block on a remote call and may be invoked concurrently
 * for different dimensions of the same essay.
 */
public interface JudgmentClient {

    /**
     * @param dimension      axis being judged; the returned score is bounded by its ceiling
     * @param essayText      the submission
     * @param prompt         the writing task the essay answers
     * @param rubricGuidance what the judge should look for on this axis
     * @throws JudgmentUnavailableException on transport failure, quota, timeout or an unusable reply
     */
    Judgment judge(Dimension dimension, String essayText, PromptRecord prompt, String rubricGuidance)
            throws JudgmentUnavailableException;
}
