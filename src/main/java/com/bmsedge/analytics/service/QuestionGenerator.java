package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.AnomalyQuestion;

/**
 * Optional capability that turns an anomaly description into a follow-up question for the user.
 * Implementations typically call a language model and may fail or return nothing.
 */
public interface QuestionGenerator {

    /**
     * @param displayDate human-readable period of the anomaly
     * @param productName product id or name shown to the user
     * @param description short description of what changed
     * @return the question, or null when nothing could be generated
     */
    AnomalyQuestion generate(String displayDate, String productName, String description);
}
