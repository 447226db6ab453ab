package com.benefits.progress;

/**
 * Progress of one {@link FlowSection}.
 */
public record SectionProgress(
        String sectionId,
        String sectionName,
        int totalQuestions,
        int answeredQuestions,
        int progressPercent,
        boolean completed
) {
}
