package com.agentos.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Clarify-stage verdict for a goal or a task.
 *
 * @param clearEnough whether the model judged the input clear
 * @param confidence  0 to 100
 * @param questions   open questions, blocking or not
 * @param blocking    derived decision; when true, work must wait for answers
 */
public record ClarificationAssessment(
    boolean clearEnough,
    int confidence,
    List<ClarifyingQuestion> questions,
    boolean blocking
) {
    public ClarificationAssessment {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    /**
     * One line per question with urgency and a BLOCKING/Non-blocking label.
     */
    public String formatQuestions() {
        return questions.stream()
                .map(q -> "- [" + q.urgency().wireName() + "] "
                        + (Boolean.TRUE.equals(q.blocking()) ? "BLOCKING" : "Non-blocking") + ": "
                        + q.question()
                        + "\n  Why: " + q.why()
                        + "\n  Assumption if unanswered: " + q.assumptionIfUnanswered())
                .collect(Collectors.joining("\n"));
    }
}
