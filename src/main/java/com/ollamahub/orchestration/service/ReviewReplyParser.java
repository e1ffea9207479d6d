package com.ollamahub.orchestration.service;

import static com.ollamahub.orchestration.OrchestrationConstants.FINAL_ANSWER_HEADING;
import static com.ollamahub.orchestration.OrchestrationConstants.FINAL_ANSWER_HEADING_KEYWORD;
import static com.ollamahub.orchestration.OrchestrationConstants.REVIEW_HEADING_KEYWORD;

import com.ollamahub.orchestration.model.ReviewReply;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Splits a reviewer reply at its final-answer heading. A line equal to the requested heading
 * wins; otherwise the last heading mentioning "final answer" is used, so sub-headings inside the
 * critique do not cut it short.
 */
@Component
public class ReviewReplyParser {

    public ReviewReply parse(String raw) {
        Assert.hasText(raw, "Reviewer reply must not be empty");
        List<String> lines = Arrays.asList(raw.split("\\R", -1));
        int separator = indexOfSeparator(lines);
        if (separator < 0) {
            return new ReviewReply.Unstructured(raw);
        }
        String answer = String.join("\n", lines.subList(separator + 1, lines.size())).strip();
        if (!StringUtils.hasText(answer)) {
            return new ReviewReply.Unstructured(raw);
        }
        return new ReviewReply.Structured(critique(lines.subList(0, separator)), answer);
    }

    private static int indexOfSeparator(List<String> lines) {
        int loose = -1;
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).strip();
            if (isExactFinalAnswerHeading(line)) {
                return i;
            }
            if (loose < 0 && isHeadingContaining(line, FINAL_ANSWER_HEADING_KEYWORD)) {
                loose = i;
            }
        }
        return loose;
    }

    private static String critique(List<String> lines) {
        int first = 0;
        while (first < lines.size() && lines.get(first).isBlank()) {
            first++;
        }
        // Drop the leading review heading only; headings further down belong to the critique.
        if (first < lines.size() && isHeadingContaining(lines.get(first).strip(), REVIEW_HEADING_KEYWORD)) {
            first++;
        }
        return String.join("\n", lines.subList(first, lines.size())).strip();
    }

    private static boolean isExactFinalAnswerHeading(String line) {
        String heading = line.endsWith(":") ? line.substring(0, line.length() - 1).strip() : line;
        return heading.equalsIgnoreCase(FINAL_ANSWER_HEADING);
    }

    private static boolean isHeadingContaining(String line, String keyword) {
        return line.startsWith("#") && line.toLowerCase(Locale.ROOT).contains(keyword);
    }
}
