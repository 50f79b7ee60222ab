package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.AnomalyQuestion;
import com.bmsedge.analytics.dto.AnomalyRecord;
import com.bmsedge.analytics.model.AnomalyDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the follow-up question asked about a detected anomaly, using the injected generator
 * when one is available and a template otherwise.
 */
@Service
public class AnomalyQuestionService {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyQuestionService.class);

    private static final DateTimeFormatter MONTH_DISPLAY = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_DISPLAY = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    static final List<String> DEFAULT_CHOICES = List.of(
            "Campaign or promotion",
            "Weather",
            "Competitor activity",
            "Nothing in particular",
            "Other (free text)");

    private final Optional<QuestionGenerator> questionGenerator;

    public AnomalyQuestionService(Optional<QuestionGenerator> questionGenerator) {
        this.questionGenerator = questionGenerator;
    }

    public AnomalyQuestion generateQuestion(AnomalyRecord anomaly) {
        String displayName = anomaly.getDisplayName();
        String displayDate = formatPeriodForDisplay(anomaly.getPeriodKey());

        if (questionGenerator.isPresent()) {
            String description = String.format("Sales %s (actual: %.0f, expected: %.0f)",
                    anomaly.getDirection().getLabel(), anomaly.getActualValue(), anomaly.getExpectedValue());
            try {
                AnomalyQuestion generated = questionGenerator.get().generate(displayDate, displayName, description);
                if (generated != null && generated.getQuestion() != null && !generated.getQuestion().isBlank()) {
                    return generated;
                }
                logger.warn("Question generator returned no question for {} on {}, using template",
                        displayName, displayDate);
            } catch (RuntimeException e) {
                logger.warn("Question generator failed for {} on {}, using template: {}",
                        displayName, displayDate, e.getMessage());
            }
        }
        return templateQuestion(anomaly, displayName, displayDate);
    }

    private AnomalyQuestion templateQuestion(AnomalyRecord anomaly, String displayName, String displayDate) {
        String question;
        if (anomaly.getDirection() == AnomalyDirection.INCREASE) {
            question = String.format(
                    "Sales of \"%s\" in %s were %.0f above normal (expected: %.0f, actual: %.0f). "
                            + "Was there a special event, campaign or other outside factor at that time?",
                    displayName, displayDate, anomaly.getDeviation(), anomaly.getExpectedValue(),
                    anomaly.getActualValue());
        } else {
            question = String.format(
                    "Sales of \"%s\" in %s were %.0f below normal (expected: %.0f, actual: %.0f). "
                            + "Was there anything that held sales back, such as weather, competitors or stock-outs?",
                    displayName, displayDate, anomaly.getDeviation(), anomaly.getExpectedValue(),
                    anomaly.getActualValue());
        }
        return new AnomalyQuestion(question, DEFAULT_CHOICES, false);
    }

    /**
     * {@code 2024-03} becomes "March 2024", {@code 2024-W05} "2024 week 05" and {@code 2024-03-05}
     * "March 5, 2024". Anything else is returned unchanged.
     */
    public static String formatPeriodForDisplay(String periodKey) {
        if (periodKey == null) {
            return "";
        }
        try {
            if (periodKey.length() == 7 && periodKey.charAt(4) == '-') {
                return YearMonth.parse(periodKey).format(MONTH_DISPLAY);
            }
            if (periodKey.contains("-W")) {
                String[] parts = periodKey.split("-W");
                if (parts.length == 2) {
                    return parts[0] + " week " + parts[1];
                }
            }
            if (periodKey.length() == 10) {
                return LocalDate.parse(periodKey).format(DAY_DISPLAY);
            }
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable period key '{}'", periodKey);
        }
        return periodKey;
    }
}
