package com.bmsedge.analytics.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public final class AnomalyQuestion {

    private final String question;
    private final List<String> choices;
    private final boolean generated;

    public AnomalyQuestion(String question, List<String> choices, boolean generated) {
        this.question = question;
        this.choices = List.copyOf(choices);
        this.generated = generated;
    }
}
