package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Recommendation(
        String text,
        String priority,
        Integer priorityLevel,
        String type,
        List<String> affectedRequirements,
        List<String> affectedCode,
        StageName sourceStage
) {

    public Recommendation {
        affectedRequirements = affectedRequirements != null ? List.copyOf(affectedRequirements) : List.of();
        affectedCode = affectedCode != null ? List.copyOf(affectedCode) : List.of();
    }

    public static Recommendation plain(String text, StageName sourceStage) {
        return new Recommendation(text, null, null, null, List.of(), List.of(), sourceStage);
    }
}
