package com.relayline.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Study-progress context for one user, appended to the system prompt when requested.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppDataContext {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("study_progress")
    StudyProgress studyProgress;

    @JsonProperty("recent_activity")
    RecentActivity recentActivity;

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StudyProgress {

        @JsonProperty("total_blocks")
        int totalBlocks;

        @JsonProperty("completed_blocks")
        int completedBlocks;

        /**
         * Percentage, 0-100.
         */
        @JsonProperty("accuracy")
        double accuracy;

        @JsonProperty("subjects_studied")
        List<String> subjectsStudied;

        @JsonProperty("time_spent_hours")
        double timeSpentHours;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecentActivity {

        @JsonProperty("questions_answered")
        int questionsAnswered;

        @JsonProperty("correct_answers")
        int correctAnswers;

        @JsonProperty("topics_struggled")
        List<String> topicsStruggled;

        @JsonProperty("topics_strong")
        List<String> topicsStrong;
    }
}
