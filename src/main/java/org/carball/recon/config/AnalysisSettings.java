package org.carball.recon.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class AnalysisSettings {

    // Values classified per date-bearing column
    @Builder.Default
    @JsonProperty("date_sample_size")
    private int dateSampleSize = 10;

    // Token-overlap similarity needed for a fuzzy header match
    @Builder.Default
    @JsonProperty("similarity_threshold")
    private double similarityThreshold = 0.7;

    // Substrings of a normalized header that mark it as date-bearing
    @Builder.Default
    @JsonProperty("date_keywords")
    private List<String> dateKeywords = new ArrayList<>(List.of(
            "date", "reg_date", "registration_date", "exemption_date", "dob", "died", "paid"));

    // 1 runs files sequentially
    @Builder.Default
    @JsonProperty("parallelism")
    private int parallelism = 1;

    // Share of analyzed files a field must appear in to be a core column in the DDL suggestion
    @Builder.Default
    @JsonProperty("core_field_ratio")
    private double coreFieldRatio = 0.5;

    // Non-blank values kept per column as profile samples
    @Builder.Default
    @JsonProperty("profile_sample_size")
    private int profileSampleSize = 10;

    // Columns with at most this many distinct values report their value set
    @Builder.Default
    @JsonProperty("categorical_limit")
    private int categoricalLimit = 50;

    public static AnalysisSettings createDefaults() {
        return AnalysisSettings.builder().build();
    }

    /**
     * Rejects values the analysis cannot run with and warns about values that are legal but unusual.
     */
    public void validate() {
        if (dateSampleSize < 1) {
            throw new IllegalArgumentException("Date sample size must be positive: " + dateSampleSize);
        }
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1]: " + similarityThreshold);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        if (profileSampleSize < 0) {
            throw new IllegalArgumentException("Profile sample size must not be negative: " + profileSampleSize);
        }
        if (categoricalLimit < 0) {
            throw new IllegalArgumentException("Categorical limit must not be negative: " + categoricalLimit);
        }
        if (dateKeywords == null || dateKeywords.isEmpty()) {
            log.warn("No date keywords configured; no column will be sampled for date formats");
        }
        if (similarityThreshold < 0.5) {
            log.warn("Similarity threshold ({}) is low and may produce many ambiguous mappings", similarityThreshold);
        }
        if (coreFieldRatio < 0.0 || coreFieldRatio > 1.0) {
            log.warn("Core field ratio ({}) should be between 0 and 1", coreFieldRatio);
        }
        int processors = Runtime.getRuntime().availableProcessors();
        if (parallelism > processors * 4) {
            log.warn("Parallelism ({}) is far above available processors ({})", parallelism, processors);
        }
    }

    public String getDescription() {
        return String.format(
                "Settings: dateSampleSize=%d, similarityThreshold=%.2f, dateKeywords=%s, parallelism=%d, "
                        + "coreFieldRatio=%.2f, profileSampleSize=%d, categoricalLimit=%d",
                dateSampleSize, similarityThreshold, dateKeywords, parallelism, coreFieldRatio,
                profileSampleSize, categoricalLimit);
    }
}
