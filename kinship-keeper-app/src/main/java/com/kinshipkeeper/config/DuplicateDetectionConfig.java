package com.kinshipkeeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring weights for duplicate detection.
 * Define under 'kinship.duplicates' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "kinship.duplicates")
public class DuplicateDetectionConfig {

    private int defaultThreshold = 70;
    private double nameWeight = 0.5;
    private double dateWeight = 0.3;
    private double parentWeight = 0.2;
    // a field only counts as "matching" above this score
    private int fieldMatchCutoff = 70;

    public int getDefaultThreshold() { return defaultThreshold; }
    public void setDefaultThreshold(int defaultThreshold) { this.defaultThreshold = defaultThreshold; }

    public double getNameWeight() { return nameWeight; }
    public void setNameWeight(double nameWeight) { this.nameWeight = nameWeight; }

    public double getDateWeight() { return dateWeight; }
    public void setDateWeight(double dateWeight) { this.dateWeight = dateWeight; }

    public double getParentWeight() { return parentWeight; }
    public void setParentWeight(double parentWeight) { this.parentWeight = parentWeight; }

    public int getFieldMatchCutoff() { return fieldMatchCutoff; }
    public void setFieldMatchCutoff(int fieldMatchCutoff) { this.fieldMatchCutoff = fieldMatchCutoff; }
}
