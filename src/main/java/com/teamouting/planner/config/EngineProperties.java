package com.teamouting.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables of the event lifecycle engine, bound from {@code outing.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "outing.engine")
public class EngineProperties {

    private int maxDateOptions = 10;

    @DurationUnit(ChronoUnit.MILLIS)
    private Duration lockTimeout = Duration.ofSeconds(2);

    private final Scoring scoring = new Scoring();

    public int getMaxDateOptions() {
        return maxDateOptions;
    }

    public void setMaxDateOptions(int maxDateOptions) {
        this.maxDateOptions = maxDateOptions;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Scoring getScoring() {
        return scoring;
    }

    /**
     * Weights of the date consensus score.
     */
    public static class Scoring {

        private int yesWeight = 2;
        private int maybeWeight = 1;
        private int noWeight = 0;
        private int priorityBonus = 1;

        public int getYesWeight() {
            return yesWeight;
        }

        public void setYesWeight(int yesWeight) {
            this.yesWeight = yesWeight;
        }

        public int getMaybeWeight() {
            return maybeWeight;
        }

        public void setMaybeWeight(int maybeWeight) {
            this.maybeWeight = maybeWeight;
        }

        public int getNoWeight() {
            return noWeight;
        }

        public void setNoWeight(int noWeight) {
            this.noWeight = noWeight;
        }

        public int getPriorityBonus() {
            return priorityBonus;
        }

        public void setPriorityBonus(int priorityBonus) {
            this.priorityBonus = priorityBonus;
        }
    }
}
