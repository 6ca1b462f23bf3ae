package com.chatstore.maintenance;

import lombok.Value;

import java.util.List;

/**
 * Pass/fail results of a database verification run.
 */
@Value
public class VerificationReport {

    List<Check> checks;

    /**
     * Healthy when every critical check passed (connection, pgvector, required tables, vector index).
     */
    public boolean isHealthy() {
        return checks.stream()
                .filter(Check::isCritical)
                .allMatch(Check::isPassed);
    }

    public long failedCount() {
        return checks.stream().filter(check -> !check.isPassed()).count();
    }

    @Value
    public static class Check {
        String name;
        boolean passed;
        boolean critical;
        String detail;

        public static Check pass(String name, String detail) {
            return new Check(name, true, false, detail);
        }

        public static Check fail(String name, String detail) {
            return new Check(name, false, false, detail);
        }

        public Check asCritical() {
            return new Check(name, passed, true, detail);
        }
    }
}
