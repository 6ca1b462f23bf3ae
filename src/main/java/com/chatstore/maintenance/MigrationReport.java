package com.chatstore.maintenance;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a migration run: which scripts were applied, where it stopped,
 * and the schema objects present afterwards.
 */
@Value
@Builder
public class MigrationReport {

    int discoveredScripts;

    @Singular("result")
    List<ScriptResult> results;

    @Singular("table")
    List<String> tables;

    // null when pgvector is not installed
    String vectorExtensionVersion;

    @Singular("index")
    List<SchemaInventory.IndexInfo> indexes;

    public long appliedCount() {
        return results.stream().filter(ScriptResult::isSuccess).count();
    }

    public boolean isSuccessful() {
        return appliedCount() == discoveredScripts;
    }

    @Value
    public static class ScriptResult {
        String fileName;
        boolean success;
        String error;

        public static ScriptResult applied(String fileName) {
            return new ScriptResult(fileName, true, null);
        }

        public static ScriptResult failed(String fileName, String error) {
            return new ScriptResult(fileName, false, error);
        }
    }
}
