package com.chatstore.maintenance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;

/**
 * Command-line entry for the maintenance tools.
 *
 * <pre>
 *   --migrate      apply schema migrations
 *   --smoke-test   run the operations smoke test (after --migrate, only if it succeeded)
 *   --verify       print the verification report
 * </pre>
 *
 * Without any of these options the runner does nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseToolsRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String MIGRATE = "migrate";
    static final String SMOKE_TEST = "smoke-test";
    static final String VERIFY = "verify";

    private static final Set<String> TOOL_OPTIONS = Set.of(MIGRATE, SMOKE_TEST, VERIFY);

    private final MigrationRunner migrationRunner;
    private final DatabaseSmokeCheck databaseSmokeCheck;
    private final DatabaseVerifier databaseVerifier;

    private int exitCode;

    public static boolean isToolInvocation(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith("--"))
                .map(arg -> arg.substring(2))
                .anyMatch(TOOL_OPTIONS::contains);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(MIGRATE)) {
            MigrationReport report = migrationRunner.run().block();
            if (report == null || !report.isSuccessful()) {
                exitCode = 1;
            }
        }

        if (exitCode == 0 && args.containsOption(SMOKE_TEST)) {
            try {
                databaseSmokeCheck.run().block();
            } catch (RuntimeException e) {
                // already logged by the smoke test; report through the exit status
                exitCode = 1;
            }
        }

        if (args.containsOption(VERIFY)) {
            VerificationReport report = databaseVerifier.verify().block();
            if (report == null || !report.isHealthy()) {
                exitCode = 1;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
