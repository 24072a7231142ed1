package com.ryuqq.analysis.adapter.runner;

import com.ryuqq.analysis.adapter.file.audit.JsonlAuditLog;
import com.ryuqq.analysis.adapter.file.store.FileSystemArtifactStore;
import com.ryuqq.analysis.adapter.file.store.JsonFileCacheIndex;
import com.ryuqq.analysis.application.cache.CacheEfficiencyReport;
import com.ryuqq.analysis.application.cache.CacheStatistics;
import com.ryuqq.analysis.application.cache.ValidationCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * 검증 캐시 관리 CLI.
 *
 * <pre>
 * cache --stats                          [--root DIR]
 * cache --efficiency                     [--root DIR]
 * cache --cleanup [--max-age-hours N]    [--root DIR]   (기본 24시간)
 * cache --cleanup-failed                 [--root DIR]
 * </pre>
 *
 * <p>성공 시 0, 인자 오류 시 2, 실행 실패 시 1을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheCommand {

    private static final Logger log = LoggerFactory.getLogger(CacheCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String DEFAULT_ROOT = "analysis-data";
    static final long DEFAULT_MAX_AGE_HOURS = 24;

    static final String USAGE = String.join(System.lineSeparator(),
        "Usage: cache (--stats | --efficiency | --cleanup [--max-age-hours N] | --cleanup-failed) [--root DIR]",
        "  --stats            show cache entries and sizes",
        "  --efficiency       show hit rate and recommendations",
        "  --cleanup          remove entries older than --max-age-hours (default " + DEFAULT_MAX_AGE_HOURS + ")",
        "  --cleanup-failed   remove cached failed validations so they are retried",
        "  --root DIR         storage root (default " + DEFAULT_ROOT + ")");

    private final PrintStream out;
    private final PrintStream err;
    private final Clock clock;

    public CacheCommand(PrintStream out, PrintStream err, Clock clock) {
        if (out == null || err == null) {
            throw new IllegalArgumentException("out and err cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.out = out;
        this.err = err;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int code = new CacheCommand(System.out, System.err, Clock.systemUTC()).execute(args);
        System.exit(code);
    }

    /**
     * 명령 실행.
     *
     * @param args 인자
     * @return 종료 코드
     */
    public int execute(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            ValidationCacheManager manager = open(options.root());
            switch (options.action()) {
                case STATS -> printStatistics(manager.statistics());
                case EFFICIENCY -> printEfficiency(manager.efficiencyReport());
                case CLEANUP -> {
                    int removed = manager.cleanupOldEntries(Duration.ofHours(options.maxAgeHours()));
                    out.printf("Removed %d entries older than %d hours%n", removed, options.maxAgeHours());
                }
                case CLEANUP_FAILED -> {
                    int removed = manager.cleanupFailedEntries();
                    out.printf("Removed %d failed validation entries%n", removed);
                }
            }
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("cache {} failed for root {}", options.action(), options.root(), e);
            err.println("cache command failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private ValidationCacheManager open(Path root) {
        return new ValidationCacheManager(
            new FileSystemArtifactStore(root, FileSystemArtifactStore.DEFAULT_NAMESPACE, clock),
            JsonFileCacheIndex.under(root),
            new JsonlAuditLog(root.resolve("audit")),
            clock
        );
    }

    private void printStatistics(CacheStatistics statistics) {
        out.printf("Entries: %d (failed: %d, missing artifacts: %d)%n",
            statistics.totalEntries(), statistics.failedEntries(), statistics.missingArtifacts());
        out.printf("Total size: %d bytes%n", statistics.totalBytes());
        if (statistics.oldestEntry() != null) {
            out.printf("Oldest: %s, newest: %s%n", statistics.oldestEntry(), statistics.newestEntry());
        }
        for (CacheStatistics.EntrySummary entry : statistics.entries()) {
            out.printf("  %s  %-7s %-30s %8d bytes  %dh old%n",
                entry.key(), entry.status(), entry.model(), entry.size(), entry.age().toHours());
        }
    }

    private void printEfficiency(CacheEfficiencyReport report) {
        out.printf("Hit rate: %.1f%% (%d hits, %d misses) - %s%n",
            report.hitRate() * 100, report.hits(), report.misses(), report.efficiency());
        out.printf("Entries: %d (stale: %d, failed: %d)%n",
            report.totalEntries(), report.staleEntries(), report.failedEntries());
        out.printf("Size: %d bytes - %s%n", report.totalBytes(), report.sizeEfficiency());
        for (String recommendation : report.recommendations()) {
            out.println("  - " + recommendation);
        }
    }

    enum Action {
        STATS, EFFICIENCY, CLEANUP, CLEANUP_FAILED
    }

    /**
     * 파싱된 인자.
     */
    record Options(Action action, Path root, long maxAgeHours) {

        static Options parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("No action given");
            }
            Action action = null;
            Path root = Paths.get(DEFAULT_ROOT);
            Long maxAgeHours = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--stats" -> action = single(action, Action.STATS);
                    case "--efficiency" -> action = single(action, Action.EFFICIENCY);
                    case "--cleanup" -> action = single(action, Action.CLEANUP);
                    case "--cleanup-failed" -> action = single(action, Action.CLEANUP_FAILED);
                    case "--root" -> root = Paths.get(valueOf(args, ++i, arg));
                    case "--max-age-hours" -> maxAgeHours = parseHours(valueOf(args, ++i, arg));
                    default -> throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }

            if (action == null) {
                throw new IllegalArgumentException("No action given");
            }
            if (maxAgeHours != null && action != Action.CLEANUP) {
                throw new IllegalArgumentException("--max-age-hours is only valid with --cleanup");
            }
            return new Options(action, root, maxAgeHours == null ? DEFAULT_MAX_AGE_HOURS : maxAgeHours);
        }

        private static Action single(Action current, Action next) {
            if (current != null) {
                throw new IllegalArgumentException("Only one action allowed (got " + current + " and " + next + ")");
            }
            return next;
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index];
        }

        private static long parseHours(String value) {
            try {
                long hours = Long.parseLong(value);
                if (hours < 0) {
                    throw new IllegalArgumentException("--max-age-hours cannot be negative: " + value);
                }
                return hours;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--max-age-hours must be a number: " + value, e);
            }
        }
    }
}
