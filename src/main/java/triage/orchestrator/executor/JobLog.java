package triage.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;

/**
 * Diagnostic log captured for a single job.
 * Every line is kept in memory (returned to clients with the job) and mirrored
 * to the application logger.
 */
public final class JobLog {

    private static final Logger log = LoggerFactory.getLogger(JobLog.class);

    private final String jobId;
    private final Clock clock;
    private final StringBuilder buffer = new StringBuilder();

    public JobLog(String jobId, Clock clock) {
        this.jobId = jobId;
        this.clock = clock;
    }

    public void info(String format, Object... args) {
        FormattingTuple ft = MessageFormatter.arrayFormat(format, args);
        append("INFO", ft.getMessage(), ft.getThrowable());
        log.info("[{}] {}", jobId, ft.getMessage());
    }

    public void warn(String format, Object... args) {
        FormattingTuple ft = MessageFormatter.arrayFormat(format, args);
        append("WARN", ft.getMessage(), ft.getThrowable());
        log.warn("[{}] {}", jobId, ft.getMessage());
    }

    /** A trailing Throwable argument is rendered with its stack trace. */
    public void error(String format, Object... args) {
        FormattingTuple ft = MessageFormatter.arrayFormat(format, args);
        append("ERROR", ft.getMessage(), ft.getThrowable());
        if (ft.getThrowable() != null) {
            log.error("[{}] {}", jobId, ft.getMessage(), ft.getThrowable());
        } else {
            log.error("[{}] {}", jobId, ft.getMessage());
        }
    }

    private synchronized void append(String level, String message, Throwable t) {
        buffer.append(clock.instant()).append(' ').append(level).append(' ').append(message).append('\n');
        if (t != null) {
            StringWriter sw = new StringWriter();
            t.printStackTrace(new PrintWriter(sw));
            buffer.append(sw);
        }
    }

    /** Everything logged so far. */
    public synchronized String contents() {
        return buffer.toString();
    }
}
