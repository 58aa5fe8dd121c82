package triage.orchestrator.executor;

import triage.orchestrator.backend.InferenceBackend;
import triage.orchestrator.core.CancellationToken;
import triage.orchestrator.model.ClassificationResult;
import triage.orchestrator.model.JobOutcome;
import triage.orchestrator.model.LabelScore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Body of one classification job, run on a pool worker.
 *
 * Processes items in order and checks the cancellation token before each one.
 * A backend failure stops the job and is captured in the outcome together with
 * the log written so far; nothing is thrown to the pool for expected failures.
 * An interrupt from the pool counts as a cancellation request.
 */
public final class ClassificationJob implements Callable<JobOutcome> {

    private final String jobId;
    private final List<String> items;
    private final List<String> categories;
    private final InferenceBackend backend;
    private final CancellationToken token;
    private final ProgressListener progress;
    private final JobLog jobLog;

    public ClassificationJob(String jobId,
            List<String> items,
            List<String> categories,
            InferenceBackend backend,
            CancellationToken token,
            ProgressListener progress,
            Clock clock) {
        this.jobId = jobId;
        this.items = List.copyOf(items);
        this.categories = List.copyOf(categories);
        this.backend = backend;
        this.token = token;
        this.progress = progress != null ? progress : ProgressListener.NONE;
        this.jobLog = new JobLog(jobId, clock);
    }

    @Override
    public JobOutcome call() {
        int total = items.size();
        jobLog.info("Starting classification job {} with {} items", jobId, total);

        List<ClassificationResult> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                jobLog.warn("Job {} cancelled after {} of {} items", jobId, i, total);
                return JobOutcome.aborted(jobLog.contents(), i);
            }

            String item = items.get(i);
            try {
                List<LabelScore> ranked = backend.classify(item, categories);
                ClassificationResult result = ClassificationResult.fromRanked(item, ranked);
                results.add(result);
                jobLog.info("Item {}/{} classified as '{}': {}", i + 1, total, result.predicted(), item);
            } catch (Exception e) {
                if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    jobLog.warn("Job {} cancelled during item {}/{}: {}", jobId, i + 1, total, e.getMessage());
                    return JobOutcome.aborted(jobLog.contents(), i);
                }
                jobLog.error("Job {} failed on item {}/{} with error: {}", jobId, i + 1, total, e.getMessage(), e);
                return JobOutcome.failed(describe(e), jobLog.contents(), i);
            }

            reportProgress((double) (i + 1) / total);
        }

        jobLog.info("Job {} completed successfully", jobId);
        return JobOutcome.completed(results, jobLog.contents());
    }

    private void reportProgress(double fraction) {
        try {
            progress.onProgress(jobId, fraction);
        } catch (RuntimeException e) {
            jobLog.warn("Progress update for job {} failed: {}", jobId, e.getMessage());
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg != null && !msg.isBlank() ? msg : e.getClass().getSimpleName();
    }

    public String jobId() {
        return jobId;
    }
}
