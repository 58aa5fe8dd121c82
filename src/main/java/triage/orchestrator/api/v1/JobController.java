package triage.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triage.orchestrator.api.Controller;
import triage.orchestrator.api.v1.dto.CancelResponse;
import triage.orchestrator.api.v1.dto.ClassifyBatchRequest;
import triage.orchestrator.api.v1.dto.ErrorResponse;
import triage.orchestrator.api.v1.dto.JobLogResponse;
import triage.orchestrator.api.v1.dto.JobResultsResponse;
import triage.orchestrator.api.v1.dto.JobStatusResponse;
import triage.orchestrator.api.v1.dto.SubmitResponse;
import triage.orchestrator.exception.InvalidJobStateException;
import triage.orchestrator.exception.InvalidRequestException;
import triage.orchestrator.exception.JobNotFoundException;
import triage.orchestrator.exception.PoolExhaustedException;
import triage.orchestrator.exception.ServiceShuttingDownException;
import triage.orchestrator.model.JobRecord;
import triage.orchestrator.server.RouterHandler;
import triage.orchestrator.service.JobOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for classification jobs (public API).
 *
 * POST /api/v1/classify/batch - Submit a batch
 * GET /api/v1/jobs/{jobId} - Get job status
 * GET /api/v1/jobs/{jobId}/results - Get results (COMPLETED only)
 * GET /api/v1/jobs/{jobId}/log - Get captured log
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job
 * DELETE /api/v1/jobs/{jobId} - Cancel a job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern SUBMIT_PATTERN = Pattern.compile("^/api/v1/classify/batch$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_RESULTS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/results$");
    private static final Pattern JOB_LOG_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/log$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private final JobOrchestrator orchestrator;

    public JobController(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SUBMIT_PATTERN.matcher(path).matches() ||
                    JOB_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches() ||
                    JOB_RESULTS_PATTERN.matcher(path).matches() ||
                    JOB_LOG_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        try {
            if (method.equals(HttpMethod.POST) && SUBMIT_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }

            Matcher cancelMatcher = JOB_CANCEL_PATTERN.matcher(path);
            if (method.equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher resultsMatcher = JOB_RESULTS_PATTERN.matcher(path);
            if (method.equals(HttpMethod.GET) && resultsMatcher.matches()) {
                return handleGetResults(resultsMatcher.group(1));
            }

            Matcher logMatcher = JOB_LOG_PATTERN.matcher(path);
            if (method.equals(HttpMethod.GET) && logMatcher.matches()) {
                return handleGetLog(logMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                String jobId = jobMatcher.group(1);
                if (method.equals(HttpMethod.DELETE)) {
                    return handleCancel(jobId);
                }
                return handleGetJob(jobId);
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JobNotFoundException e) {
            return ControllerResponse.notFound("Job not found");
        } catch (InvalidRequestException e) {
            log.debug("Rejected submission: {}", e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (PoolExhaustedException | ServiceShuttingDownException e) {
            log.warn("Submission refused: {}", e.getMessage());
            return ControllerResponse.unavailable(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.internalError("internal error");
        }
    }

    /**
     * POST /api/v1/classify/batch - Submit a batch
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        ClassifyBatchRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, ClassifyBatchRequest.class);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Malformed JSON body");
        }
        if (request == null) {
            return ControllerResponse.badRequest("Items and categories required");
        }

        JobRecord job = orchestrator.submit(request.itemsOrEmpty(), request.categoriesOrEmpty());
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, SubmitResponse.from(job));
    }

    /**
     * GET /api/v1/jobs/{jobId} - Get job status
     */
    private ControllerResponse handleGetJob(String jobId) {
        return ControllerResponse.json(HttpResponseStatus.OK, JobStatusResponse.from(orchestrator.query(jobId)));
    }

    /**
     * GET /api/v1/jobs/{jobId}/results - Get job results
     */
    private ControllerResponse handleGetResults(String jobId) {
        try {
            return ControllerResponse.json(HttpResponseStatus.OK,
                    JobResultsResponse.from(orchestrator.results(jobId)));
        } catch (InvalidJobStateException e) {
            return ControllerResponse.json(HttpResponseStatus.BAD_REQUEST,
                    ErrorResponse.of(e.getMessage(), e.state().value()));
        }
    }

    /**
     * GET /api/v1/jobs/{jobId}/log - Get captured log
     */
    private ControllerResponse handleGetLog(String jobId) {
        return ControllerResponse.json(HttpResponseStatus.OK, new JobLogResponse(jobId, orchestrator.log(jobId)));
    }

    /**
     * POST /api/v1/jobs/{jobId}/cancel, DELETE /api/v1/jobs/{jobId} - Cancel a job
     */
    private ControllerResponse handleCancel(String jobId) {
        try {
            JobRecord job = orchestrator.cancel(jobId);
            return ControllerResponse.json(HttpResponseStatus.OK, CancelResponse.from(job));
        } catch (InvalidJobStateException e) {
            return ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    ErrorResponse.of(e.getMessage(), e.state().value()));
        }
    }
}
