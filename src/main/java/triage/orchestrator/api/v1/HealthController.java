package triage.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triage.orchestrator.api.Controller;
import triage.orchestrator.api.v1.dto.HealthResponse;
import triage.orchestrator.service.JobOrchestrator;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final JobOrchestrator orchestrator;

    public HealthController(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        int active = orchestrator.activeJobCount();
        int total = orchestrator.totalJobCount();

        if (orchestrator.isShuttingDown()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.shuttingDown(active, total, formatUptime(), VERSION));
        }
        return ControllerResponse.json(HttpResponseStatus.OK,
                HealthResponse.healthy(active, total, formatUptime(), VERSION));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
