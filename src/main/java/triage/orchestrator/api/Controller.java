package triage.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triage.orchestrator.api.v1.dto.ErrorResponse;
import triage.orchestrator.server.RouterHandler;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize a DTO with the shared mapper. */
        public static ControllerResponse json(HttpResponseStatus status, Object dto) {
            try {
                return json(status, RouterHandler.mapper().writeValueAsString(dto));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("failed to serialize " + dto.getClass().getSimpleName(), e);
            }
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return json(status, ErrorResponse.of(message));
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse unavailable(String message) {
            return error(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        public static ControllerResponse internalError(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
