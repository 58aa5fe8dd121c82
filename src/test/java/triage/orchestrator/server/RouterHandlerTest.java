package triage.orchestrator.server;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import triage.orchestrator.api.Controller;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private EmbeddedChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }

    private static Controller controller(String path, Runnable behaviour) {
        return new Controller() {
            @Override
            public boolean matches(HttpMethod method, String p) {
                return p.equals(path);
            }

            @Override
            public ControllerResponse handle(io.netty.channel.ChannelHandlerContext ctx,
                    io.netty.handler.codec.http.FullHttpRequest req, String p) {
                behaviour.run();
                return ControllerResponse.json("{\"ok\":true}");
            }
        };
    }

    private FullHttpResponse send(String uri) {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
        return channel.readOutbound();
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    @Test
    void dispatchesToMatchingControllerIgnoringQuery() {
        channel = new EmbeddedChannel(new RouterHandler().registerController(controller("/api/v1/ok", () -> {
        })));

        FullHttpResponse response = send("/api/v1/ok?verbose=1");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json; charset=utf-8", response.headers().get("Content-Type"));
        assertEquals("{\"ok\":true}", body(response));
    }

    @Test
    void unmatchedPathIsNotFound() {
        channel = new EmbeddedChannel(new RouterHandler());

        FullHttpResponse response = send("/api/v1/missing");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("{\"error\":\"not found\"}", body(response));
    }

    @Test
    void illegalArgumentBecomesBadRequest() {
        channel = new EmbeddedChannel(new RouterHandler().registerController(controller("/bad", () -> {
            throw new IllegalArgumentException("bad \"input\"");
        })));

        FullHttpResponse response = send("/bad");

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("{\"error\":\"bad \\\"input\\\"\"}", body(response));
    }

    @Test
    void unexpectedExceptionBecomesServerError() {
        channel = new EmbeddedChannel(new RouterHandler().registerController(controller("/boom", () -> {
            throw new IllegalStateException("boom");
        })));

        FullHttpResponse response = send("/boom");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertTrue(body(response).contains("boom"));
    }
}
