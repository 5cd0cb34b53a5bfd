package exray.bridge.server;

import exray.bridge.api.Controller.ControllerResponse;
import exray.bridge.error.ArtifactStoreException;
import exray.bridge.error.EngineQueryException;
import exray.bridge.error.EngineSubmissionException;
import exray.bridge.error.NoEngineNameException;
import exray.bridge.error.ObjectNotFoundException;
import exray.bridge.error.ResultUnavailableException;
import exray.bridge.error.RunNotCompleteException;
import exray.bridge.error.RunNotFoundException;
import exray.bridge.error.TemplateNotFoundException;
import exray.bridge.error.WorkflowNotFoundException;
import exray.bridge.util.Jsons;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private static int status(Exception e) {
        return RouterHandler.toErrorResponse(HttpMethod.GET, "/api/v1/runs/x", e).status().code();
    }

    @Test
    @DisplayName("Bridge failures map onto HTTP status codes")
    void errorMapping() {
        assertEquals(400, status(new IllegalArgumentException("bad")));
        assertEquals(400, status(new TemplateNotFoundException("x")));
        assertEquals(404, status(new RunNotFoundException("x")));
        assertEquals(404, status(new ResultUnavailableException("x", "failed")));
        assertEquals(404, status(new NoEngineNameException("x")));
        assertEquals(404, status(new WorkflowNotFoundException("wf")));
        assertEquals(404, status(new ObjectNotFoundException("b", "k")));
        assertEquals(409, status(new RunNotCompleteException("x", "Running")));
        assertEquals(502, status(new EngineSubmissionException(500, "down")));
        assertEquals(502, status(new EngineQueryException("fetch workflow", "wf", 500, "down")));
        assertEquals(502, status(new ArtifactStoreException("offline", new IOException("refused"))));
        assertEquals(500, status(new IllegalStateException("boom")));
    }

    @Test
    void errorBodyIsJson() throws Exception {
        ControllerResponse response = RouterHandler.toErrorResponse(HttpMethod.GET, "/x",
                new RunNotFoundException("r1"));

        assertEquals("application/json", response.contentType());
        assertEquals("Run not found: r1", Jsons.mapper().readTree(response.body()).path("error").asText());
    }
}
