package exray.bridge.api.v1;

import exray.bridge.api.Controller;
import exray.bridge.api.MultipartForm;
import exray.bridge.api.v1.dto.ResultResponse;
import exray.bridge.api.v1.dto.RunListResponse;
import exray.bridge.api.v1.dto.RunResponse;
import exray.bridge.api.v1.dto.SubmitRunForm;
import exray.bridge.error.RunNotFoundException;
import exray.bridge.model.RunRecord;
import exray.bridge.model.WorkflowKind;
import exray.bridge.service.RunOrchestrator;
import exray.bridge.service.SubmitRequest;
import exray.bridge.util.Jsons;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for runs (public API).
 *
 * POST /api/v1/runs/{ctgan|llm|custom} - Submit a run (multipart form)
 * GET  /api/v1/runs                    - List runs
 * GET  /api/v1/runs/{runId}            - Get a run
 * GET  /api/v1/runs/{runId}/result     - Download link for the result
 * GET  /api/v1/runs/{runId}/logs       - Aggregated workflow logs
 */
public class RunController implements Controller {

    private static final Pattern SUBMIT_PATTERN = Pattern.compile("^/api/v1/runs/(ctgan|llm|custom)$");
    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs/?$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern RUN_RESULT_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/result$");
    private static final Pattern RUN_LOGS_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/logs$");

    private final RunOrchestrator orchestrator;

    public RunController(RunOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SUBMIT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || RUN_BY_ID_PATTERN.matcher(path).matches()
                    || RUN_RESULT_PATTERN.matcher(path).matches()
                    || RUN_LOGS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());

        Matcher submitMatcher = SUBMIT_PATTERN.matcher(path);
        if (req.method().equals(HttpMethod.POST) && submitMatcher.matches()) {
            WorkflowKind kind = WorkflowKind.fromTag(submitMatcher.group(1))
                    .orElseThrow(() -> new IllegalArgumentException("unknown workflow kind"));
            return handleSubmit(kind, req);
        }

        if (RUNS_PATTERN.matcher(path).matches()) {
            List<RunRecord> runs = orchestrator.listRuns(flag(query, "refresh", true));
            return ControllerResponse.json(Jsons.toJson(RunListResponse.from(runs)));
        }

        Matcher resultMatcher = RUN_RESULT_PATTERN.matcher(path);
        if (resultMatcher.matches()) {
            return ControllerResponse.json(
                    Jsons.toJson(ResultResponse.from(orchestrator.getResult(resultMatcher.group(1)))));
        }

        Matcher logsMatcher = RUN_LOGS_PATTERN.matcher(path);
        if (logsMatcher.matches()) {
            Integer tail = intParam(query, "tail");
            return ControllerResponse.text(orchestrator.getLogs(logsMatcher.group(1), tail));
        }

        Matcher runMatcher = RUN_BY_ID_PATTERN.matcher(path);
        if (runMatcher.matches()) {
            String runId = runMatcher.group(1);
            RunRecord run = orchestrator.getRun(runId, flag(query, "refresh", true))
                    .orElseThrow(() -> new RunNotFoundException(runId));
            return ControllerResponse.json(Jsons.toJson(RunResponse.from(run)));
        }

        return ControllerResponse.notFound("unknown run endpoint");
    }

    /**
     * POST /api/v1/runs/{kind}
     */
    private ControllerResponse handleSubmit(WorkflowKind kind, FullHttpRequest req) throws Exception {
        try (MultipartForm form = MultipartForm.decode(req)) {
            SubmitRunForm submission = SubmitRunForm.parse(kind, form.fields());

            String dataField = SubmitRunForm.dataFileField(kind);
            MultipartForm.UploadedPart data = form.file(dataField)
                    .orElseThrow(() -> new IllegalArgumentException(dataField + " is required"));

            SubmitRequest.UploadedFile script = null;
            if (kind == WorkflowKind.CUSTOM) {
                MultipartForm.UploadedPart part = form.file(SubmitRunForm.SCRIPT_FILE_FIELD)
                        .orElseThrow(() -> new IllegalArgumentException(SubmitRunForm.SCRIPT_FILE_FIELD + " is required"));
                SubmitRunForm.validateScriptName(part.filename());
                script = new SubmitRequest.UploadedFile(part.path(), part.filename());
            }

            RunRecord run = orchestrator.submit(new SubmitRequest(
                    kind,
                    submission.parameters(),
                    new SubmitRequest.UploadedFile(data.path(), data.filename()),
                    script,
                    submission.limits()));

            return ControllerResponse.json(HttpResponseStatus.CREATED, Jsons.toJson(RunResponse.from(run)));
        }
    }

    private static boolean flag(QueryStringDecoder query, String name, boolean fallback) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String value = values.get(0).trim();
        return value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes");
    }

    private static Integer intParam(QueryStringDecoder query, String name) {
        Map<String, List<String>> params = query.parameters();
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }
}
