package tickwork.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.api.Controller;
import tickwork.engine.api.v1.dto.DeadLetterResponse;
import tickwork.engine.api.v1.dto.ExecutionResultResponse;
import tickwork.engine.model.Job;
import tickwork.engine.service.JobService;
import tickwork.engine.service.ResultService;
import tickwork.engine.util.Json;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only inspection of execution outcomes.
 *
 * GET /api/v1/jobs/{jobId}/results?limit=N - recent attempts of a job
 * GET /api/v1/queues/{queue}/dead-letters?limit=N - dead letters of a queue
 */
public class ResultController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ResultController.class);

    private static final Pattern JOB_RESULTS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/results$");
    private static final Pattern DEAD_LETTERS_PATTERN = Pattern.compile("^/api/v1/queues/([^/]+)/dead-letters$");

    private final JobService jobService;
    private final ResultService resultService;

    public ResultController(JobService jobService, ResultService resultService) {
        this.jobService = jobService;
        this.resultService = resultService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (JOB_RESULTS_PATTERN.matcher(path).matches() || DEAD_LETTERS_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            int limit = limitParam(req.uri());

            Matcher results = JOB_RESULTS_PATTERN.matcher(path);
            if (results.matches()) {
                return handleJobResults(results.group(1), limit);
            }

            Matcher deadLetters = DEAD_LETTERS_PATTERN.matcher(path);
            if (deadLetters.matches()) {
                return handleDeadLetters(deadLetters.group(1), limit);
            }

            return ControllerResponse.notFound("unknown results endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Result controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleJobResults(String jobId, int limit) throws Exception {
        Optional<Job> job = jobService.getJob(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        List<ExecutionResultResponse> results = resultService.resultsForJob(jobId, limit).stream()
                .map(ExecutionResultResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jobId", jobId);
        response.put("enabled", job.get().enabled());
        response.put("nextRun", job.get().nextRun());
        response.put("count", results.size());
        response.put("results", results);
        return ControllerResponse.json(Json.MAPPER.writeValueAsString(response));
    }

    private ControllerResponse handleDeadLetters(String queue, int limit) throws Exception {
        List<DeadLetterResponse> letters = resultService.deadLetters(queue, limit).stream()
                .map(DeadLetterResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("queue", queue);
        response.put("count", letters.size());
        response.put("deadLetters", letters);
        return ControllerResponse.json(Json.MAPPER.writeValueAsString(response));
    }

    static int limitParam(String uri) {
        List<String> values = new QueryStringDecoder(uri).parameters().get("limit");
        if (values == null || values.isEmpty()) {
            return ResultService.DEFAULT_LIMIT;
        }
        try {
            return Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number: " + values.get(0));
        }
    }
}
