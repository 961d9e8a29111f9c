package com.github.dimitryivaniuta.outreach.passes.web;

import com.github.dimitryivaniuta.outreach.passes.domain.PassGenerationJob;
import com.github.dimitryivaniuta.outreach.passes.domain.PassJobStatus;
import com.github.dimitryivaniuta.outreach.passes.domain.WalletPlatform;
import com.github.dimitryivaniuta.outreach.passes.service.JobMetadataCodec;
import com.github.dimitryivaniuta.outreach.passes.service.PassJobStore;
import com.github.dimitryivaniuta.outreach.passes.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.outreach.passes.web.dto.IssuePassRequest;
import com.github.dimitryivaniuta.outreach.passes.web.dto.PassJobResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for pass generation jobs.
 */
@RestController
@RequestMapping("/api")
public class PassJobsController {

    private final PassJobStore jobStore;
    private final JobMetadataCodec codec;

    /**
     * Creates the controller.
     *
     * @param jobStore job store
     * @param codec codec for the JSON columns of a job
     */
    public PassJobsController(PassJobStore jobStore, JobMetadataCodec codec) {
        this.jobStore = jobStore;
        this.codec = codec;
    }

    /**
     * Requests a pass for an attendee. Returns the existing job when one is already queued or running.
     *
     * @param attendeeId attendee
     * @param request request
     * @return 201 with a new job, 200 with an existing one
     */
    @PostMapping(value = "/attendees/{attendeeId}/pass-jobs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PassJobResponse> issue(@PathVariable String attendeeId, @Valid @RequestBody IssuePassRequest request) {
        List<WalletPlatform> platforms = parsePlatforms(request.platforms());
        EnqueueResult result = jobStore.enqueue(attendeeId, request.tenantId(), platforms, request.source());

        PassJobResponse body = toResponse(result.job());
        if (result.created()) {
            return ResponseEntity.created(URI.create("/api/pass-jobs/" + body.jobId())).body(body);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Fetches a job with its progress message.
     *
     * @param jobId job id
     * @return job
     */
    @GetMapping(value = "/pass-jobs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PassJobResponse> get(@PathVariable String jobId) {
        PassGenerationJob job = jobStore.findJob(jobId).orElseThrow(() -> error(HttpStatus.NOT_FOUND, "Pass job not found"));
        return ResponseEntity.ok(toResponse(job));
    }

    /**
     * Lists jobs in a status, oldest first (e.g. {@code status=failed} for the dead-letter view).
     *
     * @param status job status
     * @param tenantId optional tenant filter
     * @return jobs
     */
    @GetMapping(value = "/pass-jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PassJobResponse> list(@RequestParam String status, @RequestParam(required = false) String tenantId) {
        PassJobStatus parsed;
        try {
            parsed = PassJobStatus.parse(status);
        } catch (IllegalArgumentException ex) {
            throw error(HttpStatus.BAD_REQUEST, "Unknown job status '" + status + "'");
        }
        return jobStore.listJobs(parsed, tenantId).stream().map(this::toResponse).toList();
    }

    private PassJobResponse toResponse(PassGenerationJob job) {
        return PassJobResponse.from(job, codec.readPlatformMap(job.getWalletPassUrl()), codec.readPlatformMap(job.getWalletPassErrors()));
    }

    private List<WalletPlatform> parsePlatforms(List<String> raw) {
        List<WalletPlatform> platforms = new ArrayList<>();
        if (raw == null) {
            return platforms;
        }
        for (String key : raw) {
            WalletPlatform platform = WalletPlatform.fromKey(key)
                    .orElseThrow(() -> error(HttpStatus.BAD_REQUEST, "Unknown wallet platform '" + key + "'. Allowed: apple, google"));
            if (!platforms.contains(platform)) {
                platforms.add(platform);
            }
        }
        return platforms;
    }

    private static ErrorResponseException error(HttpStatus status, String detail) {
        return new ErrorResponseException(status, ProblemDetail.forStatusAndDetail(status, detail), null);
    }
}
