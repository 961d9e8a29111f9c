package com.github.dimitryivaniuta.outreach.passes.web;

import com.github.dimitryivaniuta.outreach.passes.service.PassGenerationWorker;
import com.github.dimitryivaniuta.outreach.passes.service.dto.WorkerRunSummary;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Invocation endpoint for the external scheduler. Each call runs one worker invocation synchronously.
 */
@RestController
@RequestMapping("/internal/pass-worker")
public class PassWorkerController {

    private final PassGenerationWorker worker;

    public PassWorkerController(PassGenerationWorker worker) {
        this.worker = worker;
    }

    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public WorkerRunSummary run() {
        return worker.runOnce();
    }
}
