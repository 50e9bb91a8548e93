package com.celia.orchestrator.api;

import com.celia.orchestrator.api.dto.JobDetailResponse;
import com.celia.orchestrator.api.dto.JobResponse;
import com.celia.orchestrator.api.dto.StatsResponse;
import com.celia.orchestrator.api.dto.SubmitJobRequest;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.service.ArtifactStore;
import com.celia.orchestrator.service.JobService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST API for job lifecycle.
 *
 * POST   /jobs                           submit a new job
 * GET    /jobs                           list jobs, newest first
 * GET    /jobs/stats                     job counts, model usage and coordinator load
 * GET    /jobs/{id}                      full job including logs and files
 * GET    /jobs/{id}/status               status only, for cheap polling
 * DELETE /jobs/{id}                      delete a job and its artifacts
 * GET    /jobs/{id}/download/{filename}  fetch a produced file
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService    jobService;
    private final ArtifactStore artifacts;

    public JobController(JobService jobService, ArtifactStore artifacts) {
        this.jobService = jobService;
        this.artifacts  = artifacts;
    }

    /**
     * Submit a new job. Execution starts in the background.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"task":"deploy service","repoUrl":"https://github.com/apache/commons-lang.git"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        if (req == null) {
            throw new ValidationException("Request body is required");
        }
        JobSnapshot job = jobService.submit(req.task(), req.repoUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public List<JobDetailResponse> list(@RequestParam(required = false) Integer limit) {
        return jobService.list(limit).stream()
                .map(JobDetailResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return StatsResponse.from(jobService.stats());
    }

    /**
     * Current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobDetailResponse getJob(@PathVariable String id) {
        return JobDetailResponse.from(find(id));
    }

    @GetMapping("/{id}/status")
    public Map<String, Object> getStatus(@PathVariable String id) {
        return Map.of("status", find(id).status());
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable String id) {
        if (!jobService.delete(id)) {
            throw notFound(id);
        }
        return Map.of("message", "Job deleted");
    }

    /**
     * Download a file the job produced (e.g. the final report).
     * Returns 404 if the job or file does not exist, 400 for names outside the job's output.
     */
    @GetMapping("/{id}/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String id, @PathVariable String filename) {
        find(id);
        Path file = artifacts.resolve(id, filename).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + filename));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
                .contentType(filename.endsWith(".md") ? MediaType.TEXT_MARKDOWN : MediaType.APPLICATION_OCTET_STREAM)
                .body(new FileSystemResource(file));
    }

    private JobSnapshot find(String id) {
        return jobService.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }
}
