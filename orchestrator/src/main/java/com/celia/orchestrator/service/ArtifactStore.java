package com.celia.orchestrator.service;

import com.celia.orchestrator.agent.SummaryResult;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Per-job output directories on the local filesystem.
 *
 * Layout: {@code <workspace-dir>/<jobId>/output/<filename>}.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String REPORT_FILENAME = "CELIA_FINAL_REPORT.md";

    private final Path  root;
    private final Clock clock;

    @Autowired
    public ArtifactStore(JobProperties properties, Clock clock) {
        this(Path.of(properties.getWorkspaceDir()), clock);
    }

    public ArtifactStore(Path root, Clock clock) {
        this.root  = root.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /** Create the job's output directory; existing directories are left alone. */
    public Path prepare(String jobId) {
        Path dir = outputDir(jobId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArtifactException("Could not create output directory for job " + jobId, e);
        }
        log.debug("Output directory ready at {}", dir);
        return dir;
    }

    /**
     * Write the final report for {@code job}.
     *
     * @param logTail last part of the job log, embedded verbatim
     * @return the file name of the report, relative to the output directory
     */
    public String writeReport(JobSnapshot job, SummaryResult summary, String logTail) {
        Path file = prepare(job.id()).resolve(REPORT_FILENAME);
        try {
            Files.writeString(file, renderReport(job, summary, logTail), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactException("Could not write report for job " + job.id(), e);
        }
        log.info("Report written to {}", file);
        return REPORT_FILENAME;
    }

    /**
     * Locate a produced file for download.
     *
     * @return empty if the file does not exist
     * @throws ValidationException if the name escapes the job's output directory
     */
    public Optional<Path> resolve(String jobId, String filename) {
        Path dir  = outputDir(jobId);
        Path file = dir.resolve(filename).normalize();
        if (!file.startsWith(dir) || file.equals(dir)) {
            throw new ValidationException("Invalid file name: " + filename);
        }
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    /** Remove everything stored for the job. A missing directory is not an error. */
    public void delete(String jobId) {
        Path jobDir = jobDir(jobId);
        if (!Files.exists(jobDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(jobDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            throw new ArtifactException("Could not delete artifacts of job " + jobId, e);
        }
        log.info("Deleted artifacts of job {}", jobId);
    }

    public Path outputDir(String jobId) {
        return jobDir(jobId).resolve("output");
    }

    private Path jobDir(String jobId) {
        Path dir = root.resolve(jobId).normalize();
        if (jobId.isBlank() || !dir.getParent().equals(root)) {
            throw new ValidationException("Invalid job id: " + jobId);
        }
        return dir;
    }

    String renderReport(JobSnapshot job, SummaryResult summary, String logTail) {
        StringBuilder sb = new StringBuilder();
        sb.append("# CELIA AI AGENT EXECUTION REPORT\n\n");
        sb.append("**Job ID**: `").append(job.id()).append("`\n\n");
        sb.append("**Generated**: ").append(DateTimeFormatter.ISO_INSTANT.format(clock.instant())).append("\n\n");
        sb.append("**Status at report time**: ").append(job.status().value()).append("\n\n");
        sb.append("**Task**: ").append(job.task()).append("\n\n");
        sb.append("**Repository**: ").append(job.hasRepository() ? job.repoUrl() : "none").append("\n\n");

        sb.append("## Summary\n\n");
        switch (summary.source()) {
            case GENERATED -> sb.append(summary.text()).append("\n\n");
            case EMPTY     -> sb.append("_No summary was produced._\n\n");
            case FALLBACK  -> sb.append(summary.text()).append("\n");
        }

        sb.append("## Files\n\n");
        Set<String> files = new LinkedHashSet<>(job.files());
        files.add(REPORT_FILENAME);
        files.forEach(f -> sb.append("- ").append(f).append("\n"));
        sb.append("\n");

        sb.append("## Log Tail\n\n```\n").append(logTail.stripTrailing()).append("\n```\n");
        return sb.toString();
    }
}
