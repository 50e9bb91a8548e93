package com.celia.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One user-submitted task.
 *
 * Mutated only through the JobStore: status moves forward via a guarded
 * UPDATE, the log grows by SQL concatenation, and files are appended under
 * a row lock. Nothing here ever rewrites or truncates the log.
 *
 * DB tables: jobs, job_files  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false)
    private String id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String task;

    @Column(name = "repo_url")
    private String repoUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String logs = "";

    // Insertion order is the position column; uniqueness is enforced by JpaJobStore.addFile.
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "job_files", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "filename", nullable = false)
    private List<String> files = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String id, String task, String repoUrl, Instant createdAt) {
        this.id        = id;
        this.task      = task;
        this.repoUrl   = repoUrl;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()        { return id; }
    public String       getTask()      { return task; }
    public String       getRepoUrl()   { return repoUrl; }
    public JobStatus    getStatus()    { return status; }
    public String       getLogs()      { return logs; }
    public List<String> getFiles()     { return files; }
    public String       getError()     { return error; }
    public Instant      getCreatedAt() { return createdAt; }
    public Instant      getUpdatedAt() { return updatedAt; }

    public void setLogs(String logs)          { this.logs = logs; }
    public void setUpdatedAt(Instant t)       { this.updatedAt = t; }
}
