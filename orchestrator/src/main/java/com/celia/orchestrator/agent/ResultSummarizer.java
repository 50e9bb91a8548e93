package com.celia.orchestrator.agent;

import com.celia.orchestrator.llm.GenerationRequest;
import com.celia.orchestrator.llm.ResilientCallClient;
import com.celia.orchestrator.service.JobProperties;
import com.celia.orchestrator.store.LogLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Produces the free-form summary that goes into the final report.
 *
 * Only the tail of the log is sent. When the call fails, an offline summary is
 * built straight from the log tail and file list; summarization never fails a job.
 */
@Component
public class ResultSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSummarizer.class);

    private final ResilientCallClient client;
    private final int                 logTail;

    @Autowired
    public ResultSummarizer(ResilientCallClient client, JobProperties jobProperties) {
        this(client, jobProperties.getSummaryLogTail());
    }

    ResultSummarizer(ResilientCallClient client, int logTail) {
        this.client  = client;
        this.logTail = logTail;
    }

    public SummaryResult summarize(String logs, List<String> files) throws InterruptedException {
        String tail = LogLines.tail(logs, logTail);
        try {
            String text = client.generate(GenerationRequest.of(
                    Prompts.summaryPrompt(tail, files), Prompts.SUMMARY_SYSTEM, false));
            if (text == null || text.isBlank()) {
                log.warn("Summarizer returned an empty answer");
                return SummaryResult.empty();
            }
            return SummaryResult.generated(text.strip());
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Summarization failed, using offline summary: {}", e.getMessage());
            return SummaryResult.fallback(offlineSummary(tail, files), e.getMessage());
        }
    }

    /** Deterministic summary used when the model is unavailable. */
    static String offlineSummary(String logTail, List<String> files) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Execution Summary (offline)\n\n");
        sb.append("The summarization service was unavailable; this summary was built from the raw execution log.\n\n");
        sb.append("**Files produced:** ")
          .append(files.isEmpty() ? "none" : String.join(", ", files))
          .append("\n\n");
        sb.append("**Last log lines:**\n\n```\n").append(logTail.stripTrailing()).append("\n```\n");
        return sb.toString();
    }
}
