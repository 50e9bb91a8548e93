package com.celia.orchestrator.agent;

import com.celia.orchestrator.llm.GenerationRequest;
import com.celia.orchestrator.llm.ResilientCallClient;
import com.celia.orchestrator.resilience.CallFailedException;
import com.celia.orchestrator.resilience.ErrorClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResultSummarizerTest {

    @Mock ResilientCallClient client;

    ResultSummarizer summarizer;

    @BeforeEach
    void setUp() {
        summarizer = new ResultSummarizer(client, 20);
    }

    @Test
    void summarize_sendsOnlyTheLogTail() throws Exception {
        when(client.generate(any())).thenReturn("All good.");
        String logs = "x".repeat(100) + "LAST-TWENTY-CHARS!!!";

        SummaryResult result = summarizer.summarize(logs, List.of("CELIA_FINAL_REPORT.md"));

        assertThat(result.source()).isEqualTo(ResultSource.GENERATED);
        assertThat(result.text()).isEqualTo("All good.");
        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(client).generate(captor.capture());
        assertThat(captor.getValue().message())
                .contains("LAST-TWENTY-CHARS!!!")
                .doesNotContain("xxxxxxxxxxxxxxxxxxxxxxxxxx")
                .contains("CELIA_FINAL_REPORT.md");
        assertThat(captor.getValue().jsonMode()).isFalse();
    }

    @Test
    void summarize_blankAnswer_isReportedAsEmpty() throws Exception {
        when(client.generate(any())).thenReturn("   ");

        SummaryResult result = summarizer.summarize("log", List.of());

        assertThat(result.source()).isEqualTo(ResultSource.EMPTY);
        assertThat(result.text()).isEmpty();
    }

    @Test
    void summarize_callFails_buildsOfflineSummaryFromLogs() throws Exception {
        when(client.generate(any())).thenThrow(new CallFailedException(
                "text generation", 1, ErrorClassifier.Category.AUTHENTICATION, new IOException("invalid api key")));

        SummaryResult result = summarizer.summarize("[10:00:00] [STEP 1] Build\n", List.of("out.txt"));

        assertThat(result.source()).isEqualTo(ResultSource.FALLBACK);
        assertThat(result.failureReason()).contains("invalid api key");
        assertThat(result.text())
                .startsWith("## Execution Summary (offline)")
                .contains("**Files produced:** out.txt")
                .contains("[STEP 1] Build");
    }

    @Test
    void offlineSummary_withoutFiles_saysNone() {
        assertThat(ResultSummarizer.offlineSummary("tail", List.of())).contains("**Files produced:** none");
    }
}
