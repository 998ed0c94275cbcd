package com.hvacops.copilot.service.context;

import com.hvacops.copilot.model.CopilotConfig;

import java.util.List;
import java.util.Map;

/**
 * Fallback used when no retrieval backend is wired: identifies the job and supplies no evidence.
 */
public class SnapshotOnlyJobContextProvider implements JobContextProvider {

    @Override
    public JobContext load(String tenantId, String jobId, String query, CopilotConfig.RetrievalSettings retrieval) {
        return new JobContext(Map.of("job", Map.of("id", jobId)), "", List.of());
    }
}
