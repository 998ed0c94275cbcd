package com.hvacops.copilot.service.context;

import com.hvacops.copilot.model.CopilotConfig;

public interface JobContextProvider {

    JobContext load(String tenantId, String jobId, String query, CopilotConfig.RetrievalSettings retrieval);
}
