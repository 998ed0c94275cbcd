package com.hvacops.copilot.config;

import com.hvacops.copilot.model.CopilotConfig;
import com.hvacops.copilot.service.context.JobContextProvider;
import com.hvacops.copilot.service.context.SnapshotOnlyJobContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CopilotProperties.class)
public class CopilotConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CopilotConfiguration.class);

    @Bean
    public CopilotConfig copilotConfig(CopilotProperties properties) {
        CopilotConfig config = properties.toConfig();
        log.info("Copilot configured with model {} and prompt {}", config.model().name(), config.prompt().version());
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobContextProvider jobContextProvider() {
        log.warn("No JobContextProvider configured; answering without retrieved evidence");
        return new SnapshotOnlyJobContextProvider();
    }
}
