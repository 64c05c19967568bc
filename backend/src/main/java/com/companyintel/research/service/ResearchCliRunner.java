package com.companyintel.research.service;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.ResearchPipelineException;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchTarget;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ResearchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResearchCliRunner.class);

    private final ResearchProperties properties;
    private final ResearchRunService researchRunService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ResearchCliRunner(
        ResearchProperties properties,
        ResearchRunService researchRunService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.researchRunService = researchRunService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            ResearchTarget target = new ResearchTarget(properties.getCli().getCompanyName(), properties.getCli().getUrl());
            ResearchOutcome outcome = researchRunService.runNow(target, researchRunService.defaultConfig());
            log.info(
                "Research {} ({}) finished: attempted={}, succeeded={}, softError={}, degradations={}, costUsd={}",
                target.companyName(),
                outcome.resolvedUrl(),
                outcome.batch().attempted(),
                outcome.batch().succeeded(),
                outcome.artifact().softError(),
                outcome.degradations(),
                outcome.totalCostUsd()
            );
            log.info("Artifact:\n{}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(outcome.artifact()));
        } catch (ResearchPipelineException e) {
            log.error("Research failed errorKey={} message={}", e.getErrorKey(), e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid research target: {}", e.getMessage());
            exitCode = 2;
        } catch (JsonProcessingException e) {
            log.error("Could not render artifact", e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }
}
