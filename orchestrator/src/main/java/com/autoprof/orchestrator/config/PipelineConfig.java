package com.autoprof.orchestrator.config;

import com.autoprof.orchestrator.image.ImageReader;
import com.autoprof.orchestrator.image.RasterImageReader;
import com.autoprof.orchestrator.step.BuiltinSequences;
import com.autoprof.orchestrator.step.SequenceGraph;
import com.autoprof.orchestrator.step.StepBinding;
import com.autoprof.orchestrator.step.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.List;

/**
 * Wires the long-lived pipeline pieces.
 *
 * Analysis steps are contributed as {@link StepBinding} beans; the default
 * "head" sequence is the standard one. Both can be replaced at runtime
 * between runs.
 */
@Configuration
@EnableScheduling
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public StepRegistry stepRegistry(ObjectProvider<StepBinding> bindings) {
        return new StepRegistry(bindings.orderedStream().toList());
    }

    @Bean
    public SequenceGraph defaultSequences() {
        return new SequenceGraph(BuiltinSequences.STANDARD);
    }

    @Bean
    @ConditionalOnMissingBean(ImageReader.class)
    public ImageReader imageReader() {
        return new RasterImageReader();
    }

    /**
     * Warn at startup about step names the built-in sequences refer to but no
     * step is registered under. Those images would fail on that step.
     */
    @Bean
    ApplicationRunner reportUnboundSteps(StepRegistry registry) {
        return args -> {
            List<String> missing = registry.missing(BuiltinSequences.referencedStepNames());
            if (missing.isEmpty()) {
                log.info("All built-in pipeline steps are registered ({} steps)", registry.stepNames().size());
            } else {
                log.warn("No step registered for {}; runs reaching these steps will fail", missing);
            }
        };
    }
}
