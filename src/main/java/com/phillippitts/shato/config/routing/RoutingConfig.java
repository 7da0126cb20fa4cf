package com.phillippitts.shato.config.routing;

import com.phillippitts.shato.config.properties.GenerationProperties;
import com.phillippitts.shato.config.properties.ValidatorProperties;
import com.phillippitts.shato.service.execution.CommandExecutionClient;
import com.phillippitts.shato.service.execution.CommandExecutionService;
import com.phillippitts.shato.service.execution.LocalCommandExecutionClient;
import com.phillippitts.shato.service.execution.RemoteCommandExecutionClient;
import com.phillippitts.shato.service.generation.GenerationClient;
import com.phillippitts.shato.service.generation.GenerationServiceClient;
import com.phillippitts.shato.service.generation.ModelRunnerGenerationClient;
import com.phillippitts.shato.service.generation.ProposalParser;
import com.phillippitts.shato.service.generation.SystemPromptProvider;
import com.phillippitts.shato.service.metrics.RoutingMetrics;
import com.phillippitts.shato.service.routing.CommandRouter;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.concurrent.Executor;

/**
 * Wires the router and selects its collaborators.
 *
 * <p>{@code shato.generation.mode} picks the generation client ({@code model-runner} by default,
 * or {@code service}); {@code shato.validator.mode} picks the validator client ({@code local} by
 * default, or {@code remote}).
 */
@Configuration
public class RoutingConfig {

    private static final Logger LOG = LogManager.getLogger(RoutingConfig.class);

    private final OkHttpClient okHttpClient;
    private final GenerationProperties generationProperties;
    private final ValidatorProperties validatorProperties;

    public RoutingConfig(OkHttpClient okHttpClient,
                         GenerationProperties generationProperties,
                         ValidatorProperties validatorProperties) {
        this.okHttpClient = okHttpClient;
        this.generationProperties = generationProperties;
        this.validatorProperties = validatorProperties;
    }

    /**
     * System prompt, loaded once at startup. Startup fails if the prompt resource is missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "shato.generation", name = "mode", havingValue = "model-runner", matchIfMissing = true)
    public SystemPromptProvider systemPromptProvider(ResourceLoader resourceLoader) {
        return new SystemPromptProvider(resourceLoader, generationProperties);
    }

    /**
     * Generation client calling the model runner directly.
     * Active when shato.generation.mode is model-runner or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "shato.generation", name = "mode", havingValue = "model-runner", matchIfMissing = true)
    public GenerationClient modelRunnerGenerationClient(SystemPromptProvider promptProvider, ProposalParser parser) {
        LOG.info("Generation via model runner at {} (model {})",
                generationProperties.getModelRunnerUrl(), generationProperties.getModelName());
        return new ModelRunnerGenerationClient(okHttpClient, generationProperties, promptProvider, parser);
    }

    /**
     * Generation client calling a remote generation service. Active when shato.generation.mode=service.
     */
    @Bean
    @ConditionalOnProperty(prefix = "shato.generation", name = "mode", havingValue = "service")
    public GenerationClient generationServiceClient(ProposalParser parser) {
        LOG.info("Generation via generation service at {}", generationProperties.getServiceUrl());
        return new GenerationServiceClient(okHttpClient, generationProperties.getServiceUrl(),
                generationProperties.getTimeoutMs(), parser);
    }

    /**
     * In-process validator client. Active when shato.validator.mode is local or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "shato.validator", name = "mode", havingValue = "local", matchIfMissing = true)
    public CommandExecutionClient localCommandExecutionClient(CommandExecutionService executionService,
                                                              @Qualifier("validatorExecutor") Executor executor) {
        LOG.info("Validation in-process (timeout {}ms)", validatorProperties.getTimeoutMs());
        return new LocalCommandExecutionClient(executionService, executor, validatorProperties.getTimeoutMs());
    }

    /**
     * Remote validator client. Active when shato.validator.mode=remote.
     */
    @Bean
    @ConditionalOnProperty(prefix = "shato.validator", name = "mode", havingValue = "remote")
    public CommandExecutionClient remoteCommandExecutionClient() {
        LOG.info("Validation via robot validator at {}", validatorProperties.getUrl());
        return new RemoteCommandExecutionClient(okHttpClient, validatorProperties.getUrl(),
                validatorProperties.getTimeoutMs());
    }

    @Bean
    public CommandRouter commandRouter(GenerationClient generationClient,
                                       CommandExecutionClient executionClient,
                                       RoutingMetrics metrics) {
        return new CommandRouter(generationClient, executionClient, metrics);
    }
}
