package com.workforce.employees.config;

import com.workforce.observability.CorrelationContextHolder;
import com.workforce.validation.ValidationPipeline;
import com.workforce.validation.Validator;
import com.workforce.validation.ValidatorRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the validator registry from every {@link Validator} bean, and the pipeline that the
 * request validation aspect runs.
 *
 * <p>Storage-backed rules run on {@code validationExecutor}. Its tasks carry the caller's
 * correlation context so their log lines stay attributable to the request.
 */
@Configuration
@EnableConfigurationProperties(ValidationProperties.class)
public class ValidationConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidationConfig.class);

    @Bean
    public ThreadPoolTaskExecutor validationExecutor(ValidationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.executorThreads());
        executor.setMaxPoolSize(properties.executorThreads());
        executor.setThreadNamePrefix("validation-");
        executor.setTaskDecorator(CorrelationContextHolder::wrap);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public ValidatorRegistry validatorRegistry(List<Validator<?>> validators) {
        ValidatorRegistry registry = new ValidatorRegistry(validators);
        log.info("Registered validators for {} payload type(s)", registry.size());
        registry.registeredTypes().forEach(type -> log.debug("Validator registered for {}", type.getSimpleName()));
        return registry;
    }

    @Bean
    public ValidationPipeline validationPipeline(ValidatorRegistry registry, ValidationProperties properties) {
        return new ValidationPipeline(registry, properties.timeout());
    }
}
