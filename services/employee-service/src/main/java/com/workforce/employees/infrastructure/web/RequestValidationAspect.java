package com.workforce.employees.infrastructure.web;

import com.workforce.observability.MetricFactory;
import com.workforce.validation.RuleContext;
import com.workforce.validation.ValidationOutcome;
import com.workforce.validation.ValidationPipeline;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.http.HttpServletRequest;
import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Runs the validation pipeline in front of every REST handler.
 *
 * <p>Arguments bound from the request body ({@link RequestBody}) or from query parameters ({@link
 * ModelAttribute}) are validated together with the route values of the matched URI template. A
 * handler only runs when every validated argument passed; otherwise the validation 400 body is
 * returned and the handler is never invoked. Arguments without a registered validator pass.
 *
 * <p>Rule evaluations are cancelled when the request thread is interrupted while waiting on them,
 * or when they outlive the pipeline timeout. A client that disconnects is not observed until the
 * response is written, so its lookups run to completion.
 */
@Aspect
@Component
public class RequestValidationAspect {

    static final String METRIC_REJECTIONS = "workforce.validation.rejections";
    static final String METRIC_DURATION = "workforce.validation.duration";

    private static final Logger log = LoggerFactory.getLogger(RequestValidationAspect.class);

    private final ValidationPipeline pipeline;
    private final Executor validationExecutor;
    private final ProblemDetails problemDetails;
    private final MetricFactory metrics;

    public RequestValidationAspect(
            ValidationPipeline pipeline,
            @Qualifier("validationExecutor") Executor validationExecutor,
            ProblemDetails problemDetails,
            MetricFactory metrics) {
        this.pipeline = pipeline;
        this.validationExecutor = validationExecutor;
        this.problemDetails = problemDetails;
        this.metrics = metrics;
    }

    @Around("within(@org.springframework.web.bind.annotation.RestController *)")
    public Object validate(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        List<Object> payloads = boundPayloads(signature.getMethod(), joinPoint.getArgs());
        if (payloads.isEmpty()) {
            return joinPoint.proceed();
        }

        RuleContext context = RuleContext.of(routeValues(), validationExecutor);
        Timer.Sample sample = Timer.start(Clock.SYSTEM);
        return pipeline.gate(payloads, context,
                () -> {
                    stopTimer(sample, "passed");
                    return joinPoint.proceed();
                },
                outcome -> {
                    stopTimer(sample, "rejected");
                    return reject(signature, payloads, outcome);
                });
    }

    private void stopTimer(Timer.Sample sample, String result) {
        sample.stop(metrics.timer(METRIC_DURATION, "Time spent validating request payloads", "result", result));
    }

    private Object reject(MethodSignature signature, List<Object> payloads, ValidationOutcome outcome) {
        log.debug("Rejected {} with {} validation error(s)", signature.toShortString(), outcome.errorCount());
        for (Object payload : payloads) {
            metrics.counter(METRIC_REJECTIONS, "Requests rejected by validation",
                    "payload", payload.getClass().getSimpleName()).increment();
        }
        if (ResponseEntity.class.isAssignableFrom(signature.getReturnType())) {
            return ResponseEntity.badRequest().body(problemDetails.validation(outcome));
        }
        throw new RequestValidationException(outcome);
    }

    static List<Object> boundPayloads(Method method, Object[] args) {
        Annotation[][] annotations = method.getParameterAnnotations();
        List<Object> payloads = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i] != null && isBoundFromRequest(annotations[i])) {
                payloads.add(args[i]);
            }
        }
        return payloads;
    }

    private static boolean isBoundFromRequest(Annotation[] annotations) {
        for (Annotation annotation : annotations) {
            if (annotation instanceof RequestBody || annotation instanceof ModelAttribute) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> routeValues() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return Map.of();
        }
        HttpServletRequest request = servletAttributes.getRequest();
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Map.of();
    }
}
