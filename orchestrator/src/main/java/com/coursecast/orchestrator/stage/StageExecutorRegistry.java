package com.coursecast.orchestrator.stage;

import com.coursecast.orchestrator.artifact.ArtifactStoreException;
import com.coursecast.orchestrator.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps each {@link PipelineStage} to its executor and times every call.
 *
 * <pre>
 *   coursecast.stage.duration{stage, outcome="success|transient|validation|external_service|internal"}
 * </pre>
 */
@Component
public class StageExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageExecutorRegistry.class);

    private final Map<PipelineStage, StageExecutor> executors = new EnumMap<>(PipelineStage.class);
    private final MeterRegistry meterRegistry;

    public StageExecutorRegistry(List<StageExecutor> allExecutors, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StageExecutor executor : allExecutors) {
            StageExecutor previous = executors.put(executor.stage(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors for stage " + executor.stage().value()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + executor.getClass().getSimpleName());
            }
            log.info("Registered executor {} for stage '{}'",
                    executor.getClass().getSimpleName(), executor.stage().value());
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!executors.containsKey(stage)) {
                throw new IllegalStateException("No executor registered for stage " + stage.value());
            }
        }
    }

    /**
     * Run the executor for {@code stage}.
     *
     * Storage failures are reported as transient; any other unexpected
     * exception is passed through untouched for the caller to classify.
     */
    public StageResult execute(PipelineStage stage, StageContext ctx) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return executors.get(stage).execute(ctx);
        } catch (StageException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (ArtifactStoreException e) {
            outcome = "transient";
            throw new StageException(StageException.Kind.TRANSIENT,
                    "Artifact storage error in " + stage.value() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            outcome = "internal";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("coursecast.stage.duration",
                    "stage", stage.value(), "outcome", outcome));
        }
    }
}
