package com.di.modelops.retrain.worker;

import com.di.modelops.error.ErrorCategory;
import com.di.modelops.audit.AuditModule;
import com.di.modelops.audit.AuditRecord;
import com.di.modelops.audit.AuditSink;
import com.di.modelops.retrain.job.RetrainJob;
import com.di.modelops.retrain.job.RetrainJobService;
import com.di.modelops.retrain.job.RetrainJobStatus;
import com.di.modelops.retrain.job.RunDetails;
import com.di.modelops.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claims one queued retrain job and runs it. Simulate mode completes the job without training; execute
 * mode runs the training routine outside any store transaction. A training failure is recorded on the job
 * and returned as a failed result, never thrown. Failed jobs are not retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainWorker {

    private final RetrainJobService jobService;
    private final TrainingRoutine trainingRoutine;
    private final TrainingSummarizer summarizer;
    private final PredictorHandle predictorHandle;
    private final AuditSink auditSink;

    public WorkerResult processNext(String cohort, boolean execute) {
        Optional<RetrainJob> claimed = jobService.claimNext(cohort);
        if (claimed.isEmpty()) {
            log.debug("[WORKER] No queued retrain job (cohort filter: {})", cohort);
            return WorkerResult.noop();
        }
        RetrainJob job = claimed.get();
        Map<String, String> mdc = new HashMap<>();
        mdc.put("jobId", String.valueOf(job.getId()));
        mdc.put("cohort", job.getCohort());
        return MdcPropagation.callWithContext(mdc, () -> process(job, execute));
    }

    private WorkerResult process(RetrainJob job, boolean execute) {
        log.info("[WORKER] Processing retrain job mode={}", execute ? RunDetails.MODE_EXECUTE : RunDetails.MODE_SIMULATE);
        RetrainJob finalized;
        RunDetails runDetails;
        try {
            runDetails = execute ? train(job.getCohort()) : RunDetails.simulated();
            finalized = jobService.finalize(job.getId(), RetrainJobStatus.COMPLETED, runDetails, null);
        } catch (Exception e) {
            return fail(job, execute, e);
        }

        auditSink.record(AuditRecord.builder()
                .module(AuditModule.RETRAIN_WORKER)
                .status(AuditRecord.SUCCESS)
                .recordsProcessed(1)
                .detail("job_id", finalized.getId())
                .detail("cohort", finalized.getCohort())
                .detail("execute", execute)
                .detail("mode", runDetails.getMode())
                .build());
        log.info("[WORKER] Retrain job completed");
        if (execute) {
            reloadPredictor();
        }
        return WorkerResult.builder()
                .status(WorkerStatus.COMPLETED)
                .message("Retrain job processed successfully.")
                .job(finalized)
                .runDetails(runDetails)
                .build();
    }

    private RunDetails train(String cohort) throws Exception {
        TrainingOutput output = trainingRoutine.train(cohort);
        if (output == null || output.isEmpty()) {
            throw new IllegalStateException("Training pipeline returned no output");
        }
        return summarizer.summarize(output);
    }

    private WorkerResult fail(RetrainJob job, boolean execute, Exception cause) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String error = errorText(cause);
        log.warn("[WORKER] Retrain job failed ({}): {}", ErrorCategory.categorize(cause), error);
        RunDetails runDetails = RunDetails.forMode(execute);
        RetrainJob failed = jobService.finalize(job.getId(), RetrainJobStatus.FAILED, runDetails, error);
        auditSink.record(AuditRecord.builder()
                .module(AuditModule.RETRAIN_WORKER)
                .status(AuditRecord.FAILED)
                .recordsProcessed(1)
                .errors(error)
                .detail("job_id", failed.getId())
                .detail("cohort", failed.getCohort())
                .detail("execute", execute)
                .build());
        return WorkerResult.builder()
                .status(WorkerStatus.FAILED)
                .message("Retrain job failed: " + error)
                .job(failed)
                .runDetails(runDetails)
                .build();
    }

    private void reloadPredictor() {
        try {
            predictorHandle.reload();
        } catch (RuntimeException e) {
            // the job already completed; the serving handle keeps its previous artifacts
            log.warn("[WORKER] Predictor reload failed ({}): {}", ErrorCategory.categorize(e), e.getMessage());
        }
    }

    static String errorText(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getName();
    }
}
