package com.reelforge.jobs;

import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes the payload of one {@link JobType}. Register implementations as
 * Spring beans to have the bundled poller claim and run their jobs.
 *
 * @param <T> the type the JSON payload is converted to before processing
 */
public interface JobWorker<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * The job type this worker handles. Each type may have at most one worker.
     */
    JobType getJobType();

    /**
     * Runs a claimed job. The returned object is serialized as the job's
     * result; any exception counts as a failed attempt and is retried while
     * attempts remain.
     *
     * @param job     the claimed job, already in {@code processing}
     * @param payload the converted payload
     * @return the result to store, may be {@code null}
     * @throws Exception if the attempt failed
     */
    Object process(Job job, T payload) throws Exception;

    /**
     * Optional callback invoked when {@link #process(Job, Object)} throws.
     * Exceptions thrown here are logged and do not change the failure handling.
     */
    default void onError(Job job, T payload, Exception exception) {
        // no-op
    }

    /**
     * Payload class used to convert the stored JSON. Inferred from the
     * generic parameter unless overridden.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobWorker::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobWorker.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " payload type cannot be inferred. Specify a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
