package com.reelforge.jobs;

/**
 * Outcome of a stuck-job sweep.
 *
 * @param requeued jobs returned to {@code pending} because attempts remained
 * @param failed   jobs moved to terminal {@code failed} because the attempt cap was reached
 */
public record ReapResult(int requeued, int failed) {

    public int total() {
        return requeued + failed;
    }
}
