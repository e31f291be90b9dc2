package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.util.Texts;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 사이클 하나의 집계. 오케스트레이터 스레드에서만 갱신됩니다.
 */
@Getter
public class CycleStats {

    private static final int MAX_SUMMARY_LENGTH = 2000;

    private int sourcesOk;
    private int sourcesFailed;
    private int itemsConsidered;
    private int itemsPosted;
    private int batchesPublished;
    private int batchesFailed;
    private boolean aborted;
    private final List<String> errors = new ArrayList<>();

    void sourceSucceeded() {
        sourcesOk++;
    }

    void sourceFailed(String sourceId, String reason) {
        sourcesFailed++;
        errors.add("source " + sourceId + ": " + reason);
    }

    void itemsConsidered(int count) {
        itemsConsidered = count;
    }

    void batchPublished(int itemCount) {
        batchesPublished++;
        itemsPosted += itemCount;
    }

    void batchFailed(String batchId, String reason) {
        batchesFailed++;
        errors.add("batch " + batchId + ": " + reason);
    }

    void aborted(String reason) {
        aborted = true;
        errors.add(reason);
    }

    public CycleOutcome outcome() {
        int failures = sourcesFailed + batchesFailed;
        int successes = sourcesOk + batchesPublished;
        if (aborted) {
            return CycleOutcome.FAILED;
        }
        if (failures == 0) {
            return CycleOutcome.OK;
        }
        return successes > 0 ? CycleOutcome.PARTIAL : CycleOutcome.FAILED;
    }

    public String errorSummary() {
        if (errors.isEmpty()) {
            return null;
        }
        String summary = String.join("; ", errors);
        return Texts.truncate(summary, MAX_SUMMARY_LENGTH);
    }
}
