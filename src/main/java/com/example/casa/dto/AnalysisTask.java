package com.example.casa.dto;

import java.util.concurrent.CompletableFuture;

/**
 * 提交后返回的任务句柄，future在任务进入终态时完成
 */
public class AnalysisTask {

    private final String analysisId;
    private final CompletableFuture<AnalysisJob> completion;

    public AnalysisTask(String analysisId, CompletableFuture<AnalysisJob> completion) {
        this.analysisId = analysisId;
        this.completion = completion;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public CompletableFuture<AnalysisJob> getCompletion() {
        return completion;
    }
}
