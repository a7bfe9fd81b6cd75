package com.example.casa.service;

import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 分析任务的持久化存储，按任务ID保存完整快照
 */
public interface JobStore {

    /**
     * 读取任务快照，不存在时为空
     */
    Mono<AnalysisJob> get(String analysisId);

    /**
     * 写入（覆盖）任务快照，失败时以 PersistenceException 结束
     */
    Mono<Void> put(AnalysisJob job);

    /**
     * 删除任务快照，返回是否存在过
     */
    Mono<Boolean> delete(String analysisId);

    /**
     * 已保存任务的摘要，只读取列表所需字段
     */
    Flux<AnalysisSummary> listSummaries();
}
