package com.example.casa.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@Table("analysis_records")
public class AnalysisRecord {
    @Id
    private Long id;

    @Column("analysis_id")
    private String analysisId;

    @Column("status")
    private String status;

    @Column("analysis_type")
    private String analysisType;

    @Column("filename")
    private String filename;

    @Column("snapshot")
    private String snapshot; // JSON格式，完整任务快照

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
