package com.team.issuemetrics.model.entity;

import com.team.issuemetrics.model.entity.converter.ConsistencyDetailsConverter;
import com.team.issuemetrics.model.entity.converter.QualityDetailsConverter;
import com.team.issuemetrics.model.evaluation.ConsistencyDetails;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.evaluation.QualityDetails;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Issue 的評估結果（與 Issue 1:1）。
 * 三個評估軸各自獨立為 nullable，寫入某一軸時不可覆蓋其他軸。
 */
@Entity
@Table(name = "evaluation_record")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long issueId;

    // ===== 速度 =====
    private Integer speedScore;

    @Enumerated(EnumType.STRING)
    private Grade speedGrade;

    private LocalDateTime speedCalculatedAt;

    // ===== 品質 =====
    private Integer qualityScore;

    @Enumerated(EnumType.STRING)
    private Grade qualityGrade;

    @Convert(converter = QualityDetailsConverter.class)
    @Column(length = 100000)
    private QualityDetails qualityDetails;

    private LocalDateTime qualityCalculatedAt;

    // ===== 一致性 =====
    private Integer consistencyScore;

    @Enumerated(EnumType.STRING)
    private Grade consistencyGrade;

    @Convert(converter = ConsistencyDetailsConverter.class)
    @Column(length = 100000)
    private ConsistencyDetails consistencyDetails;

    private LocalDateTime consistencyCalculatedAt;

    /** 找不到關聯的已 merge PR 而略過的時間；Issue 之後有更新就會再列入待評估 */
    private Instant consistencySkippedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
