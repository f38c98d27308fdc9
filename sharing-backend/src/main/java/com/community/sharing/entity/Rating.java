package com.community.sharing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Rating Entity: 评分表
 * 同一账号对同一内容最多一条评分，由唯一约束 uk_rating_media_account 保证。
 * media_id / account_id 由外键约束到父表；写入只通过 ID 字段，关联对象只读。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "ratings",
        uniqueConstraints = @UniqueConstraint(name = "uk_rating_media_account", columnNames = {"media_id", "account_id"}),
        indexes = {
                @Index(name = "idx_rating_media", columnList = "media_id"),
                @Index(name = "idx_rating_account", columnList = "account_id")
        })
@Check(constraints = "score >= 1 AND score <= 5")
public class Rating {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    public static final String FK_MEDIA = "fk_rating_media";
    public static final String FK_ACCOUNT = "fk_rating_account";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "rating_id", nullable = false, updatable = false)
    private UUID ratingId;

    @Column(name = "media_id", nullable = false, updatable = false)
    private UUID mediaId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "media_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = FK_MEDIA))
    private MediaEntry media;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = FK_ACCOUNT))
    private Account account;

    @Column(name = "score", nullable = false)
    private Integer score;

    @Column(name = "comment", length = Length.LONG)
    private String comment;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
