package com.community.sharing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * MediaEntry Entity: 媒体内容表
 * 内容本身只以外部 URL 引用，不在本系统存储。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "media_entries", indexes = {
        @Index(name = "idx_media_category", columnList = "category"),
        @Index(name = "idx_media_account", columnList = "account_id"),
        @Index(name = "idx_media_created_at", columnList = "created_at")
})
public class MediaEntry {

    public static final String FK_ACCOUNT = "fk_media_account";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "media_id", nullable = false, updatable = false)
    private UUID mediaId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", length = Length.LONG)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private MediaCategory category;

    @Column(name = "thumbnail_url", length = 512)
    private String thumbnailUrl;

    @Column(name = "content_url", nullable = false, length = 512)
    private String contentUrl;

    /**
     * account_id: 创建者账号 ID
     */
    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    // 只读关联，仅用于生成外键约束
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = FK_ACCOUNT))
    private Account account;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
