package com.community.sharing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

// 内容创建者 / 评分者的简要信息
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountSummaryDTO {
    private UUID userId;
    private String username;
}
