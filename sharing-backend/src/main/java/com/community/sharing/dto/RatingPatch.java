package com.community.sharing.dto;

import lombok.Data;

// score 为 null 表示未提供；comment 允许显式置空
@Data
public class RatingPatch {
    private Integer score;

    private String comment;
    private boolean commentProvided;

    public void setComment(String comment) {
        this.comment = comment;
        this.commentProvided = true;
    }

    public boolean isEmpty() {
        return score == null && !commentProvided;
    }
}
