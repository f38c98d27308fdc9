package com.community.sharing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.Collections;
import java.util.List;

/**
 * 分页列表结果：当前页数据 + 分页元信息（页码从 1 开始）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageDTO<T> {
    private List<T> items;
    private PaginationDTO pagination;

    public static <T> PageDTO<T> of(List<T> items, Page<?> page) {
        PaginationDTO pagination = new PaginationDTO(
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalPages(),
                page.getTotalElements());
        return new PageDTO<>(items, pagination);
    }

    /**
     * 越界页：没有数据，总数取自同一过滤条件下的首页查询
     */
    public static <T> PageDTO<T> empty(int pageNumber, Page<?> firstPage) {
        PaginationDTO pagination = new PaginationDTO(
                pageNumber,
                firstPage.getSize(),
                firstPage.getTotalPages(),
                firstPage.getTotalElements());
        return new PageDTO<>(Collections.emptyList(), pagination);
    }
}
