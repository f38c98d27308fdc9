package com.community.sharing.validation;

import com.community.sharing.dto.MediaListQuery;
import com.community.sharing.dto.RatingListQuery;
import com.community.sharing.entity.MediaCategory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

import static com.community.sharing.validation.RequestFields.*;

/**
 * 列表查询参数校验：分页、过滤与排序。
 * per_page 超过上限时截断为 100；未知排序字段静默回退到 created_at。
 */
@Component
public class ListingQueryValidator {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 10;
    public static final int MAX_PER_PAGE = 100;

    // 对外排序字段 → 实体属性
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "created_at", "createdAt",
            "updated_at", "updatedAt",
            "title", "title",
            "category", "category");

    private static final String DEFAULT_SORT_PROPERTY = "createdAt";

    public MediaListQuery validateMediaQuery(Map<String, String> params) {
        FieldErrors errors = new FieldErrors();
        MediaListQuery query = new MediaListQuery();
        query.setPage(page(params, errors));
        query.setPerPage(perPage(params, errors));

        String category = params.get("category");
        if (category != null && !category.isEmpty()) {
            MediaCategory.fromValue(category).ifPresentOrElse(query::setCategory,
                    () -> errors.reject("category", "Must be one of: "
                            + String.join(", ", MediaCategory.allValues()) + "."));
        }
        query.setCreatorId(uuid(params, "creator_id", errors));

        String search = params.get("search");
        if (search != null && !search.isEmpty()) {
            query.setSearch(search);
        }

        String sortBy = params.get("sort_by");
        query.setSortProperty(sortBy == null
                ? DEFAULT_SORT_PROPERTY
                : SORT_FIELDS.getOrDefault(sortBy, DEFAULT_SORT_PROPERTY));
        query.setDirection("asc".equalsIgnoreCase(params.get("order"))
                ? Sort.Direction.ASC
                : Sort.Direction.DESC);

        errors.throwIfAny();
        return query;
    }

    public RatingListQuery validateRatingQuery(Map<String, String> params) {
        FieldErrors errors = new FieldErrors();
        RatingListQuery query = new RatingListQuery();
        query.setPage(page(params, errors));
        query.setPerPage(perPage(params, errors));
        query.setMediaId(uuid(params, "media_id", errors));
        query.setUserId(uuid(params, "user_id", errors));
        errors.throwIfAny();
        return query;
    }

    /**
     * 请求页的起始偏移是否超出 int 范围。超出时不可能有数据，调用方直接返回空页。
     */
    public static boolean exceedsMaxOffset(int page, int perPage) {
        return (long) (page - 1) * perPage > Integer.MAX_VALUE;
    }

    private int page(Map<String, String> params, FieldErrors errors) {
        Integer page = positiveInteger(params, "page", errors);
        return page == null ? DEFAULT_PAGE : page;
    }

    private int perPage(Map<String, String> params, FieldErrors errors) {
        Integer perPage = positiveInteger(params, "per_page", errors);
        return perPage == null ? DEFAULT_PER_PAGE : Math.min(perPage, MAX_PER_PAGE);
    }

    private Integer positiveInteger(Map<String, String> params, String name, FieldErrors errors) {
        String raw = params.get(name);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Integer value = toInteger(raw);
        if (value == null) {
            errors.reject(name, NOT_INTEGER);
            return null;
        }
        if (value < 1) {
            errors.reject(name, "Must be greater than or equal to 1.");
            return null;
        }
        return value;
    }

    private UUID uuid(Map<String, String> params, String name, FieldErrors errors) {
        String raw = params.get(name);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        UUID value = toUuid(raw);
        if (value == null) {
            errors.reject(name, NOT_UUID);
        }
        return value;
    }
}
