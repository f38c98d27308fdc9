package com.community.sharing.validation;

import com.community.sharing.dto.MediaEntryPatch;
import com.community.sharing.dto.MediaEntryRequest;
import com.community.sharing.entity.MediaCategory;
import com.community.sharing.exception.EmptyUpdateException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

import static com.community.sharing.validation.RequestFields.*;

/**
 * 媒体内容创建 / 更新请求校验。
 * 更新与创建使用相同的字段规则，但所有字段可选，且至少提供一个字段。
 */
@Component
public class MediaEntryValidator {

    static final int URL_MAX_LENGTH = 512;

    private static final Set<String> FIELDS =
            Set.of("title", "description", "category", "thumbnail_url", "content_url");

    private static final String CATEGORY_MESSAGE =
            "Must be one of: " + String.join(", ", MediaCategory.allValues()) + ".";

    public MediaEntryRequest validateCreate(Map<String, Object> body) {
        requireBody(body);
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, FIELDS, errors);

        MediaEntryRequest request = new MediaEntryRequest();
        request.setTitle(title(body, true, errors));
        request.setDescription(string(body, "description", false, true, errors));
        request.setCategory(category(body, true, errors));
        request.setThumbnailUrl(url(body, "thumbnail_url", false, true, errors));
        request.setContentUrl(url(body, "content_url", true, false, errors));

        errors.throwIfAny();
        return request;
    }

    public MediaEntryPatch validateUpdate(Map<String, Object> body) {
        requireBody(body);
        if (body.isEmpty()) {
            throw new EmptyUpdateException();
        }
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, FIELDS, errors);

        MediaEntryPatch patch = new MediaEntryPatch();
        patch.setTitle(title(body, false, errors));
        patch.setCategory(category(body, false, errors));
        patch.setContentUrl(url(body, "content_url", false, false, errors));
        if (body.containsKey("description")) {
            patch.setDescription(string(body, "description", false, true, errors));
        }
        if (body.containsKey("thumbnail_url")) {
            patch.setThumbnailUrl(url(body, "thumbnail_url", false, true, errors));
        }

        errors.throwIfAny();
        if (patch.isEmpty()) {
            throw new EmptyUpdateException();
        }
        return patch;
    }

    private String title(Map<String, Object> body, boolean required, FieldErrors errors) {
        String title = string(body, "title", required, false, errors);
        checkLength("title", title, 1, 255, errors);
        return title;
    }

    private MediaCategory category(Map<String, Object> body, boolean required, FieldErrors errors) {
        String value = string(body, "category", required, false, errors);
        if (value == null) {
            return null;
        }
        return MediaCategory.fromValue(value).orElseGet(() -> {
            errors.reject("category", CATEGORY_MESSAGE);
            return null;
        });
    }

    private String url(Map<String, Object> body, String field, boolean required, boolean nullable,
                       FieldErrors errors) {
        String value = string(body, field, required, nullable, errors);
        if (value == null) {
            return null;
        }
        if (!isUrl(value)) {
            errors.reject(field, NOT_URL);
        }
        checkLength(field, value, null, URL_MAX_LENGTH, errors);
        return value;
    }
}
