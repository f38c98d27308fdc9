package com.community.sharing.validation;

import com.community.sharing.dto.RatingPatch;
import com.community.sharing.dto.RatingRequest;
import com.community.sharing.entity.Rating;
import com.community.sharing.exception.EmptyUpdateException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.community.sharing.validation.RequestFields.*;

@Component
public class RatingValidator {

    private static final Set<String> CREATE_FIELDS = Set.of("media_id", "score", "comment");
    private static final Set<String> UPDATE_FIELDS = Set.of("score", "comment");

    private static final String SCORE_RANGE = "Must be greater than or equal to " + Rating.MIN_SCORE
            + " and less than or equal to " + Rating.MAX_SCORE + ".";

    public RatingRequest validateCreate(Map<String, Object> body) {
        requireBody(body);
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, CREATE_FIELDS, errors);

        UUID mediaId = null;
        String rawMediaId = string(body, "media_id", true, false, errors);
        if (rawMediaId != null) {
            mediaId = toUuid(rawMediaId);
            if (mediaId == null) {
                errors.reject("media_id", NOT_UUID);
            }
        }
        Integer score = score(body, true, errors);
        String comment = string(body, "comment", false, true, errors);

        errors.throwIfAny();
        return new RatingRequest(mediaId, score, comment);
    }

    public RatingPatch validateUpdate(Map<String, Object> body) {
        requireBody(body);
        if (body.isEmpty()) {
            throw new EmptyUpdateException();
        }
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, UPDATE_FIELDS, errors);

        RatingPatch patch = new RatingPatch();
        patch.setScore(score(body, false, errors));
        if (body.containsKey("comment")) {
            patch.setComment(string(body, "comment", false, true, errors));
        }

        errors.throwIfAny();
        if (patch.isEmpty()) {
            throw new EmptyUpdateException();
        }
        return patch;
    }

    private Integer score(Map<String, Object> body, boolean required, FieldErrors errors) {
        Integer score = integer(body, "score", required, errors);
        if (score != null && (score < Rating.MIN_SCORE || score > Rating.MAX_SCORE)) {
            errors.reject("score", SCORE_RANGE);
            return null;
        }
        return score;
    }
}
