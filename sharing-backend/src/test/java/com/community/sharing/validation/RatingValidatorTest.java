package com.community.sharing.validation;

import com.community.sharing.dto.RatingPatch;
import com.community.sharing.dto.RatingRequest;
import com.community.sharing.exception.EmptyUpdateException;
import com.community.sharing.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class RatingValidatorTest {

    private static final String SCORE_RANGE = "Must be greater than or equal to 1 and less than or equal to 5.";

    private final RatingValidator validator = new RatingValidator();

    private Map<String, Object> createBody(Object score) {
        Map<String, Object> body = new HashMap<>();
        body.put("media_id", UUID.randomUUID().toString());
        body.put("score", score);
        return body;
    }

    @Test
    void testValidateCreate_Success() {
        UUID mediaId = UUID.randomUUID();
        Map<String, Object> body = new HashMap<>();
        body.put("media_id", mediaId.toString());
        body.put("score", 5);
        body.put("comment", "Great");

        RatingRequest request = validator.validateCreate(body);

        assertEquals(mediaId, request.getMediaId());
        assertEquals(5, request.getScore());
        assertEquals("Great", request.getComment());
    }

    @Test
    void testValidateCreate_ScoreOutOfRange() {
        ValidationFailedException low = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(createBody(0)));
        assertEquals(SCORE_RANGE, low.getMessages().get("score"));

        ValidationFailedException high = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(createBody(6)));
        assertEquals(SCORE_RANGE, high.getMessages().get("score"));
    }

    @Test
    void testValidateCreate_ScoreBoundaries() {
        assertEquals(1, validator.validateCreate(createBody(1)).getScore());
        assertEquals(5, validator.validateCreate(createBody(5)).getScore());
    }

    @Test
    void testValidateCreate_ScoreNotInteger() {
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(createBody(4.5)));
        assertEquals("Not a valid integer.", ex.getMessages().get("score"));
    }

    @Test
    void testValidateCreate_InvalidMediaId() {
        Map<String, Object> body = createBody(3);
        body.put("media_id", "not-a-uuid");

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(body));
        assertEquals("Not a valid UUID.", ex.getMessages().get("media_id"));
    }

    @Test
    void testValidateUpdate_EmptyBody() {
        assertThrows(EmptyUpdateException.class, () -> validator.validateUpdate(new HashMap<>()));
    }

    @Test
    void testValidateUpdate_MediaIdNotAllowed() {
        Map<String, Object> body = new HashMap<>();
        body.put("media_id", UUID.randomUUID().toString());

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateUpdate(body));
        assertEquals("Unknown field.", ex.getMessages().get("media_id"));
    }

    @Test
    void testValidateUpdate_ClearComment() {
        Map<String, Object> body = new HashMap<>();
        body.put("comment", null);

        RatingPatch patch = validator.validateUpdate(body);

        assertTrue(patch.isCommentProvided());
        assertNull(patch.getScore());
    }
}
