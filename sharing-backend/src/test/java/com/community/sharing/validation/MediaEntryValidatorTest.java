package com.community.sharing.validation;

import com.community.sharing.dto.MediaEntryPatch;
import com.community.sharing.dto.MediaEntryRequest;
import com.community.sharing.entity.MediaCategory;
import com.community.sharing.exception.EmptyUpdateException;
import com.community.sharing.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MediaEntryValidatorTest {

    private final MediaEntryValidator validator = new MediaEntryValidator();

    private Map<String, Object> validBody() {
        Map<String, Object> body = new HashMap<>();
        body.put("title", "Tetris");
        body.put("category", "game");
        body.put("content_url", "https://example.com/tetris");
        return body;
    }

    @Test
    void testValidateCreate_Success() {
        Map<String, Object> body = validBody();
        body.put("description", null);
        body.put("thumbnail_url", "http://cdn.example.com/t.png");

        MediaEntryRequest request = validator.validateCreate(body);

        assertEquals("Tetris", request.getTitle());
        assertEquals(MediaCategory.GAME, request.getCategory());
        assertNull(request.getDescription());
        assertEquals("http://cdn.example.com/t.png", request.getThumbnailUrl());
    }

    @Test
    void testValidateCreate_InvalidCategory() {
        Map<String, Object> body = validBody();
        body.put("category", "podcast");

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(body));
        assertEquals("Must be one of: game, video, artwork, music.", ex.getMessages().get("category"));
    }

    @Test
    void testValidateCreate_CategoryIsCaseSensitive() {
        Map<String, Object> body = validBody();
        body.put("category", "GAME");

        assertThrows(ValidationFailedException.class, () -> validator.validateCreate(body));
    }

    @Test
    void testValidateCreate_InvalidUrls() {
        Map<String, Object> body = validBody();
        body.put("content_url", "not a url");
        body.put("thumbnail_url", "mailto:someone@example.com");

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(body));
        assertEquals("Not a valid URL.", ex.getMessages().get("content_url"));
        assertEquals("Not a valid URL.", ex.getMessages().get("thumbnail_url"));
    }

    @Test
    void testValidateCreate_TitleLength() {
        Map<String, Object> body = validBody();
        body.put("title", "");
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(body));
        assertEquals("Length must be between 1 and 255.", ex.getMessages().get("title"));

        body.put("title", "t".repeat(255));
        assertDoesNotThrow(() -> validator.validateCreate(body));
    }

    @Test
    void testValidateCreate_MissingRequired() {
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateCreate(new HashMap<>()));
        assertEquals(3, ex.getMessages().size());
        assertTrue(ex.getMessages().keySet().containsAll(java.util.List.of("title", "category", "content_url")));
    }

    @Test
    void testValidateUpdate_EmptyBody() {
        EmptyUpdateException ex = assertThrows(EmptyUpdateException.class,
                () -> validator.validateUpdate(new HashMap<>()));
        assertEquals(EmptyUpdateException.MESSAGE, ex.getMessages().get(ValidationFailedException.SCHEMA_KEY));
    }

    @Test
    void testValidateUpdate_ExplicitNullDescription() {
        Map<String, Object> body = new HashMap<>();
        body.put("description", null);

        MediaEntryPatch patch = validator.validateUpdate(body);

        assertTrue(patch.isDescriptionProvided());
        assertNull(patch.getDescription());
        assertFalse(patch.isThumbnailUrlProvided());
        assertNull(patch.getTitle());
    }

    @Test
    void testValidateUpdate_NullTitleRejected() {
        Map<String, Object> body = new HashMap<>();
        body.put("title", null);

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateUpdate(body));
        assertEquals("Field may not be null.", ex.getMessages().get("title"));
    }

    @Test
    void testValidateUpdate_UnknownFieldOnly() {
        Map<String, Object> body = new HashMap<>();
        body.put("user_id", "someone");

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> validator.validateUpdate(body));
        assertEquals("Unknown field.", ex.getMessages().get("user_id"));
    }
}
