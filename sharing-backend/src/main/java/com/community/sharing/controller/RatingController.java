package com.community.sharing.controller;

import com.community.sharing.dto.CommonResponse;
import com.community.sharing.dto.PageDTO;
import com.community.sharing.dto.RatingDTO;
import com.community.sharing.dto.RatingStatsDTO;
import com.community.sharing.filter.BearerTokenFilter;
import com.community.sharing.service.RatingService;
import com.community.sharing.validation.ListingQueryValidator;
import com.community.sharing.validation.RatingValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/ratings")
public class RatingController {

    private final RatingService ratingService;
    private final RatingValidator ratingValidator;
    private final ListingQueryValidator listingQueryValidator;

    public RatingController(RatingService ratingService,
                            RatingValidator ratingValidator,
                            ListingQueryValidator listingQueryValidator) {
        this.ratingService = ratingService;
        this.ratingValidator = ratingValidator;
        this.listingQueryValidator = listingQueryValidator;
    }

    /**
     * **路径: POST /ratings**
     * 功能: 为内容评分（1-5），每个账号对同一内容只能评一次
     */
    @PostMapping
    public ResponseEntity<CommonResponse<RatingDTO>> create(
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId,
            @RequestBody(required = false) Map<String, Object> body) {
        RatingDTO created = ratingService.createRating(accountId, ratingValidator.validateCreate(body));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.created("Rating created successfully", created));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<PageDTO<RatingDTO>>> list(@RequestParam Map<String, String> params) {
        PageDTO<RatingDTO> page = ratingService.listRatings(listingQueryValidator.validateRatingQuery(params));
        return ResponseEntity.ok(CommonResponse.success(page));
    }

    @GetMapping("/{ratingId}")
    public ResponseEntity<CommonResponse<RatingDTO>> get(@PathVariable("ratingId") UUID ratingId) {
        return ResponseEntity.ok(CommonResponse.success(ratingService.getRating(ratingId)));
    }

    @PutMapping("/{ratingId}")
    public ResponseEntity<CommonResponse<RatingDTO>> update(
            @PathVariable("ratingId") UUID ratingId,
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId,
            @RequestBody(required = false) Map<String, Object> body) {
        RatingDTO updated = ratingService.updateRating(ratingId, accountId, body);
        return ResponseEntity.ok(CommonResponse.success("Rating updated successfully", updated));
    }

    @DeleteMapping("/{ratingId}")
    public ResponseEntity<CommonResponse<Void>> delete(
            @PathVariable("ratingId") UUID ratingId,
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId) {
        ratingService.deleteRating(ratingId, accountId);
        return ResponseEntity.ok(CommonResponse.success("Rating deleted successfully", null));
    }

    /**
     * **路径: GET /ratings/media/{mediaId}/stats**
     * 功能: 内容评分统计（总数、均值、1-5 分布）
     */
    @GetMapping("/media/{mediaId}/stats")
    public ResponseEntity<CommonResponse<RatingStatsDTO>> stats(@PathVariable("mediaId") UUID mediaId) {
        return ResponseEntity.ok(CommonResponse.success(ratingService.getMediaStats(mediaId)));
    }
}
