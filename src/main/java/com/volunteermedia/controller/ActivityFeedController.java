package com.volunteermedia.controller;

import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.ActivityFeedService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * GET /api/groups/{id}/activity-feed
 *
 * Query parameters (all optional):
 * type      - all | comments | announcements
 * animal_id - only comments on this animal
 * tags      - comma separated comment tag names
 * rating    - session rating filter, e.g. "poor"
 * from, to  - RFC 3339 timestamps
 * limit, offset
 *
 * Comments and group updates are merged newest first.
 */
@RestController
@RequiredArgsConstructor
public class ActivityFeedController {

    private final ActivityFeedService activityFeedService;

    @GetMapping("/api/groups/{id}/activity-feed")
    public ResponseEntity<Map<String, Object>> activityFeed(@CurrentUser AuthenticatedUser user,
                                                            @PathVariable Long id,
                                                            @RequestParam(required = false) String type,
                                                            @RequestParam(name = "animal_id", required = false) Long animalId,
                                                            @RequestParam(required = false) String tags,
                                                            @RequestParam(required = false) String rating,
                                                            @RequestParam(required = false) String from,
                                                            @RequestParam(required = false) String to,
                                                            @RequestParam(required = false) Integer limit,
                                                            @RequestParam(required = false) Integer offset) {
        ActivityFeedService.FeedQuery query = new ActivityFeedService.FeedQuery(
                type, animalId, tags, rating, from, to, limit, offset);
        return ResponseEntity.ok(activityFeedService.getFeed(user, id, query));
    }
}
