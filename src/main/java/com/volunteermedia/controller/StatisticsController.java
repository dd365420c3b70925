package com.volunteermedia.controller;

import com.volunteermedia.dto.CommentTagStatistics;
import com.volunteermedia.dto.GroupStatistics;
import com.volunteermedia.dto.UserStatistics;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;

    @GetMapping("/admin/dashboard/stats")
    public ResponseEntity<Map<String, Object>> dashboardStats() {
        return ResponseEntity.ok(statisticsService.dashboardStats());
    }

    @GetMapping("/admin/statistics/groups")
    public ResponseEntity<List<GroupStatistics>> groupStatistics() {
        return ResponseEntity.ok(statisticsService.groupStatistics());
    }

    @GetMapping("/admin/statistics/users")
    public ResponseEntity<List<UserStatistics>> userStatistics() {
        return ResponseEntity.ok(statisticsService.userStatistics());
    }

    @GetMapping("/statistics/comment-tags")
    public ResponseEntity<List<CommentTagStatistics>> commentTagStatistics(@CurrentUser AuthenticatedUser user,
                                                                           @RequestParam("group_id") Long groupId) {
        return ResponseEntity.ok(statisticsService.commentTagStatistics(user, groupId));
    }
}
