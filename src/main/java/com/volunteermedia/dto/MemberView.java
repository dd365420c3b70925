package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MemberView {
    Long userId;
    String username;
    String firstName;
    String lastName;
    String email;
    String phoneNumber;
    @JsonProperty("is_group_admin")
    boolean groupAdmin;
    @JsonProperty("is_site_admin")
    boolean siteAdmin;
    Instant joinedAt;
}
