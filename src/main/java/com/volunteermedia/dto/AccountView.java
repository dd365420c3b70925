package com.volunteermedia.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * The signed-in user as returned by {@code GET /api/me}: the user's own fields plus
 * their groups and whether they administer any of them.
 */
@Data
@AllArgsConstructor
public class AccountView {

    @JsonUnwrapped
    private User user;

    private List<Group> groups;

    @JsonProperty("is_group_admin")
    private boolean groupAdmin;
}
