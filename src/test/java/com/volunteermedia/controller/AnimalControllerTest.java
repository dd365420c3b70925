package com.volunteermedia.controller;

import com.volunteermedia.dto.AnimalRequest;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.UnauthorizedException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.JwtService;
import com.volunteermedia.service.AnimalService;
import com.volunteermedia.service.RateLimitService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnimalController.class)
class AnimalControllerTest {

    private static final String TOKEN = "Bearer volunteer-token";
    private static final AuthenticatedUser VOLUNTEER = new AuthenticatedUser(5L, false);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnimalService animalService;
    @MockBean
    private JwtService jwtService;
    @MockBean
    private RateLimitService rateLimitService;

    @BeforeEach
    void setUp() {
        when(jwtService.parseToken("volunteer-token")).thenReturn(VOLUNTEER);
    }

    private static Animal animal(long id, String name) {
        Animal animal = new Animal();
        animal.setId(id);
        animal.setGroupId(2L);
        animal.setName(name);
        animal.setTrainerNotes("leash reactive");
        return animal;
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/groups/2/animals"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Authorization header required"));
        verifyNoInteractions(animalService);
    }

    @Test
    void malformedHeaderIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/groups/2/animals").header(HttpHeaders.AUTHORIZATION, "Token abc"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid authorization format"));
    }

    @Test
    void expiredTokenIsUnauthorized() throws Exception {
        when(jwtService.parseToken("stale")).thenThrow(new UnauthorizedException("Invalid or expired token"));

        mockMvc.perform(get("/api/groups/2/animals").header(HttpHeaders.AUTHORIZATION, "Bearer stale"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listsAnimalsInSnakeCase() throws Exception {
        when(animalService.listAnimals(VOLUNTEER, 2L, "available", null)).thenReturn(List.of(animal(10L, "Rex")));

        mockMvc.perform(get("/api/groups/2/animals").param("status", "available")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Rex"))
                .andExpect(jsonPath("$[0].group_id").value(2))
                .andExpect(jsonPath("$[0].trainer_notes").value("leash reactive"))
                .andExpect(jsonPath("$[0].status").value("available"))
                .andExpect(jsonPath("$[0].is_returned").value(false));
    }

    @Test
    void createReturns201() throws Exception {
        Animal created = animal(11L, "Milo");
        created.setStatus(AnimalStatus.FOSTER);
        when(animalService.createAnimal(eq(VOLUNTEER), eq(2L), any(AnimalRequest.class))).thenReturn(created);

        mockMvc.perform(post("/api/groups/2/animals")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Milo\",\"species\":\"Cat\",\"status\":\"foster\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(11))
                .andExpect(jsonPath("$.status").value("foster"));
    }

    @Test
    void nonNumericGroupIdIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/groups/abc/animals").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid id"));
    }

    @Test
    void serviceDenialIsForbidden() throws Exception {
        when(animalService.listAnimals(eq(VOLUNTEER), eq(3L), isNull(), isNull()))
                .thenThrow(new ForbiddenException("Access denied"));

        mockMvc.perform(get("/api/groups/3/animals").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Access denied"));
    }

    @Test
    void deleteReturnsMessage() throws Exception {
        mockMvc.perform(delete("/api/groups/2/animals/10").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Animal deleted successfully"));
    }
}
