package com.genads.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class VideoJobControllerTest {

    private static final List<String> INPUT_FIELDS = List.of(
            "owner_email", "project_name", "brand_name", "brand_detail",
            "creative_prompt", "target_audience", "video_style", "aspect_ratio", "duration_seconds",
            "product_image_url", "brand_logo_url", "brand_guideline_url", "reference_image_url");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private ObjectNode payload() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("owner_email", "owner-" + UUID.randomUUID() + "@example.com");
        node.put("project_name", "Spring launch");
        node.put("brand_name", "Acme");
        node.put("brand_detail", "Outdoor gear since 1990");
        node.put("creative_prompt", "A tent glowing at dusk on a ridge");
        node.put("target_audience", "Hikers 25-40");
        node.put("video_style", "cinematic");
        node.put("aspect_ratio", "9:16");
        node.put("duration_seconds", 30);
        node.put("product_image_url", "https://cdn.example.com/product.png");
        node.put("brand_logo_url", "https://cdn.example.com/logo.svg");
        node.put("brand_guideline_url", "https://cdn.example.com/guide.pdf");
        node.put("reference_image_url", "https://cdn.example.com/ref.jpg");
        return node;
    }

    private ResultActions create(JsonNode body) throws Exception {
        return mockMvc.perform(post("/video/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private String createAndGetId(JsonNode body) throws Exception {
        String response = create(body)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("data").path("id").asText();
    }

    private JsonNode fetch(String id) throws Exception {
        String response = mockMvc.perform(get("/video/" + id))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("data");
    }

    @Test
    void testCreateThenFetchReturnsInputPlusProcessing() throws Exception {
        ObjectNode body = payload();

        create(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("processing"));
        String id = createAndGetId(body);

        JsonNode job = fetch(id);
        for (String field : INPUT_FIELDS) {
            assertEquals(body.get(field), job.get(field), field);
        }
        assertEquals(id, job.get("id").asText());
        assertEquals("processing", job.get("status").asText());
        assertTrue(job.get("project_id").isNull());
        assertTrue(job.get("video_url").isNull());
        assertFalse(job.get("created_at").isNull());
    }

    @Test
    void testCreateAppliesDefaults() throws Exception {
        ObjectNode body = payload();
        body.remove(List.of("aspect_ratio", "duration_seconds", "brand_detail",
                "product_image_url", "brand_logo_url", "brand_guideline_url", "reference_image_url"));

        JsonNode job = fetch(createAndGetId(body));

        assertEquals("16:9", job.get("aspect_ratio").asText());
        assertEquals(15, job.get("duration_seconds").asInt());
        assertEquals("", job.get("brand_detail").asText());
        assertTrue(job.get("product_image_url").isNull());
    }

    @ParameterizedTest
    @ValueSource(ints = {5, 120})
    void testDurationBoundsAreInclusive(int seconds) throws Exception {
        ObjectNode body = payload();
        body.put("duration_seconds", seconds);
        create(body).andExpect(status().isOk());
    }

    @ParameterizedTest
    @ValueSource(ints = {4, 121})
    void testDurationOutsideBoundsIsRejected(int seconds) throws Exception {
        ObjectNode body = payload();
        body.put("duration_seconds", seconds);
        create(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1:1", "9:16", "16:9", "4:5", "21:9"})
    void testEverySupportedAspectRatioIsAccepted(String ratio) throws Exception {
        ObjectNode body = payload();
        body.put("aspect_ratio", ratio);
        assertEquals(ratio, fetch(createAndGetId(body)).get("aspect_ratio").asText());
    }

    @ParameterizedTest
    @ValueSource(strings = {"4:3", "square", "16:10"})
    void testUnsupportedAspectRatioIsRejected(String ratio) throws Exception {
        ObjectNode body = payload();
        body.put("aspect_ratio", ratio);
        create(body).andExpect(status().isBadRequest());
    }

    @Test
    void testWrongPrimitiveTypesAreRejected() throws Exception {
        ObjectNode textDuration = payload();
        textDuration.put("duration_seconds", "thirty");
        create(textDuration).andExpect(status().isBadRequest());

        ObjectNode numericTextDuration = payload();
        numericTextDuration.put("duration_seconds", "15");
        create(numericTextDuration)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));

        ObjectNode fractionalDuration = payload();
        fractionalDuration.put("duration_seconds", 15.5);
        create(fractionalDuration).andExpect(status().isBadRequest());

        ObjectNode numericName = payload();
        numericName.put("project_name", 123);
        create(numericName).andExpect(status().isBadRequest());
    }

    @Test
    void testLongFreeTextIsStored() throws Exception {
        ObjectNode body = payload();
        body.put("project_id", "my-spring-launch-project-2024");
        body.put("project_name", "p".repeat(300));
        body.put("brand_name", "b".repeat(300));
        body.put("video_style", "s".repeat(256));
        body.put("product_image_url", "https://cdn.example.com/" + "a".repeat(3000) + ".png");

        JsonNode job = fetch(createAndGetId(body));

        assertEquals("my-spring-launch-project-2024", job.get("project_id").asText());
        assertEquals(300, job.get("project_name").asText().length());
        assertEquals(256, job.get("video_style").asText().length());
        assertEquals(body.get("product_image_url"), job.get("product_image_url"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"owner@localhost", "not-an-email"})
    void testOwnerEmailNeedsDottedDomain(String email) throws Exception {
        ObjectNode body = payload();
        body.put("owner_email", email);
        create(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @Test
    void testOverlongOwnerEmailIsRejected() throws Exception {
        ObjectNode body = payload();
        body.put("owner_email", "owner@" + String.join(".", Collections.nCopies(6, "d".repeat(60))) + ".com");
        create(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @Test
    void testMissingRequiredFieldIsRejected() throws Exception {
        ObjectNode body = payload();
        body.remove("creative_prompt");
        create(body).andExpect(status().isBadRequest());
    }

    @Test
    void testMalformedAssetUrlIsRejected() throws Exception {
        ObjectNode body = payload();
        body.put("brand_logo_url", "logo.svg");
        create(body).andExpect(status().isBadRequest());
    }

    @Test
    void testClientCannotChooseStatus() throws Exception {
        ObjectNode body = payload();
        body.put("status", "completed");
        assertEquals("processing", fetch(createAndGetId(body)).get("status").asText());
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-an-id", "65a1b2c3d4e5f60718293a4b", "65A1B2C3D4E5F60718293A4B"})
    void testFetchMalformedOrUnknownIdIsNotFound(String id) throws Exception {
        mockMvc.perform(get("/video/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("V006"));
    }

    @Test
    void testFinalizeIsIdempotent() throws Exception {
        String id = createAndGetId(payload());

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/video/" + id + "/finalize"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.id").value(id))
                    .andExpect(jsonPath("$.data.status").value("finalized"));
        }

        assertEquals("finalized", fetch(id).get("status").asText());
    }

    @Test
    void testUpperCaseIdResolvesToStoredJob() throws Exception {
        String id = createAndGetId(payload());
        String upper = id.toUpperCase();

        assertEquals(id, fetch(upper).get("id").asText());
        mockMvc.perform(post("/video/" + upper + "/finalize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(id))
                .andExpect(jsonPath("$.data.status").value("finalized"));

        assertEquals("finalized", fetch(id).get("status").asText());
    }

    @Test
    void testFinalizeMalformedIdIsInvalid() throws Exception {
        mockMvc.perform(post("/video/not-an-id/finalize"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("V007"));
    }
}
