package com.nhoyhub.order.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.web.servlet.MultipartProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "nhoyhub.storage.upload-dir=target/test-images")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class OrderApiIntegrationTest {

    private static final String BEARER = "Bearer fake-jwt-token-for-admin";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MultipartProperties multipartProperties;

    @Test
    @DisplayName("Should not cap upload size")
    void shouldNotCapUploadSize() {
        assertThat(multipartProperties.getMaxFileSize().toBytes()).isNegative();
        assertThat(multipartProperties.getMaxRequestSize().toBytes()).isNegative();
    }

    @Test
    @DisplayName("Should page through the seeded orders")
    void shouldListThirdPageOfSeededOrders() throws Exception {
        mockMvc.perform(get("/orders").param("page", "3").param("page_size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(5)))
                .andExpect(jsonPath("$.total").value(25))
                .andExpect(jsonPath("$.page").value(3))
                .andExpect(jsonPath("$.page_size").value(10))
                .andExpect(jsonPath("$.items[0].id").value(21))
                .andExpect(jsonPath("$.items[4].id").value(25))
                .andExpect(jsonPath("$.items[0].price").value("121"))
                .andExpect(jsonPath("$.items[0].image_url").value("/images/default.jpg"));
    }

    @Test
    @DisplayName("Should apply default paging, status filter and search")
    void shouldFilterAndSearch() throws Exception {
        mockMvc.perform(get("/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(12)))
                .andExpect(jsonPath("$.page_size").value(12));

        mockMvc.perform(get("/orders").param("status", "Approved").param("page_size", "50"))
                .andExpect(jsonPath("$.total").value(8))
                .andExpect(jsonPath("$.items[0].status").value("approved"))
                .andExpect(jsonPath("$.items[0].download_link").value("http://example.com/download/3"));

        mockMvc.perform(get("/orders").param("status", "bogus"))
                .andExpect(jsonPath("$.total").value(25));

        mockMvc.perform(get("/orders").param("q", "DUMMY-7-"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].id").value(7));
    }

    @Test
    @DisplayName("Should issue the admin token only for the admin credentials")
    void shouldLogin() throws Exception {
        mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "admin")
                        .param("password", "password123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value("fake-jwt-token-for-admin"))
                .andExpect(jsonPath("$.token_type").value("bearer"));

        mockMvc.perform(post("/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "admin")
                        .param("password", "nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.detail").value("Incorrect username or password"));
    }

    @Test
    @DisplayName("Should reject admin endpoints without a valid token")
    void shouldGuardAdminEndpoints() throws Exception {
        mockMvc.perform(get("/orders/1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Not authenticated"));

        mockMvc.perform(get("/config").header(HttpHeaders.AUTHORIZATION, "Bearer wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid authentication credentials"));

        mockMvc.perform(delete("/orders/1"))
                .andExpect(status().isUnauthorized());

        // still there
        mockMvc.perform(get("/orders/1").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1));
    }

    @Test
    @DisplayName("Should create, approve, read back and delete an order")
    void shouldRunOrderLifecycle() throws Exception {
        byte[] bytes = new byte[]{(byte) 0x89, 'P', 'N', 'G'};
        MvcResult created = mockMvc.perform(multipart("/orders")
                        .file(new MockMultipartFile("image", "case.png", "image/png", bytes))
                        .param("name", "Case $999")
                        .param("udid", "u1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(26))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.price").value("999"))
                .andExpect(jsonPath("$.download_link").value(nullValue()))
                .andExpect(jsonPath("$.image_url", startsWith("/images/order_26_")))
                .andExpect(jsonPath("$.image_url", endsWith("_case.png")))
                .andReturn();
        String imageUrl = JsonPath.read(created.getResponse().getContentAsString(), "$.image_url");

        mockMvc.perform(get(imageUrl))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(content().bytes(bytes));

        mockMvc.perform(multipart(HttpMethod.PUT, "/orders/{id}", 26)
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .param("name", "Case $999")
                        .param("udid", "u1")
                        .param("status", "approved")
                        .param("download_link", "http://x/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"));

        mockMvc.perform(get("/orders/{id}", 26).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.download_link").value("http://x/1"))
                .andExpect(jsonPath("$.price").value("999"))
                .andExpect(jsonPath("$.image_url").value(imageUrl));

        mockMvc.perform(delete("/orders/{id}", 26).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/orders/{id}", 26).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Order not found: 26"));

        mockMvc.perform(delete("/orders/{id}", 26).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should reject malformed order requests")
    void shouldRejectBadOrderRequests() throws Exception {
        mockMvc.perform(multipart("/orders")
                        .param("name", "No image")
                        .param("udid", "u1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Missing field: image"));

        mockMvc.perform(multipart("/orders")
                        .file(new MockMultipartFile("image", "a.png", "image/png", new byte[]{1}))
                        .param("name", "x".repeat(101))
                        .param("udid", "u1"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(multipart(HttpMethod.PUT, "/orders/{id}", 1)
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .param("name", "A")
                        .param("udid", "u1")
                        .param("status", "shipped"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/orders/abc").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isBadRequest());

        // nothing was recorded
        mockMvc.perform(get("/orders"))
                .andExpect(jsonPath("$.total").value(25));
    }

    @Test
    @DisplayName("Should serve the placeholder for an unknown image")
    void shouldServePlaceholder() throws Exception {
        mockMvc.perform(get("/images/does-not-exist.jpg"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(content().string("A placeholder image should be here."));
    }

    @Test
    @DisplayName("Should read and update configuration as admin")
    void shouldManageConfig() throws Exception {
        mockMvc.perform(get("/config").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.public_image_url", startsWith("https://via.placeholder.com/")))
                .andExpect(jsonPath("$.esign_image_5").value(""));

        mockMvc.perform(put("/config/public")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"public_image_url\":\"http://cdn/p.png\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Public image URL updated"))
                .andExpect(jsonPath("$.public_image_url").value("http://cdn/p.png"));

        mockMvc.perform(put("/config/public")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Missing public_image_url field"));

        mockMvc.perform(put("/config/esign/{index}", 6)
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"http://cdn/e.png\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Esign index must be between 1 and 5"));

        mockMvc.perform(put("/config/esign/{index}", 2)
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"http://cdn/e.png\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.esign_image_2").value("http://cdn/e.png"));

        mockMvc.perform(get("/config").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(jsonPath("$.public_image_url").value("http://cdn/p.png"))
                .andExpect(jsonPath("$.esign_image_2").value("http://cdn/e.png"));
    }
}
