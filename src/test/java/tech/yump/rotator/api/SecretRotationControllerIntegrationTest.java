package tech.yump.rotator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.rotator.api.dto.SecretRotationProperties;
import tech.yump.rotator.api.dto.SecretToRotate;
import tech.yump.rotator.auth.StaticTokenAuthFilter;
import tech.yump.rotator.directory.Credential;
import tech.yump.rotator.directory.memory.InMemoryCredentialDirectory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test") // Use application-test.yml
class SecretRotationControllerIntegrationTest {

    private static final String TEST_TOKEN = "test-rotator-token";
    private static final String PREVIEW_URL = "/v1/rotation/entra-id/preview";
    private static final String APPLY_URL = "/v1/rotation/entra-id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryCredentialDirectory directory;

    // Rotators are cached per tenant for the whole context, so each test gets its own tenant.
    private String tenantId;
    private String appId;
    private UUID expiringKey;
    private UUID freshKey;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID().toString();
        appId = directory.registerApplication(tenantId, "billing-api");
        directory.registerApplication(tenantId, "no-secrets");
        expiringKey = UUID.randomUUID();
        freshKey = UUID.randomUUID();
        Instant now = Instant.now();
        directory.addCredential(tenantId, appId,
                Credential.existing("ci-deploy", expiringKey, now.minus(Duration.ofDays(170)), now.plus(Duration.ofDays(10))));
        directory.addCredential(tenantId, appId,
                Credential.existing("runtime", freshKey, now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(179))));
    }

    private String body(List<SecretToRotate> secrets, boolean deleteAfterRenew) throws Exception {
        return objectMapper.writeValueAsString(new SecretRotationProperties(tenantId, 30, 180, secrets, deleteAfterRenew, null));
    }

    @Test
    @DisplayName("GET / should be reachable without a token")
    void root_isPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("OK")));
    }

    @Test
    @DisplayName("Preview without a token should be forbidden")
    void preview_withoutToken_isForbidden() throws Exception {
        mockMvc.perform(post(PREVIEW_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(List.of(), false)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Preview with an unknown token should be forbidden")
    void preview_withInvalidToken_isForbidden() throws Exception {
        mockMvc.perform(post(PREVIEW_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, "not-a-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(List.of(), false)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Preview should report current secrets and change nothing")
    void preview_reportsWithoutWriting() throws Exception {
        mockMvc.perform(post(PREVIEW_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(List.of(new SecretToRotate("billing-api", "ci-deploy")), true)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type", is("SecretRotationEntraId")))
                .andExpect(jsonPath("$.identifiers.id", is(tenantId)))
                .andExpect(jsonPath("$.properties.rotateSecretsExpiringWithinDays", is(30)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets", hasSize(2)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].appRegistrationName", is("billing-api")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].secretName", is("ci-deploy")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].isExpiringSoon", is(true)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].isRenewed", is(false)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].secretValue", is("No Secret Changed")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[1].isExpiringSoon", is(false)));

        assertThat(directory.applications(tenantId).get(0).credentials())
                .extracting(Credential::keyId)
                .containsExactly(expiringKey, freshKey);
    }

    @Test
    @DisplayName("Preview should omit the report when no application has secrets")
    void preview_emptyTenant_omitsReport() throws Exception {
        String emptyTenant = UUID.randomUUID().toString();
        directory.registerApplication(emptyTenant, "lonely-app");

        mockMvc.perform(post(PREVIEW_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("id", emptyTenant))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identifiers.id", is(emptyTenant)))
                .andExpect(jsonPath("$.properties.expiresInDays", is(180)))
                .andExpect(jsonPath("$.properties.deleteAfterRenew", is(false)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets").doesNotExist());
    }

    @Test
    @DisplayName("CreateOrUpdate should rotate, create and delete, then be a no-op on repeat")
    void createOrUpdate_rotatesCreatesAndIsIdempotent() throws Exception {
        String request = body(List.of(
                new SecretToRotate("billing-api", "ci-deploy"),
                new SecretToRotate("billing-api", "new-secret"),
                new SecretToRotate("missing-app", "whatever")), true);

        mockMvc.perform(put(APPLY_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets", hasSize(3)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].secretName", is("ci-deploy")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].isRenewed", is(true)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[0].secretValue", not(is("No Secret Changed"))))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[1].secretName", is("runtime")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[1].isRenewed", is(false)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[1].secretValue", is("No Secret Changed")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[2].secretName", is("new-secret")))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[2].isRenewed", is(true)));

        List<Credential> afterFirst = directory.applications(tenantId).get(0).credentials();
        assertThat(afterFirst).extracting(Credential::keyId).doesNotContain(expiringKey).contains(freshKey);
        assertThat(afterFirst).extracting(Credential::displayName)
                .containsExactlyInAnyOrder("ci-deploy", "runtime", "new-secret");

        mockMvc.perform(put(APPLY_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets", hasSize(3)))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[*].isRenewed", everyItem(is(false))))
                .andExpect(jsonPath("$.properties.appsWithExpiringSecrets[*].secretValue", everyItem(is("No Secret Changed"))));

        assertThat(directory.applications(tenantId).get(0).credentials()).isEqualTo(afterFirst);
    }

    @Test
    @DisplayName("CreateOrUpdate should reject a missing tenant id")
    void createOrUpdate_missingId_isBadRequest() throws Exception {
        mockMvc.perform(put(APPLY_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secretsToRotate\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.title", is("Invalid Resource Properties")))
                .andExpect(jsonPath("$.detail", containsString("id")));
    }

    @Test
    @DisplayName("CreateOrUpdate should reject blank secret names and a negative threshold")
    void createOrUpdate_invalidFields_isBadRequest() throws Exception {
        String request = """
                {
                  "id": "%s",
                  "rotateSecretsExpiringWithinDays": -1,
                  "secretsToRotate": [ { "appRegistrationName": "billing-api", "secretName": " " } ]
                }
                """.formatted(tenantId);

        mockMvc.perform(put(APPLY_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("rotateSecretsExpiringWithinDays")))
                .andExpect(jsonPath("$.detail", containsString("secretsToRotate[0].secretName")));

        assertThat(directory.applications(tenantId).get(0).credentials()).hasSize(2);
    }

    @Test
    @DisplayName("Malformed JSON should be a bad request")
    void malformedJson_isBadRequest() throws Exception {
        mockMvc.perform(post(PREVIEW_URL)
                        .header(StaticTokenAuthFilter.TOKEN_HEADER, TEST_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Bad Request")));
    }
}
