package com.planverify.api.integration;

import com.planverify.core.domain.InsurancePlan;
import com.planverify.core.domain.Provider;
import com.planverify.core.repository.InsurancePlanRepository;
import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.ProviderRepository;
import com.planverify.core.repository.VerificationLogRepository;
import com.planverify.core.repository.VoteLogRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the verification endpoints over MockMvc.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class VerificationApiIntegrationTest {

    private static final String NPI = "1234567890";
    private static final String PLAN = "BCBS-PPO-2025";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ProviderRepository providerRepository;

    @Autowired
    private InsurancePlanRepository planRepository;

    @Autowired
    private ProviderPlanAcceptanceRepository acceptanceRepository;

    @Autowired
    private VerificationLogRepository verificationLogRepository;

    @Autowired
    private VoteLogRepository voteLogRepository;

    @BeforeEach
    void setUp() {
        voteLogRepository.deleteAll();
        verificationLogRepository.deleteAll();
        acceptanceRepository.deleteAll();
        providerRepository.deleteAll();
        planRepository.deleteAll();

        providerRepository.save(Provider.individual(NPI, "Ana", "Ruiz", "Cardiology", null));
        planRepository.save(InsurancePlan.create(PLAN, "Blue PPO", "Blue Cross"));
    }

    @Test
    void submitReturnsCreatedWithoutSubmitterDetails() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/verify")
                        .with(from("203.0.113.7"))
                        .header("User-Agent", "IntegrationTest/1.0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submitBody(true, "patient@example.com")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.acceptance.acceptanceStatus").value("PENDING"))
                .andExpect(jsonPath("$.acceptance.verificationCount").value(1))
                .andExpect(jsonPath("$.verification.verificationType").value("PLAN_ACCEPTANCE"))
                .andExpect(jsonPath("$.verification.newValue.acceptanceStatus").value("ACCEPTED"))
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body)
                .doesNotContain("203.0.113.7")
                .doesNotContain("patient@example.com")
                .doesNotContain("IntegrationTest/1.0")
                .doesNotContain("sourceIp")
                .doesNotContain("submittedBy");

        assertThat(verificationLogRepository.findAll().get(0).getSourceIp()).isEqualTo("203.0.113.7");
    }

    @Test
    void duplicateSubmissionIsConflict() throws Exception {
        submit("203.0.113.7", true);

        mockMvc.perform(post("/api/v1/verify")
                        .with(from("203.0.113.7"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submitBody(false, null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERIFY_004"));
    }

    @Test
    void forwardedHeaderDoesNotChangeClientIdentity() throws Exception {
        mockMvc.perform(post("/api/v1/verify")
                        .with(from("198.51.100.1"))
                        .header("X-Forwarded-For", "6.6.6.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submitBody(true, null)))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/verify")
                        .with(from("198.51.100.1"))
                        .header("X-Forwarded-For", "6.6.6.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submitBody(false, null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERIFY_004"));

        assertThat(verificationLogRepository.count()).isEqualTo(1);
        assertThat(verificationLogRepository.findAll().get(0).getSourceIp()).isEqualTo("198.51.100.1");

        String verificationId = submit("203.0.113.9", true);

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .with(from("198.51.100.1"))
                        .header("X-Forwarded-For", "7.7.7.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upvotes").value(1));

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .with(from("198.51.100.1"))
                        .header("X-Forwarded-For", "7.7.7.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERIFY_005"));

        assertThat(verificationLogRepository.findById(UUID.fromString(verificationId)).orElseThrow().getUpvotes())
                .isEqualTo(1);
    }

    @Test
    void unknownProviderIsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"npi\":\"9999999999\",\"planId\":\"" + PLAN + "\",\"acceptsInsurance\":true}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VERIFY_001"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"npi\":\"12345\",\"planId\":\"" + PLAN + "\",\"acceptsInsurance\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VERIFY_008"));

        mockMvc.perform(post("/api/v1/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"npi\":\"" + NPI + "\",\"planId\":\"" + PLAN + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void voteFlowAndErrors() throws Exception {
        String verificationId = submit("203.0.113.7", true);

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .with(from("198.51.100.1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upvotes").value(1))
                .andExpect(jsonPath("$.netVotes").value(1))
                .andExpect(jsonPath("$.voteChanged").value(false));

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .with(from("198.51.100.1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERIFY_005"));

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .with(from("198.51.100.1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"down\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upvotes").value(0))
                .andExpect(jsonPath("$.downvotes").value(1))
                .andExpect(jsonPath("$.voteChanged").value(true));

        mockMvc.perform(post("/api/v1/verify/" + verificationId + "/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"sideways\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VERIFY_007"));

        mockMvc.perform(post("/api/v1/verify/00000000-0000-0000-0000-000000000000/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VERIFY_003"));

        mockMvc.perform(post("/api/v1/verify/not-a-uuid/vote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote\":\"up\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pairAggregateAndListings() throws Exception {
        submit("203.0.113.1", true);
        submit("203.0.113.2", true);
        submit("203.0.113.3", true);

        mockMvc.perform(get("/api/v1/verify/" + NPI + "/" + PLAN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acceptance.acceptanceStatus").value("ACCEPTED"))
                .andExpect(jsonPath("$.acceptance.confidenceScore").value(79))
                .andExpect(jsonPath("$.acceptance.confidenceLevel").value("HIGH"))
                .andExpect(jsonPath("$.verifications", hasSize(3)))
                .andExpect(jsonPath("$.summary.totalVerifications").value(3));

        mockMvc.perform(get("/api/v1/verify/" + NPI + "/UNKNOWN-PLAN"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VERIFY_002"));

        mockMvc.perform(get("/api/v1/verify/recent").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.verifications", hasSize(2)));

        mockMvc.perform(get("/api/v1/verify/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.byType.PLAN_ACCEPTANCE").value(3));
    }

    @Test
    void healthIsOpenAndUnthrottled() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(header().doesNotExist("X-Rate-Limit-Remaining"));
    }

    private String submit(String sourceIp, boolean accepts) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/verify")
                        .with(from(sourceIp))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submitBody(accepts, null)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.path("verification").path("id").asText();
    }

    private static RequestPostProcessor from(String remoteAddr) {
        return request -> {
            request.setRemoteAddr(remoteAddr);
            return request;
        };
    }

    private String submitBody(boolean accepts, String submittedBy) {
        return "{\"npi\":\"" + NPI + "\",\"planId\":\"" + PLAN + "\",\"acceptsInsurance\":" + accepts
                + (submittedBy != null ? ",\"submittedBy\":\"" + submittedBy + "\"" : "")
                + ",\"acceptsNewPatients\":true}";
    }
}
