package com.flagship.drink_ledger.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.drink_ledger.authz.AuthorizationPolicy;
import com.flagship.drink_ledger.config.LedgerProperties;
import com.flagship.drink_ledger.observability.CorrelationContext;
import com.flagship.drink_ledger.observability.LedgerMetrics;
import com.flagship.drink_ledger.store.InMemoryLedgerStore;
import com.flagship.drink_ledger.transaction.KeyedLocks;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.transaction.UserKeyGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.Clock;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP tests for the ledger API.
 *
 * These tests verify:
 * - Identity headers become principals, missing identity is 401 or a login redirect
 * - Group checks map to 403
 * - Ledger failures map to their status codes
 * - Money crosses the boundary as decimal currency
 */
@WebMvcTest(properties = {
    "ledger.drink-price-cents=150",
    "ledger.postpaid.activated-on-create=true"
})
@Import(LedgerControllerTest.LedgerTestConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class LedgerControllerTest {

    private static final String USER_HEADER = "X-Forwarded-User";
    private static final String GROUPS_HEADER = "X-Forwarded-Groups";

    @TestConfiguration
    static class LedgerTestConfig {

        @Bean
        InMemoryLedgerStore ledgerStore() {
            return new InMemoryLedgerStore().withDrinkTypes(List.of("Sonstiges", "Club Mate"));
        }

        @Bean
        LedgerTransactionService ledgerTransactionService(InMemoryLedgerStore store, LedgerProperties properties) {
            return new LedgerTransactionService(
                store,
                new AuthorizationPolicy(properties.getGroups().getMember(), properties.getGroups().getAdmin()),
                new KeyedLocks(),
                new UserKeyGenerator(properties.getUserKeyBytes()),
                new LedgerMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC(),
                properties.getPostpaid().isActivatedOnCreate()
            );
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryLedgerStore store;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String user, String groups) {
        return request.header(USER_HEADER, user).header(GROUPS_HEADER, groups);
    }

    private MockHttpServletRequestBuilder asAlice(MockHttpServletRequestBuilder request) {
        return as(request, "alice", "drinks-members");
    }

    private MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return as(request, "admin", "drinks-members, drinks-admins");
    }

    private MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, String body) {
        return request.contentType(MediaType.APPLICATION_JSON).content(body);
    }

    private void visitHome(MockHttpServletRequestBuilder request) throws Exception {
        mockMvc.perform(request).andExpect(status().isOk());
    }

    private String createPrepaidUser(String username, String startMoney) throws Exception {
        MvcResult result = mockMvc.perform(asAlice(json(post("/add_prepaid_user"),
                "{\"username\":\"" + username + "\",\"start_money\":" + startMoney + "}")))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("user_key").asText();
    }

    @Test
    @DisplayName("Anonymous stats request is rejected with 401")
    void anonymousStatsUnauthorized() throws Exception {
        mockMvc.perform(get("/stats").accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    @DisplayName("Anonymous browser request is redirected to the login page")
    void anonymousBrowserRedirected() throws Exception {
        mockMvc.perform(get("/stats").accept(MediaType.TEXT_HTML))
            .andExpect(status().isSeeOther())
            .andExpect(header().string("Location", "/login"));
    }

    @Test
    @DisplayName("Stats need the admin group")
    void statsNeedAdmin() throws Exception {
        mockMvc.perform(asAlice(get("/stats")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Forbidden"));

        mockMvc.perform(asAdmin(get("/stats")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.drink_stats.length()").value(2))
            .andExpect(jsonPath("$.postpaid_users").isArray());
    }

    @Test
    @DisplayName("Home page creates the account on first visit")
    void homeCreatesAccount() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.authenticated").value(false))
            .andExpect(jsonPath("$.login_url").value("/login"));

        mockMvc.perform(asAlice(get("/")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.authenticated").value(true))
            .andExpect(jsonPath("$.account.username").value("alice"))
            .andExpect(jsonPath("$.account.money").value(0.0))
            .andExpect(jsonPath("$.drink_types.length()").value(2));

        assertTrue(store.findPostpaid("alice").isPresent());
    }

    @Test
    @DisplayName("Drink, payup and balances end to end")
    void drinkAndPayUp() throws Exception {
        printTestHeader("Drink and payup over HTTP");

        visitHome(asAlice(get("/")));
        visitHome(asAdmin(get("/")));

        mockMvc.perform(asAlice(json(post("/drink"), "{\"drink_type_id\":2}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user_type").value("POSTPAID"))
            .andExpect(jsonPath("$.money").value(-1.5));

        mockMvc.perform(asAdmin(json(post("/set_money_postpaid"), "{\"username\":\"admin\",\"money\":10.00}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.money").value(10.0));

        MvcResult result = mockMvc.perform(asAdmin(json(post("/payup"), "{\"username\":\"alice\",\"money\":\"5.00\"}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.payer.money").value(5.0))
            .andExpect(jsonPath("$.receiver.money").value(3.5))
            .andReturn();
        printOutput("Payup response", result.getResponse().getContentAsString());

        assertEquals(500, store.getPostpaid("admin").getMoney());
        assertEquals(350, store.getPostpaid("alice").getMoney());
        assertEquals(1, store.findDrinkType(2).orElseThrow().getConsumed());
    }

    @Test
    @DisplayName("Point of sale drink by user key needs no login")
    void drinkByKey() throws Exception {
        visitHome(asAlice(get("/")));
        String userKey = createPrepaidUser("guest1", "5.00");

        mockMvc.perform(json(post("/drink"), "{\"user_key\":\"" + userKey + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user_type").value("PREPAID"))
            .andExpect(jsonPath("$.username").value("guest1"))
            .andExpect(jsonPath("$.money").value(3.5));

        mockMvc.perform(json(post("/drink"), "{\"user_key\":\"no-such-key\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Self drink without login is unauthorized")
    void anonymousSelfDrink() throws Exception {
        mockMvc.perform(post("/drink"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Deactivated users get 403 Inactive")
    void inactiveUser() throws Exception {
        visitHome(asAlice(get("/")));

        mockMvc.perform(asAdmin(json(post("/toggle_activated_user_postpaid"), "{\"username\":\"alice\"}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.activated").value(false));

        mockMvc.perform(asAlice(post("/drink")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Inactive"));
        assertEquals(0, store.getPostpaid("alice").getMoney());
    }

    @Test
    @DisplayName("Prepaid users: creation, ownership and conflicts")
    void prepaidUsers() throws Exception {
        visitHome(asAlice(get("/")));
        visitHome(as(get("/"), "bob", "drinks-members"));
        createPrepaidUser("guest1", "2.00");

        mockMvc.perform(asAlice(json(post("/add_prepaid_user"), "{\"username\":\"guest1\",\"start_money\":0}")))
            .andExpect(status().isConflict());

        mockMvc.perform(as(json(post("/add_prepaid_user"), "{\"username\":\"guest2\",\"start_money\":0}"), "carol", ""))
            .andExpect(status().isForbidden());

        mockMvc.perform(as(json(post("/add_money_prepaid_user"), "{\"username\":\"guest1\",\"money\":1}"),
                "bob", "drinks-members"))
            .andExpect(status().isForbidden());

        mockMvc.perform(asAlice(json(post("/add_money_prepaid_user"), "{\"username\":\"guest1\",\"money\":1.005}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.money").value(3.01));

        mockMvc.perform(asAlice(get("/prepaid_users")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].username").value("guest1"));
    }

    @Test
    @DisplayName("Invalid request bodies are rejected with 400")
    void validation() throws Exception {
        visitHome(asAlice(get("/")));

        mockMvc.perform(asAlice(json(post("/add_prepaid_user"), "{\"start_money\":1}")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.username").exists());

        mockMvc.perform(asAlice(json(post("/add_prepaid_user"), "{\"username\":")))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Deleting a prepaid user retires its key")
    void deletePrepaidUser() throws Exception {
        visitHome(asAlice(get("/")));
        String userKey = createPrepaidUser("guest1", "1.00");

        mockMvc.perform(asAlice(json(post("/del_prepaid_user"), "{\"username\":\"guest1\"}")))
            .andExpect(status().isForbidden());

        mockMvc.perform(asAdmin(json(post("/del_prepaid_user"), "{\"username\":\"guest1\"}")))
            .andExpect(status().isNoContent());

        mockMvc.perform(json(post("/drink"), "{\"user_key\":\"" + userKey + "\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Drink types are managed by admins")
    void drinkTypes() throws Exception {
        mockMvc.perform(asAdmin(json(post("/drink_types"), "{\"name\":\"Fritz Kola\",\"icon\":\"fritz.png\",\"quantity\":24}")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(3));

        mockMvc.perform(asAdmin(json(post("/drink_types/3/quantity"), "{\"quantity\":12}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.quantity").value(12));

        mockMvc.perform(asAlice(json(post("/drink_types/3/quantity"), "{\"quantity\":0}")))
            .andExpect(status().isForbidden());

        mockMvc.perform(asAlice(get("/drink_types")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    @DisplayName("Health endpoint and correlation id")
    void healthAndCorrelationId() throws Exception {
        mockMvc.perform(get("/health").header(CorrelationContext.CORRELATION_ID_HEADER, "test-123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "test-123"));
    }

    @Test
    @DisplayName("Unknown path is 404, not a server error")
    void unknownPathNotFound() throws Exception {
        printTestHeader("Unknown path");

        MvcResult result = mockMvc.perform(asAlice(get("/no_such_page")).accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"))
            .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Wrong HTTP method is 405 with an Allow header")
    void wrongMethodNotAllowed() throws Exception {
        mockMvc.perform(asAdmin(get("/payup")).accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(header().string("Allow", containsString("POST")))
            .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }

    @Test
    @DisplayName("Non-numeric path id is 400")
    void nonNumericPathIdBadRequest() throws Exception {
        mockMvc.perform(asAdmin(json(post("/drink_types/abc/quantity"), "{\"quantity\":1}")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));
    }

    @Test
    @DisplayName("Unsupported content type is 415")
    void unsupportedContentType() throws Exception {
        mockMvc.perform(asAdmin(post("/payup"))
                .contentType(MediaType.TEXT_PLAIN)
                .content("username=alice&amount=1")
                .accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isUnsupportedMediaType())
            .andExpect(jsonPath("$.error").value("Unsupported Media Type"));
    }
}
