package com.myfinancehub.ledger.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myfinancehub.ledger.auth.AuthController;
import com.myfinancehub.ledger.controller.dto.BudgetRequestDto;
import com.myfinancehub.ledger.controller.dto.EmailUpdateRequestDto;
import com.myfinancehub.ledger.controller.dto.ExpenseRequestDto;
import com.myfinancehub.ledger.controller.dto.IncomeRequestDto;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerFlowTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    private String token;

    @BeforeEach
    void setUp() throws Exception {
        token = registerAndLogin("alice-" + UUID.randomUUID());
    }

    @Test
    void expensesBudgetAndSummaryForMay() throws Exception {
        postExpense(token, "Food", "200", LocalDate.of(2024, 5, 1));
        postExpense(token, "Transport", "50", LocalDate.of(2024, 5, 15));
        mockMvc.perform(authorized(post("/incomes"), token)
                        .content(objectMapper.writeValueAsString(
                                new IncomeRequestDto(new BigDecimal("1000"), LocalDate.of(2024, 5, 25), "salary"))))
                .andExpect(status().isCreated());

        mockMvc.perform(authorized(put("/budgets"), token)
                        .content(objectMapper.writeValueAsString(
                                new BudgetRequestDto("Food", 5, 2024, new BigDecimal("150")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("Food"));

        MvcResult progress = mockMvc.perform(authorized(get("/budgets/progress").param("month", "2024-05"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.month").value("2024-05"))
                .andExpect(jsonPath("$.progress.length()").value(1))
                .andExpect(jsonPath("$.progress[0].category").value("Food"))
                .andReturn();
        JsonNode food = json(progress).get("progress").get(0);
        assertThat(food.get("spent").decimalValue()).isEqualByComparingTo("200");
        assertThat(food.get("ratio").decimalValue()).isEqualByComparingTo("1");

        MvcResult summary = mockMvc.perform(authorized(get("/analytics/summary").param("month", "2024-05"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topCategory").value("Food"))
                .andExpect(jsonPath("$.trend.length()").value(6))
                .andReturn();
        JsonNode totals = json(summary).get("totals");
        assertThat(totals.get("income").decimalValue()).isEqualByComparingTo("1000");
        assertThat(totals.get("expense").decimalValue()).isEqualByComparingTo("250");
        assertThat(totals.get("netSavings").decimalValue()).isEqualByComparingTo("750");
    }

    @Test
    void expenseListingCarriesIndexAndTotal() throws Exception {
        postExpense(token, "Food", "12.50", LocalDate.of(2024, 5, 3));
        postExpense(token, "Health", "30", LocalDate.of(2024, 4, 20));

        MvcResult listing = mockMvc.perform(authorized(get("/expenses"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.expenses[0].index").value(1))
                .andExpect(jsonPath("$.expenses[0].category").value("Health"))
                .andExpect(jsonPath("$.expenses[1].index").value(2))
                .andExpect(jsonPath("$.expenses[1].date").value("2024-05-03"))
                .andReturn();
        assertThat(json(listing).get("total").decimalValue()).isEqualByComparingTo("42.50");

        mockMvc.perform(authorized(get("/expenses").param("from", "2024-05-01").param("to", "2024-05-31"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.expenses[0].category").value("Food"));
    }

    @Test
    void expenseListingFiltersByCategoryAndSearchText() throws Exception {
        postExpense(token, "Food", "12.00", LocalDate.of(2024, 5, 3), "Lunch with team");
        postExpense(token, "Food", "8.00", LocalDate.of(2024, 5, 4), "groceries");
        postExpense(token, "Transport", "3.00", LocalDate.of(2024, 5, 5), "bus after lunch");

        MvcResult filtered = mockMvc.perform(authorized(get("/expenses")
                        .param("category", "Food")
                        .param("q", "LUNCH"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.expenses[0].index").value(1))
                .andExpect(jsonPath("$.expenses[0].description").value("Lunch with team"))
                .andReturn();
        assertThat(json(filtered).get("total").decimalValue()).isEqualByComparingTo("12.00");

        mockMvc.perform(authorized(get("/expenses").param("q", "lunch"), token))
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void analyticsAcceptExplicitDateRange() throws Exception {
        postExpense(token, "Food", "40", LocalDate.of(2024, 3, 10), null);
        postExpense(token, "Health", "25", LocalDate.of(2024, 4, 2), null);
        postExpense(token, "Food", "99", LocalDate.of(2024, 6, 1), null);

        mockMvc.perform(authorized(get("/analytics/categories")
                        .param("from", "2024-03-01")
                        .param("to", "2024-04-30"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.from").value("2024-03-01"))
                .andExpect(jsonPath("$.categories.length()").value(2))
                .andExpect(jsonPath("$.categories[0].category").value("Food"))
                .andExpect(jsonPath("$.categories[1].category").value("Health"));

        mockMvc.perform(authorized(get("/analytics/cash-flow")
                        .param("from", "2024-03-01")
                        .param("to", "2024-04-30"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.series.length()").value(2))
                .andExpect(jsonPath("$.series[0].month").value("2024-03"))
                .andExpect(jsonPath("$.series[1].month").value("2024-04"));

        mockMvc.perform(authorized(get("/analytics/cash-flow").param("from", "2024-03-01"), token))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RANGE"));
    }

    @Test
    void categoryMenuListsConfiguredCategories() throws Exception {
        mockMvc.perform(authorized(get("/expenses/categories"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restricted").value(true))
                .andExpect(jsonPath("$.categories[0]").value("Food"))
                .andExpect(jsonPath("$.categories.length()").value(7));
    }

    @Test
    void invalidInputIsRejectedWithCode() throws Exception {
        mockMvc.perform(authorized(post("/expenses"), token)
                        .content(objectMapper.writeValueAsString(
                                new ExpenseRequestDto("Gadgets", new BigDecimal("5"), LocalDate.of(2024, 5, 1), null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_CATEGORY"));

        mockMvc.perform(authorized(post("/expenses"), token)
                        .content(objectMapper.writeValueAsString(
                                new ExpenseRequestDto("Food", new BigDecimal("-1"), LocalDate.of(2024, 5, 1), null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));

        mockMvc.perform(authorized(get("/budgets/progress").param("month", "2024-13"), token))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PERIOD"));
    }

    @Test
    void otherUsersExpensesAreInvisible() throws Exception {
        long id = postExpense(token, "Food", "9.99", LocalDate.of(2024, 5, 2));
        String mallory = registerAndLogin("mallory-" + UUID.randomUUID());

        mockMvc.perform(authorized(delete("/expenses/" + id), mallory))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mockMvc.perform(authorized(get("/expenses"), mallory))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));

        mockMvc.perform(authorized(delete("/expenses/" + id), token))
                .andExpect(status().isNoContent());
        mockMvc.perform(authorized(get("/expenses"), token))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void profileShowsEmailAndRecentLogins() throws Exception {
        mockMvc.perform(authorized(put("/profile/email"), token)
                        .content(objectMapper.writeValueAsString(new EmailUpdateRequestDto("alice@example.com"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("alice@example.com"));

        mockMvc.perform(authorized(put("/profile/email"), token)
                        .content(objectMapper.writeValueAsString(new EmailUpdateRequestDto("not-an-email"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_EMAIL"));

        mockMvc.perform(authorized(get("/profile"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("alice@example.com"))
                .andExpect(jsonPath("$.recentLogins.length()").value(1));
    }

    private long postExpense(String bearer, String category, String amount, LocalDate date) throws Exception {
        return postExpense(bearer, category, amount, date, null);
    }

    private long postExpense(String bearer, String category, String amount, LocalDate date, String description)
            throws Exception {
        MvcResult result = mockMvc.perform(authorized(post("/expenses"), bearer)
                        .content(objectMapper.writeValueAsString(
                                new ExpenseRequestDto(category, new BigDecimal(amount), date, description))))
                .andExpect(status().isCreated())
                .andReturn();
        return json(result).get("id").asLong();
    }

    private String registerAndLogin(String username) throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new AuthController.RegisterRequest(username, "Passw0rd!", null))))
                .andExpect(status().isCreated());
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AuthController.LoginRequest(username, "Passw0rd!"))))
                .andExpect(status().isOk())
                .andReturn();
        return json(result).get("accessToken").asText();
    }

    private MockHttpServletRequestBuilder authorized(MockHttpServletRequestBuilder request, String bearer) {
        return request.header(HttpHeaders.AUTHORIZATION, "Bearer " + bearer)
                .contentType(MediaType.APPLICATION_JSON);
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
