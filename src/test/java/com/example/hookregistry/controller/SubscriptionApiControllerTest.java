package com.example.hookregistry.controller;

import com.example.hookregistry.dto.SubscriptionDetailResponse;
import com.example.hookregistry.dto.UpdateSubscriptionRequest;
import com.example.hookregistry.exception.SubscriptionConflictException;
import com.example.hookregistry.exception.SubscriptionNotFoundException;
import com.example.hookregistry.model.SubscriptionConfig;
import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.SubscriptionRelayConfig;
import com.example.hookregistry.model.WebhookSubscription;
import com.example.hookregistry.service.DeliveryHistoryService;
import com.example.hookregistry.service.SubscriptionSearchService;
import com.example.hookregistry.service.SubscriptionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubscriptionApiController.class)
class SubscriptionApiControllerTest {

    private static final String CREATE_BODY = """
            {
              "name": "orders",
              "events": ["order.created", "order.paid"],
              "config": {"url": "https://a.test/hook", "secret": "s3cret", "contentType": "application/json"}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubscriptionService subscriptionService;

    @MockBean
    private SubscriptionSearchService searchService;

    @MockBean
    private DeliveryHistoryService deliveryHistoryService;

    private static WebhookSubscription subscription(Long id, String event) {
        return WebhookSubscription.builder()
                .id(id)
                .name("orders")
                .eventName(event)
                .createdById("42")
                .active(true)
                .config(SubscriptionConfig.builder().url("https://a.test/hook").build())
                .createdDateUtc(LocalDateTime.of(2026, 3, 1, 10, 15, 30))
                .lastModifiedDateUtc(LocalDateTime.of(2026, 3, 1, 10, 15, 30))
                .build();
    }

    @Test
    void create_shouldReturnCreatedSubscriptions() throws Exception {
        when(subscriptionService.create(eq("42"), eq("orders"), any(SubscriptionConfig.class), anyList()))
                .thenReturn(List.of(subscription(1L, "order.created"), subscription(2L, "order.paid")));

        mockMvc.perform(post("/api/subscriptions")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.subscriptions", hasSize(2)))
                .andExpect(jsonPath("$.subscriptions[0].id").value(1))
                .andExpect(jsonPath("$.subscriptions[0].active").value(true))
                .andExpect(jsonPath("$.subscriptions[1].eventName").value("order.paid"));

        verify(subscriptionService).create(eq("42"), eq("orders"), any(SubscriptionConfig.class),
                eq(List.of("order.created", "order.paid")));
    }

    @Test
    void create_withoutCallerHeader_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(subscriptionService);
    }

    @Test
    void create_withoutEvents_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/subscriptions")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"orders\",\"events\":[],\"config\":{\"url\":\"https://a.test/hook\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(subscriptionService);
    }

    @Test
    void create_withDuplicate_shouldReturnConflict() throws Exception {
        when(subscriptionService.create(anyString(), anyString(), any(), anyList()))
                .thenThrow(new SubscriptionConflictException("order.paid",
                        List.of(subscription(1L, "order.created"))));

        mockMvc.perform(post("/api/subscriptions")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.eventName").value("order.paid"))
                .andExpect(jsonPath("$.createdIds", contains(1)));
    }

    @Test
    void get_whenMissing_shouldReturnNotFound() throws Exception {
        when(subscriptionService.get("42", 9L)).thenThrow(new SubscriptionNotFoundException(9L));

        mockMvc.perform(get("/api/subscriptions/9").header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.path").value("/api/subscriptions/9"));
    }

    @Test
    void get_shouldReturnSubscriptionWithHistory() throws Exception {
        SubscriptionDeliveryResult result = SubscriptionDeliveryResult.builder()
                .recordId(77L)
                .resultId("r1")
                .subscriptionId(5L)
                .statusCode(404)
                .attemptedDateUtc(LocalDateTime.of(2026, 3, 2, 9, 0))
                .build();
        when(subscriptionService.get("42", 5L)).thenReturn(SubscriptionDetailResponse.builder()
                .subscription(subscription(5L, "order.created"))
                .history(List.of(result))
                .build());

        mockMvc.perform(get("/api/subscriptions/5").header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscription.id").value(5))
                .andExpect(jsonPath("$.history[0].id").value("r1"))
                .andExpect(jsonPath("$.history[0].recordId").doesNotExist())
                .andExpect(jsonPath("$.history[0].statusCode").value(404));
    }

    @Test
    void list_shouldReturnCallerSubscriptions() throws Exception {
        when(subscriptionService.list("42")).thenReturn(List.of());

        mockMvc.perform(get("/api/subscriptions").header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptions", hasSize(0)));
    }

    @Test
    void search_shouldReturnSubscribers() throws Exception {
        when(searchService.searchByEvent("42", "order.created")).thenReturn(List.of(
                SubscriptionRelayConfig.from(subscription(1L, "order.created"))));

        mockMvc.perform(get("/api/subscriptions/search")
                        .param("eventName", "order.created")
                        .header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscribers[0].subscriptionId").value(1))
                .andExpect(jsonPath("$.subscribers[0].config.url").value("https://a.test/hook"));
    }

    @Test
    void update_shouldPassPartialFields() throws Exception {
        when(subscriptionService.update(eq("42"), eq(5L), any(UpdateSubscriptionRequest.class)))
                .thenReturn(subscription(5L, "order.created"));

        mockMvc.perform(put("/api/subscriptions/5")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5));

        ArgumentCaptor<UpdateSubscriptionRequest> captor = ArgumentCaptor.forClass(UpdateSubscriptionRequest.class);
        verify(subscriptionService).update(eq("42"), eq(5L), captor.capture());
        assertEquals(Boolean.TRUE, captor.getValue().getActive());
        assertEquals(null, captor.getValue().getUrl());
    }

    @Test
    void delete_shouldReturnNoContent() throws Exception {
        mockMvc.perform(delete("/api/subscriptions/5").header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isNoContent());

        verify(subscriptionService).delete("42", 5L);
    }

    @Test
    void updateHistory_withEmptyResults_shouldSucceed() throws Exception {
        mockMvc.perform(put("/api/subscriptions/history")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"results\":[]}"))
                .andExpect(status().isNoContent());

        verify(deliveryHistoryService).updateHistory("42", List.of());
    }

    @Test
    void updateHistory_shouldMapResults() throws Exception {
        mockMvc.perform(put("/api/subscriptions/history")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"results\":[{\"id\":\"r1\",\"subscriptionId\":5,\"statusCode\":404,"
                                + "\"attemptedDateUtc\":\"2026-03-02T09:00:00\"}]}"))
                .andExpect(status().isNoContent());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<SubscriptionDeliveryResult>> captor = ArgumentCaptor.forClass(List.class);
        verify(deliveryHistoryService).updateHistory(eq("42"), captor.capture());
        SubscriptionDeliveryResult mapped = captor.getValue().get(0);
        assertEquals("r1", mapped.getResultId());
        assertEquals(5L, mapped.getSubscriptionId());
        assertEquals(404, mapped.getStatusCode());
    }

    @Test
    void updateHistory_withIncompleteResult_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(put("/api/subscriptions/history")
                        .header(SubscriptionApiController.CALLER_HEADER, "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"results\":[{\"id\":\"r1\",\"statusCode\":404}]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(deliveryHistoryService);
    }

    @Test
    void storeFailure_shouldReturnInternalServerError() throws Exception {
        when(subscriptionService.list("42")).thenThrow(new IllegalStateException("database unavailable"));

        mockMvc.perform(get("/api/subscriptions").header(SubscriptionApiController.CALLER_HEADER, "42"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(
                        "An unexpected error occurred. Please contact administrator."));
    }
}
