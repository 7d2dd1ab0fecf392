package com.carehub.billing.controller;

import com.carehub.billing.dto.CreateOrderRequest;
import com.carehub.billing.dto.OrderItemRequest;
import com.carehub.billing.dto.OrderResponse;
import com.carehub.billing.dto.OrderView;
import com.carehub.billing.dto.UpdateOrderRequest;
import com.carehub.billing.entity.OrderItemType;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentMethod;
import com.carehub.billing.exception.GlobalExceptionHandler;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.OwnershipMismatchException;
import com.carehub.billing.exception.ResourceNotFoundException;
import com.carehub.billing.service.OrderService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    @Mock
    private OrderService orderService;

    private MockMvc mockMvc;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /orders returns 201 with the order fields at top level")
    void createReturnsCreated() throws Exception {
        when(orderService.createOrder(any())).thenReturn(OrderResponse.builder()
                .order(OrderView.builder()
                        .id(1L)
                        .orderCode("DH1703123456789123")
                        .totalAmount(new BigDecimal("200000"))
                        .orderStatus(OrderStatus.PENDING)
                        .build())
                .paymentUrl("https://qr.sepay.vn/img?des=DH56789123")
                .build());

        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderCode").value("DH1703123456789123"))
                .andExpect(jsonPath("$.totalAmount").value(200000))
                .andExpect(jsonPath("$.paymentUrl").value("https://qr.sepay.vn/img?des=DH56789123"))
                .andExpect(jsonPath("$.warnings").doesNotExist());
    }

    @Test
    @DisplayName("POST /orders without items is a 400 and never reaches the service")
    void createValidatesBody() throws Exception {
        CreateOrderRequest request = validRequest();
        request.setItems(List.of());

        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("items")));

        verify(orderService, never()).createOrder(any());
    }

    @Test
    @DisplayName("Unknown user maps to 404")
    void unknownUserIsNotFound() throws Exception {
        when(orderService.createOrder(any())).thenThrow(new ResourceNotFoundException("User", 42L));

        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("User 42 not found"));
    }

    @Test
    @DisplayName("Foreign appointment maps to 403")
    void foreignAppointmentIsForbidden() throws Exception {
        when(orderService.createOrder(any())).thenThrow(new OwnershipMismatchException("Appointment", 5L, 42L));

        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("Updating a paid order maps to 400")
    void updatePaidOrderIsBadRequest() throws Exception {
        when(orderService.updateOrder(eq(1L), any(UpdateOrderRequest.class)))
                .thenThrow(new InvalidRequestException("Cannot update paid order DH1703123456789123"));

        mockMvc.perform(put("/orders/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\":\"late\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot update paid order DH1703123456789123"));
    }

    @Test
    @DisplayName("Non-numeric id is a 400")
    void badIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/orders/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unexpected failures do not leak details")
    void unexpectedFailureIsGeneric() throws Exception {
        when(orderService.getOrderByOrderCode("DH1")).thenThrow(new IllegalStateException("connection pool exhausted"));

        mockMvc.perform(get("/orders/code/DH1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    private CreateOrderRequest validRequest() {
        return CreateOrderRequest.builder()
                .userId(42L)
                .items(List.of(OrderItemRequest.builder()
                        .type(OrderItemType.APPOINTMENT_FEE)
                        .referenceId(3L)
                        .name("Initial consultation")
                        .quantity(1)
                        .unitPrice(new BigDecimal("200000"))
                        .build()))
                .method(PaymentMethod.BANK_TRANSFER)
                .build();
    }
}
