package com.carehub.billing.dto;

import com.carehub.billing.entity.OrderItemType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemRequest {

    @NotNull
    private OrderItemType type;

    private Long referenceId;

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull
    @Min(value = 1, message = "Quantity must be at least 1")
    private Integer quantity;

    @NotNull
    @DecimalMin(value = "0", message = "Unit price must be non-negative")
    @Digits(integer = 17, fraction = 2)
    private BigDecimal unitPrice;
}
