package com.fooddash.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignDriverRequest {

    @NotNull(message = "Driver id is required")
    private UUID driverId;
}
