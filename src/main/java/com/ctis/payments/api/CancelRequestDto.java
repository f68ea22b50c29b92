package com.ctis.payments.api;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CancelRequestDto {

    @Size(max = 500)
    private String reason;
}
