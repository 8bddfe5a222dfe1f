package com.mugpunters.backend.service.market;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceQuote {
    private String symbol;
    private double price;
    private LocalDateTime timestamp;
}
