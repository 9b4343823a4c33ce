package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.TripStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of trip settings. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
public class UpdateTripRequest {

    @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
    private String title;

    private String description;
    private String destination;
    private LocalDate startDate;
    private LocalDate endDate;

    @DecimalMin(value = "0", message = "Budget cannot be negative")
    private BigDecimal totalBudget;

    private String currency;
    private TripStatus status;
    private Boolean isPublic;

    public boolean hasUpdates() {
        return title != null || description != null || destination != null
            || startDate != null || endDate != null || totalBudget != null
            || currency != null || status != null || isPublic != null;
    }
}
