package com.rental.marketplace.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkReviewResultDTO implements Serializable {
    private int successful;
    private int failed;
}
