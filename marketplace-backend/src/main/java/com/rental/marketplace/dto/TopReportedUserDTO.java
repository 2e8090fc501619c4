package com.rental.marketplace.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopReportedUserDTO implements Serializable {
    private Long userId;
    private String name;
    private String email;
    private Long reportCount;
}
