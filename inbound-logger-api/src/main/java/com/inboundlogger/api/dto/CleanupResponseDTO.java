package com.inboundlogger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResponseDTO {

    private Integer olderThanDays;
    private Integer deleted;
}
